package co.repogen.generators.python;

import co.repogen.core.Names;
import co.repogen.core.model.FieldKind;
import co.repogen.core.model.ParameterKind;
import co.repogen.generators.CodeRenderer;
import co.repogen.generators.LanguageProfile;
import co.repogen.generators.OutputRole;
import co.repogen.generators.SampleValueStrategy;

import java.util.List;

/**
 * Python 3.10 modules against the boto3 DynamoDB Table resource, with dataclass entities.
 */
public final class PythonProfile implements LanguageProfile {
    public static final String ID = "python";

    private static final List<OutputRole> ROLES = List.of(
        new OutputRole(OutputRole.ENTITIES, "entities.py", "Entity dataclasses with key builders"),
        new OutputRole(OutputRole.REPOSITORIES, "repositories.py", "Repositories with CRUD and access pattern methods"),
        new OutputRole(OutputRole.BASE_REPOSITORY, "base_repository.py", "Shared boto3 plumbing"),
        new OutputRole(OutputRole.TRANSACTIONS, "transaction_service.py", "Cross-table transactions"),
        new OutputRole(OutputRole.MAPPING, "access_pattern_mapping.json", "Access pattern registry"),
        new OutputRole(OutputRole.USAGE_EXAMPLES, "usage_examples.py", "Runnable usage examples"));

    private final SampleValueStrategy sampleValues = new SampleValueStrategy();
    private final PythonRenderer renderer = new PythonRenderer();

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String fieldType(FieldKind kind, FieldKind itemKind) {
        return PythonSyntax.type(kind, itemKind);
    }

    @Override
    public String parameterType(ParameterKind kind, String entityType) {
        if (kind == ParameterKind.ENTITY) return className(entityType);
        return PythonSyntax.type(kind.fieldKind().orElseThrow(), null);
    }

    @Override
    public String literal(Object value, FieldKind kind) {
        return PythonSyntax.literal(value, kind);
    }

    @Override
    public String methodName(String snakeName) {
        return safe(Names.toSnakeCase(snakeName));
    }

    @Override
    public String className(String name) {
        return Names.toPascalCase(name);
    }

    @Override
    public String fieldName(String name) {
        return safe(Names.toSnakeCase(name));
    }

    @Override
    public List<OutputRole> outputRoles() {
        return ROLES;
    }

    @Override
    public SampleValueStrategy sampleValues() {
        return sampleValues;
    }

    @Override
    public CodeRenderer renderer() {
        return renderer;
    }

    private static String safe(String identifier) {
        if (identifier.isEmpty()) return "value";
        if (Character.isDigit(identifier.charAt(0))) identifier = "_" + identifier;
        return PythonSyntax.KEYWORDS.contains(identifier) ? identifier + "_" : identifier;
    }
}
