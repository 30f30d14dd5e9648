package co.repogen.generators.java;

import co.repogen.core.Names;
import co.repogen.core.model.FieldKind;
import co.repogen.core.model.ParameterKind;
import co.repogen.generators.CodeRenderer;
import co.repogen.generators.LanguageProfile;
import co.repogen.generators.OutputRole;
import co.repogen.generators.SampleValueStrategy;

import javax.lang.model.SourceVersion;
import java.util.List;

/**
 * Java 17 code against the AWS SDK v2 low-level {@code DynamoDbClient}: one class per entity,
 * key helper and repository, plus shared client, config and transaction classes.
 */
public final class JavaProfile implements LanguageProfile {
    public static final String ID = "java";

    private static final List<OutputRole> ROLES = List.of(
        new OutputRole(OutputRole.ENTITIES, "{package}/{name}.java", "Entity classes with item conversion"),
        new OutputRole(OutputRole.KEYS, "{package}/keys/{name}Keys.java", "Key attribute names and key builders"),
        new OutputRole(OutputRole.REPOSITORIES, "{package}/repository/{name}Repository.java",
            "Repositories with CRUD and access pattern methods"),
        new OutputRole(OutputRole.CONFIG, "{package}/config/{name}Config.java",
            "Table constants and repository factories"),
        new OutputRole(OutputRole.CLIENT, "{package}/client/{name}.java", "DynamoDB client wrapper"),
        new OutputRole(OutputRole.SUPPORT, "{package}/client/{name}.java", "AttributeValue conversions"),
        new OutputRole(OutputRole.TRANSACTIONS, "{package}/transaction/{name}.java", "Cross-table transactions"),
        new OutputRole(OutputRole.MAPPING, "access_pattern_mapping.json", "Access pattern registry"),
        new OutputRole(OutputRole.USAGE_EXAMPLES, "{package}/examples/{name}.java", "Runnable usage examples"));

    private final SampleValueStrategy sampleValues = new SampleValueStrategy();
    private final JavaRenderer renderer = new JavaRenderer();

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String fieldType(FieldKind kind, FieldKind itemKind) {
        return JavaTypes.field(kind, itemKind).toString();
    }

    @Override
    public String parameterType(ParameterKind kind, String entityType) {
        if (kind == ParameterKind.ENTITY) return className(entityType);
        return JavaTypes.scalar(kind.fieldKind().orElseThrow()).toString();
    }

    /** Literal with fully qualified type references; renderers emit imports instead. */
    @Override
    public String literal(Object value, FieldKind kind) {
        return JavaTypes.literal(value, kind).toString();
    }

    @Override
    public String methodName(String snakeName) {
        return safe(Names.toCamelCase(snakeName));
    }

    @Override
    public String className(String name) {
        return Names.toPascalCase(name);
    }

    @Override
    public String fieldName(String name) {
        return safe(Names.toCamelCase(name));
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
        if (!Character.isJavaIdentifierStart(identifier.charAt(0))) identifier = "_" + identifier;
        return SourceVersion.isKeyword(identifier) ? identifier + "Value" : identifier;
    }
}
