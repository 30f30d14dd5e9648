package co.repogen.generators;

import co.repogen.core.model.FieldKind;
import co.repogen.core.model.ParameterKind;

import java.util.List;
import java.util.Optional;

/**
 * Everything language specific about generated code: type names, naming conventions,
 * literal syntax, the artifacts produced and the renderer producing them.
 */
public interface LanguageProfile {

    /** Registry key, e.g. {@code java}. */
    String id();

    /**
     * Target type of an entity field.
     *
     * @param itemKind element kind for {@link FieldKind#ARRAY}, otherwise ignored (may be null)
     */
    String fieldType(FieldKind kind, FieldKind itemKind);

    /**
     * Target type of a pattern parameter.
     *
     * @param entityType entity name for {@link ParameterKind#ENTITY}, otherwise ignored
     */
    String parameterType(ParameterKind kind, String entityType);

    /** Source literal for a sample value of the given kind. */
    String literal(Object value, FieldKind kind);

    String methodName(String snakeName);

    String className(String name);

    String fieldName(String name);

    List<OutputRole> outputRoles();

    default Optional<OutputRole> role(String category) {
        return outputRoles().stream().filter(r -> r.category().equals(category)).findFirst();
    }

    /**
     * @throws IllegalStateException if the profile declares no such role
     */
    default OutputRole requireRole(String category) {
        return role(category).orElseThrow(
            () -> new IllegalStateException("profile '" + id() + "' has no output role '" + category + "'"));
    }

    SampleValueStrategy sampleValues();

    CodeRenderer renderer();
}
