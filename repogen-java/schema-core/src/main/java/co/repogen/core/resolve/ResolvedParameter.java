package co.repogen.core.resolve;

import co.repogen.core.model.FieldKind;
import co.repogen.core.model.ParameterKind;

/**
 * @param kind        declared parameter type
 * @param entityType  entity name for {@link ParameterKind#ENTITY} parameters, otherwise null
 * @param role        how the operation uses the value
 */
public record ResolvedParameter(String name, ParameterKind kind, String entityType, ParameterRole role) {

  /** Value kind for scalar parameters; null for entity parameters. */
  public FieldKind valueKind() {
    return kind.fieldKind().orElse(null);
  }

  public boolean isEntity() {
    return kind == ParameterKind.ENTITY;
  }
}
