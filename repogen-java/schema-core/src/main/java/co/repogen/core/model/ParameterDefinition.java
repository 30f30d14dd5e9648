package co.repogen.core.model;

import java.util.Optional;

/**
 * @param name        unique within the pattern
 * @param type        raw {@code type} value, see {@link ParameterKind}
 * @param entityType  referenced entity name when {@code type} is {@code entity}
 */
public record ParameterDefinition(String name, String type, String entityType) {

  public Optional<ParameterKind> kind() {
    return ParameterKind.of(type);
  }

  public boolean isEntity() {
    return ParameterKind.ENTITY.wire().equals(type);
  }
}
