package co.repogen.core.model;

import java.util.Optional;

/**
 * @param name      unique within the entity
 * @param type      raw {@code type} value, see {@link FieldKind}
 * @param required  whether items always carry the attribute
 * @param itemType  element type for {@code array} fields, otherwise null
 */
public record FieldDefinition(String name, String type, boolean required, String itemType) {

  public Optional<FieldKind> kind() {
    return FieldKind.of(type);
  }

  public Optional<FieldKind> itemKind() {
    return FieldKind.of(itemType);
  }
}
