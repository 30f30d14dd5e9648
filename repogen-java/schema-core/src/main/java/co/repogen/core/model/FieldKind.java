package co.repogen.core.model;

import java.util.List;
import java.util.Optional;

/**
 * Closed set of entity field types.
 */
public enum FieldKind implements WireValue {
  STRING("string"),
  INTEGER("integer"),
  DECIMAL("decimal"),
  BOOLEAN("boolean"),
  ARRAY("array"),
  OBJECT("object"),
  UUID("uuid");

  private final String wire;

  FieldKind(String wire) {
    this.wire = wire;
  }

  @Override
  public String wire() {
    return wire;
  }

  public boolean isNumeric() {
    return this == INTEGER || this == DECIMAL;
  }

  public static Optional<FieldKind> of(String value) {
    return WireValue.parse(FieldKind.class, value);
  }

  public static List<String> wireValues() {
    return WireValue.values(FieldKind.class);
  }

  /** Valid {@code item_type} values for array fields. */
  public static List<String> itemWireValues() {
    return wireValues().stream().filter(v -> !v.equals(ARRAY.wire)).toList();
  }
}
