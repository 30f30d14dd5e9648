package co.repogen.core.model;

import java.util.List;
import java.util.Optional;

/**
 * Closed set of access pattern parameter types: every field kind plus whole entities.
 */
public enum ParameterKind implements WireValue {
  STRING("string", FieldKind.STRING),
  INTEGER("integer", FieldKind.INTEGER),
  DECIMAL("decimal", FieldKind.DECIMAL),
  BOOLEAN("boolean", FieldKind.BOOLEAN),
  ARRAY("array", FieldKind.ARRAY),
  OBJECT("object", FieldKind.OBJECT),
  UUID("uuid", FieldKind.UUID),
  ENTITY("entity", null);

  private final String wire;
  private final FieldKind fieldKind;

  ParameterKind(String wire, FieldKind fieldKind) {
    this.wire = wire;
    this.fieldKind = fieldKind;
  }

  @Override
  public String wire() {
    return wire;
  }

  /** The matching field kind, empty for {@link #ENTITY}. */
  public Optional<FieldKind> fieldKind() {
    return Optional.ofNullable(fieldKind);
  }

  public static Optional<ParameterKind> of(String value) {
    return WireValue.parse(ParameterKind.class, value);
  }

  public static List<String> wireValues() {
    return WireValue.values(ParameterKind.class);
  }
}
