package co.repogen.core.model;

import java.util.List;
import java.util.Optional;

/**
 * Declared return type of a single-table access pattern.
 */
public enum ReturnShape implements WireValue {
  SINGLE_ENTITY("single_entity"),
  ENTITY_LIST("entity_list"),
  SUCCESS_FLAG("success_flag"),
  MIXED_DATA("mixed_data"),
  VOID("void");

  private final String wire;

  ReturnShape(String wire) {
    this.wire = wire;
  }

  @Override
  public String wire() {
    return wire;
  }

  public static Optional<ReturnShape> of(String value) {
    return WireValue.parse(ReturnShape.class, value);
  }

  public static List<String> wireValues() {
    return WireValue.values(ReturnShape.class);
  }
}
