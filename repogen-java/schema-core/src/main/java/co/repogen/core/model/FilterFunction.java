package co.repogen.core.model;

import java.util.List;
import java.util.Optional;

public enum FilterFunction implements WireValue {
  ATTRIBUTE_EXISTS("attribute_exists"),
  ATTRIBUTE_NOT_EXISTS("attribute_not_exists"),
  CONTAINS("contains"),
  BEGINS_WITH("begins_with"),
  SIZE("size");

  private final String wire;

  FilterFunction(String wire) {
    this.wire = wire;
  }

  @Override
  public String wire() {
    return wire;
  }

  /** Existence checks take no parameter value. */
  public boolean takesNoValue() {
    return this == ATTRIBUTE_EXISTS || this == ATTRIBUTE_NOT_EXISTS;
  }

  public static Optional<FilterFunction> of(String value) {
    return WireValue.parse(FilterFunction.class, value);
  }

  public static List<String> wireValues() {
    return WireValue.values(FilterFunction.class);
  }
}
