package co.repogen.core.model;

import java.util.List;
import java.util.Optional;

public enum FilterOperator implements WireValue {
  EQ("="),
  NE("<>"),
  LT("<"),
  LE("<="),
  GT(">"),
  GE(">="),
  BETWEEN("between"),
  IN("in");

  private final String wire;

  FilterOperator(String wire) {
    this.wire = wire;
  }

  @Override
  public String wire() {
    return wire;
  }

  public boolean isComparison() {
    return this != BETWEEN && this != IN;
  }

  public static Optional<FilterOperator> of(String value) {
    return WireValue.parse(FilterOperator.class, value);
  }

  public static List<String> wireValues() {
    return WireValue.values(FilterOperator.class);
  }
}
