package co.repogen.core.model;

import java.util.List;
import java.util.Optional;

public enum LogicalOperator implements WireValue {
  AND("AND"),
  OR("OR");

  private final String wire;

  LogicalOperator(String wire) {
    this.wire = wire;
  }

  @Override
  public String wire() {
    return wire;
  }

  public static Optional<LogicalOperator> of(String value) {
    return WireValue.parse(LogicalOperator.class, value);
  }

  public static List<String> wireValues() {
    return WireValue.values(LogicalOperator.class);
  }
}
