package co.repogen.core.model;

import java.util.List;
import java.util.Optional;

/**
 * Sort key conditions usable in a Query.
 */
public enum RangeCondition implements WireValue {
  BEGINS_WITH("begins_with"),
  BETWEEN("between"),
  GREATER_THAN(">"),
  GREATER_THAN_OR_EQUAL(">="),
  LESS_THAN("<"),
  LESS_THAN_OR_EQUAL("<=");

  private final String wire;

  RangeCondition(String wire) {
    this.wire = wire;
  }

  @Override
  public String wire() {
    return wire;
  }

  /** Number of parameter values the condition consumes. */
  public int valueCount() {
    return this == BETWEEN ? 2 : 1;
  }

  public static Optional<RangeCondition> of(String value) {
    return WireValue.parse(RangeCondition.class, value);
  }

  public static List<String> wireValues() {
    return WireValue.values(RangeCondition.class);
  }
}
