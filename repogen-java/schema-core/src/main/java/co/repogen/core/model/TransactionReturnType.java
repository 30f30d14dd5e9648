package co.repogen.core.model;

import java.util.List;
import java.util.Optional;

public enum TransactionReturnType implements WireValue {
  BOOLEAN("boolean"),
  OBJECT("object"),
  ARRAY("array");

  private final String wire;

  TransactionReturnType(String wire) {
    this.wire = wire;
  }

  @Override
  public String wire() {
    return wire;
  }

  public static Optional<TransactionReturnType> of(String value) {
    return WireValue.parse(TransactionReturnType.class, value);
  }

  public static List<String> wireValues() {
    return WireValue.values(TransactionReturnType.class);
  }
}
