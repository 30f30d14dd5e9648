package co.repogen.core.model;

import java.util.Optional;

public enum TransactionAction implements WireValue {
  PUT("Put"),
  UPDATE("Update"),
  DELETE("Delete"),
  CONDITION_CHECK("ConditionCheck"),
  GET("Get");

  private final String wire;

  TransactionAction(String wire) {
    this.wire = wire;
  }

  @Override
  public String wire() {
    return wire;
  }

  public static Optional<TransactionAction> of(String value) {
    return WireValue.parse(TransactionAction.class, value);
  }
}
