package co.repogen.core.model;

import java.util.List;
import java.util.Optional;

/**
 * Cross-table transaction kinds and the participant actions each allows.
 */
public enum TransactionOperation implements WireValue {
  TRANSACT_WRITE("TransactWrite", List.of(
      TransactionAction.PUT, TransactionAction.UPDATE, TransactionAction.DELETE, TransactionAction.CONDITION_CHECK)),
  TRANSACT_GET("TransactGet", List.of(TransactionAction.GET));

  private final String wire;
  private final List<TransactionAction> allowedActions;

  TransactionOperation(String wire, List<TransactionAction> allowedActions) {
    this.wire = wire;
    this.allowedActions = allowedActions;
  }

  @Override
  public String wire() {
    return wire;
  }

  public List<TransactionAction> allowedActions() {
    return allowedActions;
  }

  public List<String> allowedActionValues() {
    return allowedActions.stream().map(TransactionAction::wire).toList();
  }

  public static Optional<TransactionOperation> of(String value) {
    return WireValue.parse(TransactionOperation.class, value);
  }

  public static List<String> wireValues() {
    return WireValue.values(TransactionOperation.class);
  }
}
