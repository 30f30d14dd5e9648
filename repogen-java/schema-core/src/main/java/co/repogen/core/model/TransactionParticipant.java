package co.repogen.core.model;

import java.util.Optional;

/**
 * @param condition  optional condition expression applied to the action
 */
public record TransactionParticipant(String table, String entity, String action, String condition) {

  public Optional<TransactionAction> actionKind() {
    return TransactionAction.of(action);
  }
}
