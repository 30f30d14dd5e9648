package co.repogen.core.resolve;

import co.repogen.core.model.TransactionOperation;
import co.repogen.core.model.TransactionReturnType;

import java.util.List;

/**
 * Fully typed contract of one cross-table transaction pattern.
 */
public record ResolvedTransaction(
    int id,
    String methodName,
    String description,
    TransactionOperation operation,
    TransactionReturnType returnType,
    List<ResolvedParticipant> participants,
    List<ResolvedParameter> parameters
) {

  public ResolvedTransaction {
    participants = List.copyOf(participants);
    parameters = List.copyOf(parameters);
  }
}
