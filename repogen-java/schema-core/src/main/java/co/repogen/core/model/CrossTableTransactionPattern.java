package co.repogen.core.model;

import java.util.List;
import java.util.Optional;

/**
 * An atomic read or write spanning several tables.
 */
public record CrossTableTransactionPattern(
    Integer patternId,
    String name,
    String description,
    String operation,
    List<TransactionParticipant> participants,
    List<ParameterDefinition> parameters,
    String returnType
) {

  public CrossTableTransactionPattern {
    participants = List.copyOf(participants);
    parameters = List.copyOf(parameters);
  }

  public Optional<TransactionOperation> operationKind() {
    return TransactionOperation.of(operation);
  }

  public Optional<TransactionReturnType> returnTypeKind() {
    return TransactionReturnType.of(returnType);
  }
}
