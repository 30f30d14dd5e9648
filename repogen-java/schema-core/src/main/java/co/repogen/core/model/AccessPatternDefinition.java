package co.repogen.core.model;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A single-table access pattern as declared on an entity. Enum-valued properties stay raw
 * strings until validation.
 */
public record AccessPatternDefinition(
    Integer patternId,
    String name,
    String description,
    String operation,
    String indexName,
    String rangeCondition,
    Boolean consistentRead,
    FilterExpressionSpec filterExpression,
    List<ParameterDefinition> parameters,
    String returnType
) {

  public AccessPatternDefinition {
    parameters = List.copyOf(parameters);
  }

  public Optional<Operation> operationKind() {
    return Operation.of(operation);
  }

  public Optional<RangeCondition> rangeConditionKind() {
    return RangeCondition.of(rangeCondition);
  }

  public Optional<ReturnShape> returnShape() {
    return ReturnShape.of(returnType);
  }

  public boolean usesIndex() {
    return indexName != null && !indexName.isEmpty();
  }

  public boolean isConsistentRead() {
    return Boolean.TRUE.equals(consistentRead);
  }

  /**
   * Parameters that can bind key attributes or range values: everything except entity
   * parameters and filter parameters that none of {@code keyFields} names.
   */
  public List<ParameterDefinition> keyCandidateParameters(Collection<String> keyFields) {
    Set<String> filterParams = filterExpression == null ? Set.of() : filterExpression.parameterNames();
    return parameters.stream()
        .filter(p -> !p.isEntity())
        .filter(p -> !filterParams.contains(p.name()) || keyFields.contains(p.name()))
        .toList();
  }

  public Optional<ParameterDefinition> parameter(String name) {
    return parameters.stream().filter(p -> name.equals(p.name())).findFirst();
  }
}
