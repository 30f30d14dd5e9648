package co.repogen.core.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public record FilterExpressionSpec(List<FilterCondition> conditions, String logicalOperator) {

  public FilterExpressionSpec {
    conditions = List.copyOf(conditions);
  }

  public Set<String> parameterNames() {
    Set<String> names = new LinkedHashSet<>();
    for (FilterCondition c : conditions) names.addAll(c.parameterNames());
    return names;
  }

  /** The combinator, {@code AND} when the document omits it. */
  public String effectiveLogicalOperator() {
    return logicalOperator == null ? LogicalOperator.AND.wire() : logicalOperator;
  }
}
