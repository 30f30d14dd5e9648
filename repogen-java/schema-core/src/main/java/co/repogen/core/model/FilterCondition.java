package co.repogen.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * One condition of a filter expression. Carries an {@code operator}, a {@code function},
 * or both for {@code size} comparisons.
 */
public record FilterCondition(
    String field,
    String operator,
    String function,
    String param,
    String param2,
    List<String> params
) {

  public FilterCondition {
    params = params == null ? null : List.copyOf(params);
  }

  /** Parameter names referenced by the condition, in order. */
  public List<String> parameterNames() {
    List<String> names = new ArrayList<>();
    if (param != null) names.add(param);
    if (param2 != null) names.add(param2);
    if (params != null) names.addAll(params);
    return names;
  }
}
