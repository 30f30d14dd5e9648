package co.repogen.core.resolve;

import co.repogen.core.model.FilterExpressionSpec;
import co.repogen.core.model.Operation;
import co.repogen.core.model.ProjectionKind;
import co.repogen.core.model.RangeCondition;
import co.repogen.core.model.ReturnShape;

import java.util.List;

/**
 * Fully typed contract of one single-table access pattern.
 *
 * @param methodName    language-neutral snake_case name after CRUD conflict resolution
 * @param declaredName  name as written in the schema
 * @param indexName     queried index, null for the base table
 * @param projection    projection of the queried index, null for the base table
 * @param crudMethod    CRUD method this pattern is folded into, null when it gets its own method
 */
public record ResolvedPattern(
    int id,
    String methodName,
    String declaredName,
    String description,
    Operation operation,
    ReturnShape returnShape,
    ResponseShape responseShape,
    String indexName,
    ProjectionKind projection,
    RangeCondition rangeCondition,
    boolean consistentRead,
    FilterExpressionSpec filter,
    List<ResolvedParameter> parameters,
    List<KeyPlanStep> keyPlan,
    String crudMethod
) {

  public ResolvedPattern {
    parameters = List.copyOf(parameters);
    keyPlan = List.copyOf(keyPlan);
  }

  public List<ResolvedParameter> parameters(ParameterRole role) {
    return parameters.stream().filter(p -> p.role() == role).toList();
  }

  public boolean usesIndex() {
    return indexName != null;
  }

  public boolean isFolded() {
    return crudMethod != null;
  }

  /** Name of the generated method that serves this pattern. */
  public String targetMethod() {
    return isFolded() ? crudMethod : methodName;
  }

  ResolvedPattern renamed(String newName) {
    return new ResolvedPattern(id, newName, declaredName, description, operation, returnShape, responseShape,
        indexName, projection, rangeCondition, consistentRead, filter, parameters, keyPlan, crudMethod);
  }

  ResolvedPattern foldedInto(String crud) {
    return new ResolvedPattern(id, methodName, declaredName, description, operation, returnShape, responseShape,
        indexName, projection, rangeCondition, consistentRead, filter, parameters, keyPlan, crud);
  }
}
