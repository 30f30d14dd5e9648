package co.repogen.core.validation;

import co.repogen.core.diagnostics.Diagnostics;
import co.repogen.core.model.AccessPatternDefinition;
import co.repogen.core.model.FieldDefinition;
import co.repogen.core.model.FieldKind;
import co.repogen.core.model.FilterCondition;
import co.repogen.core.model.FilterFunction;
import co.repogen.core.model.FilterOperator;
import co.repogen.core.model.IndexDefinition;
import co.repogen.core.model.Operation;
import co.repogen.core.model.ParameterDefinition;
import co.repogen.core.model.ProjectionKind;
import co.repogen.core.model.SchemaDocument;
import co.repogen.core.model.TableDefinition;

import java.util.List;
import java.util.Optional;

/**
 * Shape rules that depend on another value of the same element, such as {@code item_type}
 * for arrays or the parameters a filter operator needs.
 */
public final class StructuralRules implements ValidationRule {

  @Override
  public String name() {
    return "structural";
  }

  @Override
  public void check(SchemaDocument document, Diagnostics diagnostics) {
    for (int t = 0; t < document.tables().size(); t++) {
      TableDefinition table = document.tables().get(t);
      for (int g = 0; g < table.indexes().size(); g++) {
        checkProjection(table.indexes().get(g), EntityLocation.indexPath(t, g), diagnostics);
      }
    }
    for (EntityLocation loc : EntityLocation.all(document)) {
      List<FieldDefinition> fields = loc.entity().fields();
      for (int f = 0; f < fields.size(); f++) {
        checkField(fields.get(f), loc.fieldPath(f), diagnostics);
      }
      List<AccessPatternDefinition> patterns = loc.entity().accessPatterns();
      for (int p = 0; p < patterns.size(); p++) {
        checkPattern(patterns.get(p), loc.patternPath(p), diagnostics);
      }
    }
    for (int c = 0; c < document.crossTablePatterns().size(); c++) {
      checkParameters(document.crossTablePatterns().get(c).parameters(), EntityLocation.crossTablePath(c), diagnostics);
    }
  }

  private void checkField(FieldDefinition field, String path, Diagnostics diagnostics) {
    boolean isArray = FieldKind.ARRAY.wire().equals(field.type());
    if (isArray && field.itemType() == null) {
      diagnostics.structural(path + ".item_type", "array field '" + field.name() + "' requires 'item_type'");
    }
    if (!isArray && field.itemType() != null && field.type() != null) {
      diagnostics.structural(path + ".item_type",
          "'item_type' is only allowed on array fields, '" + field.name() + "' is " + field.type());
    }
  }

  private void checkProjection(IndexDefinition index, String path, Diagnostics diagnostics) {
    Optional<ProjectionKind> projection = index.projectionKind();
    if (projection.isEmpty()) return;
    List<String> included = index.includedAttributes();
    if (projection.get() == ProjectionKind.INCLUDE) {
      if (included == null || included.isEmpty()) {
        diagnostics.structural(path + ".included_attributes",
            "index '" + index.name() + "' uses INCLUDE projection and needs a non-empty 'included_attributes'");
      }
    } else if (included != null) {
      diagnostics.structural(path + ".included_attributes",
          "'included_attributes' is only allowed with INCLUDE projection, index '" + index.name()
              + "' uses " + index.projection());
    }
  }

  private void checkPattern(AccessPatternDefinition pattern, String path, Diagnostics diagnostics) {
    checkParameters(pattern.parameters(), path, diagnostics);
    if (pattern.rangeCondition() != null && pattern.operationKind().orElse(null) == Operation.QUERY
        && pattern.parameters().isEmpty()) {
      diagnostics.structural(path + ".parameters",
          "pattern '" + pattern.name() + "' has a range condition but declares no parameters");
    }
    if (pattern.filterExpression() == null) return;
    List<FilterCondition> conditions = pattern.filterExpression().conditions();
    for (int i = 0; i < conditions.size(); i++) {
      checkCondition(conditions.get(i), path + ".filter_expression.conditions[" + i + "]", diagnostics);
    }
  }

  private void checkParameters(List<ParameterDefinition> parameters, String path, Diagnostics diagnostics) {
    for (int i = 0; i < parameters.size(); i++) {
      ParameterDefinition p = parameters.get(i);
      if (p.isEntity() && p.entityType() == null) {
        diagnostics.structural(path + ".parameters[" + i + "].entity_type",
            "entity parameter '" + p.name() + "' requires 'entity_type'");
      }
    }
  }

  private void checkCondition(FilterCondition c, String path, Diagnostics diagnostics) {
    Optional<FilterOperator> op = FilterOperator.of(c.operator());
    Optional<FilterFunction> fn = FilterFunction.of(c.function());
    if (c.operator() == null && c.function() == null) {
      diagnostics.structural(path, "condition on '" + c.field() + "' needs an 'operator' or a 'function'");
      return;
    }
    if (c.function() != null && c.operator() != null && fn.orElse(null) != FilterFunction.SIZE) {
      diagnostics.structural(path, "condition on '" + c.field()
          + "' sets both 'operator' and 'function'; only 'size' combines with an operator");
    }
    if (fn.orElse(null) == FilterFunction.SIZE && c.operator() == null) {
      diagnostics.structural(path + ".operator", "'size' on '" + c.field() + "' requires a comparison 'operator'");
    }
    if (op.isPresent()) {
      checkOperatorParams(op.get(), c, path, diagnostics);
    } else if (fn.isPresent()) {
      if (fn.get().takesNoValue()) {
        if (!c.parameterNames().isEmpty()) {
          diagnostics.structural(path, "'" + c.function() + "' on '" + c.field() + "' takes no parameters");
        }
      } else if (c.param() == null) {
        diagnostics.structural(path + ".param", "'" + c.function() + "' on '" + c.field() + "' requires 'param'");
      }
    }
  }

  private void checkOperatorParams(FilterOperator op, FilterCondition c, String path, Diagnostics diagnostics) {
    switch (op) {
      case BETWEEN -> {
        if (c.param() == null || c.param2() == null) {
          diagnostics.structural(path, "'between' on '" + c.field() + "' requires 'param' and 'param2'");
        }
      }
      case IN -> {
        if (c.params() == null || c.params().isEmpty()) {
          diagnostics.structural(path + ".params", "'in' on '" + c.field() + "' requires a non-empty 'params'");
        }
      }
      case EQ, NE, LT, LE, GT, GE -> {
        if (c.param() == null) {
          diagnostics.structural(path + ".param", "'" + c.operator() + "' on '" + c.field() + "' requires 'param'");
        }
      }
    }
  }
}
