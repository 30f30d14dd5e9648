package co.repogen.core.validation;

import co.repogen.core.diagnostics.Diagnostics;
import co.repogen.core.model.AccessPatternDefinition;
import co.repogen.core.model.CrossTableTransactionPattern;
import co.repogen.core.model.FieldDefinition;
import co.repogen.core.model.FieldKind;
import co.repogen.core.model.FilterCondition;
import co.repogen.core.model.FilterFunction;
import co.repogen.core.model.FilterOperator;
import co.repogen.core.model.IndexDefinition;
import co.repogen.core.model.LogicalOperator;
import co.repogen.core.model.Operation;
import co.repogen.core.model.ParameterDefinition;
import co.repogen.core.model.ParameterKind;
import co.repogen.core.model.ProjectionKind;
import co.repogen.core.model.RangeCondition;
import co.repogen.core.model.ReturnShape;
import co.repogen.core.model.SchemaDocument;
import co.repogen.core.model.TableDefinition;
import co.repogen.core.model.TransactionAction;
import co.repogen.core.model.TransactionOperation;
import co.repogen.core.model.TransactionParticipant;
import co.repogen.core.model.TransactionReturnType;
import co.repogen.core.model.WireValue;

import java.util.List;
import java.util.Optional;

/**
 * Closed-set membership for every enum-valued property.
 */
public final class EnumRules implements ValidationRule {

  @Override
  public String name() {
    return "enum";
  }

  @Override
  public void check(SchemaDocument document, Diagnostics diagnostics) {
    for (int t = 0; t < document.tables().size(); t++) {
      TableDefinition table = document.tables().get(t);
      for (int g = 0; g < table.indexes().size(); g++) {
        IndexDefinition index = table.indexes().get(g);
        member(index.projection(), ProjectionKind.of(index.projection()), ProjectionKind.wireValues(),
            "projection", EntityLocation.indexPath(t, g) + ".projection", diagnostics);
      }
    }

    for (EntityLocation loc : EntityLocation.all(document)) {
      List<FieldDefinition> fields = loc.entity().fields();
      for (int f = 0; f < fields.size(); f++) {
        FieldDefinition field = fields.get(f);
        String path = loc.fieldPath(f);
        member(field.type(), FieldKind.of(field.type()), FieldKind.wireValues(), "field type", path + ".type", diagnostics);
        if (field.itemType() != null) {
          member(field.itemType(), FieldKind.of(field.itemType()).filter(k -> k != FieldKind.ARRAY),
              FieldKind.itemWireValues(), "item type", path + ".item_type", diagnostics);
        }
      }
      List<AccessPatternDefinition> patterns = loc.entity().accessPatterns();
      for (int p = 0; p < patterns.size(); p++) {
        checkPattern(patterns.get(p), loc.patternPath(p), diagnostics);
      }
    }

    for (int c = 0; c < document.crossTablePatterns().size(); c++) {
      checkCrossTable(document.crossTablePatterns().get(c), EntityLocation.crossTablePath(c), diagnostics);
    }
  }

  private void checkPattern(AccessPatternDefinition pattern, String path, Diagnostics diagnostics) {
    member(pattern.operation(), Operation.of(pattern.operation()), Operation.wireValues(),
        "operation", path + ".operation", diagnostics);
    member(pattern.returnType(), ReturnShape.of(pattern.returnType()), ReturnShape.wireValues(),
        "return type", path + ".return_type", diagnostics);
    if (pattern.rangeCondition() != null) {
      member(pattern.rangeCondition(), RangeCondition.of(pattern.rangeCondition()), RangeCondition.wireValues(),
          "range condition", path + ".range_condition", diagnostics);
    }
    checkParameters(pattern.parameters(), path, diagnostics);
    if (pattern.filterExpression() == null) return;

    String filterPath = path + ".filter_expression";
    String logical = pattern.filterExpression().logicalOperator();
    if (logical != null) {
      member(logical, LogicalOperator.of(logical), LogicalOperator.wireValues(),
          "logical operator", filterPath + ".logical_operator", diagnostics);
    }
    List<FilterCondition> conditions = pattern.filterExpression().conditions();
    for (int i = 0; i < conditions.size(); i++) {
      FilterCondition c = conditions.get(i);
      String cPath = filterPath + ".conditions[" + i + "]";
      if (c.operator() != null) {
        member(c.operator(), FilterOperator.of(c.operator()), FilterOperator.wireValues(),
            "filter operator", cPath + ".operator", diagnostics);
      }
      if (c.function() != null) {
        member(c.function(), FilterFunction.of(c.function()), FilterFunction.wireValues(),
            "filter function", cPath + ".function", diagnostics);
      }
    }
  }

  private void checkParameters(List<ParameterDefinition> parameters, String path, Diagnostics diagnostics) {
    for (int i = 0; i < parameters.size(); i++) {
      ParameterDefinition p = parameters.get(i);
      member(p.type(), ParameterKind.of(p.type()), ParameterKind.wireValues(),
          "parameter type", path + ".parameters[" + i + "].type", diagnostics);
    }
  }

  private void checkCrossTable(CrossTableTransactionPattern pattern, String path, Diagnostics diagnostics) {
    Optional<TransactionOperation> op = pattern.operationKind();
    member(pattern.operation(), op, TransactionOperation.wireValues(), "transaction operation",
        path + ".operation", diagnostics);
    member(pattern.returnType(), pattern.returnTypeKind(), TransactionReturnType.wireValues(),
        "transaction return type", path + ".return_type", diagnostics);
    checkParameters(pattern.parameters(), path, diagnostics);

    List<String> allowed = op.map(TransactionOperation::allowedActionValues)
        .orElse(WireValue.values(TransactionAction.class));
    for (int i = 0; i < pattern.participants().size(); i++) {
      TransactionParticipant participant = pattern.participants().get(i);
      String action = participant.action();
      if (action == null) continue;
      Optional<TransactionAction> kind = participant.actionKind().filter(a -> allowed.contains(a.wire()));
      String what = op.map(o -> "action for " + o.wire()).orElse("action");
      member(action, kind, allowed, what, path + ".entities_involved[" + i + "].action", diagnostics);
    }
  }

  /** Missing values are the loader's concern; only present, unparseable values are reported. */
  private static void member(String raw, Optional<?> parsed, List<String> valid, String what, String path,
      Diagnostics diagnostics) {
    if (raw == null || parsed.isPresent()) return;
    diagnostics.enumViolation(path, what, raw, valid);
  }
}
