package co.repogen.core.validation;

import co.repogen.core.diagnostics.Diagnostics;
import co.repogen.core.model.AccessPatternDefinition;
import co.repogen.core.model.CrossTableTransactionPattern;
import co.repogen.core.model.EntityDefinition;
import co.repogen.core.model.FilterCondition;
import co.repogen.core.model.IndexDefinition;
import co.repogen.core.model.IndexKeyMapping;
import co.repogen.core.model.ParameterDefinition;
import co.repogen.core.model.ProjectionKind;
import co.repogen.core.model.SchemaDocument;
import co.repogen.core.model.TableDefinition;
import co.repogen.core.model.TransactionParticipant;
import co.repogen.core.template.KeyTemplateCompiler;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Name resolution: key template fields, index names, entity parameter types, filter fields
 * and parameters, INCLUDE attributes and cross-table participants.
 *
 * <p>Key templates are compiled here, so template syntax and multi-attribute arity problems
 * are reported by this group as well.
 */
public final class ReferenceRules implements ValidationRule {

  @Override
  public String name() {
    return "reference";
  }

  @Override
  public void check(SchemaDocument document, Diagnostics diagnostics) {
    List<String> entityNames = document.entityNames();
    for (EntityLocation loc : EntityLocation.all(document)) {
      checkTemplates(loc, diagnostics);
      List<AccessPatternDefinition> patterns = loc.entity().accessPatterns();
      for (int p = 0; p < patterns.size(); p++) {
        checkPattern(loc, patterns.get(p), loc.patternPath(p), entityNames, diagnostics);
      }
    }
    for (int t = 0; t < document.tables().size(); t++) {
      checkIncludedAttributes(document.tables().get(t), t, diagnostics);
    }
    for (int c = 0; c < document.crossTablePatterns().size(); c++) {
      checkCrossTable(document, document.crossTablePatterns().get(c), EntityLocation.crossTablePath(c),
          entityNames, diagnostics);
    }
  }

  private void checkTemplates(EntityLocation loc, Diagnostics diagnostics) {
    EntityDefinition entity = loc.entity();
    TableDefinition table = loc.table();
    if (entity.pkTemplate() != null) {
      KeyTemplateCompiler.compile(entity.pkTemplate(), entity, loc.path() + ".pk_template", diagnostics);
    }
    if (entity.skTemplate() != null) {
      KeyTemplateCompiler.compile(entity.skTemplate(), entity, loc.path() + ".sk_template", diagnostics);
    }
    for (int m = 0; m < entity.indexMappings().size(); m++) {
      IndexKeyMapping mapping = entity.indexMappings().get(m);
      String path = loc.mappingPath(m);
      if (table.index(mapping.indexName()).isEmpty()) {
        diagnostics.reference(path + ".name", "entity " + entity.name() + " maps unknown index '"
            + mapping.indexName() + "' of table " + table.name(), mapping.indexName(), table.indexNames());
      }
      String owner = "index '" + mapping.indexName() + "'";
      KeyTemplateCompiler.compile(mapping.pkTemplate(), entity, owner, path + ".pk_template", diagnostics);
      if (mapping.skTemplate() != null) {
        KeyTemplateCompiler.compile(mapping.skTemplate(), entity, owner, path + ".sk_template", diagnostics);
      }
    }
  }

  private void checkPattern(EntityLocation loc, AccessPatternDefinition pattern, String path, List<String> entityNames,
      Diagnostics diagnostics) {
    EntityDefinition entity = loc.entity();
    TableDefinition table = loc.table();
    if (pattern.usesIndex() && table.index(pattern.indexName()).isEmpty()) {
      diagnostics.reference(path + ".index_name", "pattern '" + pattern.name() + "' uses unknown index '"
          + pattern.indexName() + "' of table " + table.name(), pattern.indexName(), table.indexNames());
    }

    for (int i = 0; i < pattern.parameters().size(); i++) {
      ParameterDefinition p = pattern.parameters().get(i);
      if (p.isEntity() && p.entityType() != null && !entityNames.contains(p.entityType())) {
        diagnostics.reference(path + ".parameters[" + i + "].entity_type", "parameter '" + p.name()
            + "' references unknown entity '" + p.entityType() + "'", p.entityType(), entityNames);
      }
    }

    if (pattern.filterExpression() == null) return;
    Set<String> parameterNames = new LinkedHashSet<>();
    pattern.parameters().forEach(p -> parameterNames.add(p.name()));
    List<FilterCondition> conditions = pattern.filterExpression().conditions();
    for (int i = 0; i < conditions.size(); i++) {
      FilterCondition c = conditions.get(i);
      String cPath = path + ".filter_expression.conditions[" + i + "]";
      if (entity.field(c.field()).isEmpty()) {
        diagnostics.reference(cPath + ".field", "filter field '" + c.field() + "' is not a field of entity "
            + entity.name(), c.field(), entity.fieldNames());
      }
      for (String param : c.parameterNames()) {
        if (!parameterNames.contains(param)) {
          diagnostics.reference(cPath, "filter parameter '" + param + "' is not declared in the parameters of pattern '"
              + pattern.name() + "'", param, parameterNames);
        }
      }
    }
  }

  private void checkIncludedAttributes(TableDefinition table, int tableIndex, Diagnostics diagnostics) {
    for (int g = 0; g < table.indexes().size(); g++) {
      IndexDefinition index = table.indexes().get(g);
      if (index.projectionKind().orElse(null) != ProjectionKind.INCLUDE || index.includedAttributes() == null) {
        continue;
      }
      Set<String> available = new LinkedHashSet<>();
      boolean mapped = false;
      for (EntityDefinition entity : table.entities()) {
        if (entity.indexMapping(index.name()).isPresent()) {
          mapped = true;
          available.addAll(entity.fieldNames());
        }
      }
      if (!mapped) continue;
      for (int a = 0; a < index.includedAttributes().size(); a++) {
        String attr = index.includedAttributes().get(a);
        if (!available.contains(attr)) {
          diagnostics.reference(EntityLocation.indexPath(tableIndex, g) + ".included_attributes[" + a + "]",
              "included attribute '" + attr + "' is not a field of any entity using index " + index.name(),
              attr, available);
        }
      }
    }
  }

  private void checkCrossTable(SchemaDocument document, CrossTableTransactionPattern pattern, String path,
      List<String> entityNames, Diagnostics diagnostics) {
    for (int i = 0; i < pattern.participants().size(); i++) {
      TransactionParticipant participant = pattern.participants().get(i);
      String pPath = path + ".entities_involved[" + i + "]";
      Optional<TableDefinition> table = document.table(participant.table());
      if (table.isEmpty()) {
        diagnostics.reference(pPath + ".table", "transaction '" + pattern.name() + "' references unknown table '"
            + participant.table() + "'", participant.table(), document.tableNames());
        continue;
      }
      if (table.get().entity(participant.entity()).isEmpty()) {
        String where = entityNames.contains(participant.entity())
            ? "' belongs to another table, not " + participant.table()
            : "' does not exist in table " + participant.table();
        diagnostics.reference(pPath + ".entity", "transaction '" + pattern.name() + "': entity '"
            + participant.entity() + where, participant.entity(), table.get().entityNames());
      }
    }
    for (int i = 0; i < pattern.parameters().size(); i++) {
      ParameterDefinition p = pattern.parameters().get(i);
      if (p.isEntity() && p.entityType() != null && !entityNames.contains(p.entityType())) {
        diagnostics.reference(path + ".parameters[" + i + "].entity_type", "parameter '" + p.name()
            + "' references unknown entity '" + p.entityType() + "'", p.entityType(), entityNames);
      }
    }
  }
}
