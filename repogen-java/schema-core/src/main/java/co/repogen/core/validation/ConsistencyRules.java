package co.repogen.core.validation;

import co.repogen.core.Names;
import co.repogen.core.diagnostics.DiagnosticKind;
import co.repogen.core.diagnostics.Diagnostics;
import co.repogen.core.model.AccessPatternDefinition;
import co.repogen.core.model.CrossTableTransactionPattern;
import co.repogen.core.model.EntityDefinition;
import co.repogen.core.model.FieldDefinition;
import co.repogen.core.model.FilterCondition;
import co.repogen.core.model.IndexDefinition;
import co.repogen.core.model.IndexKeyMapping;
import co.repogen.core.model.Operation;
import co.repogen.core.model.ParameterDefinition;
import co.repogen.core.model.ProjectionKind;
import co.repogen.core.model.Projections;
import co.repogen.core.model.SchemaDocument;
import co.repogen.core.model.TableDefinition;
import co.repogen.core.template.KeyTemplateParser;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Combinations that are individually well formed but invalid together.
 */
public final class ConsistencyRules implements ValidationRule {

  @Override
  public String name() {
    return "consistency";
  }

  @Override
  public void check(SchemaDocument document, Diagnostics diagnostics) {
    for (int t = 0; t < document.tables().size(); t++) {
      TableDefinition table = document.tables().get(t);
      for (int g = 0; g < table.indexes().size(); g++) {
        checkIncludedKeys(table, table.indexes().get(g), EntityLocation.indexPath(t, g), diagnostics);
      }
    }
    for (EntityLocation loc : EntityLocation.all(document)) {
      checkSortKeyPresence(loc, diagnostics);
      checkGeneratedFieldNames(loc, diagnostics);
      checkMappings(loc, diagnostics);
      List<AccessPatternDefinition> patterns = loc.entity().accessPatterns();
      for (int p = 0; p < patterns.size(); p++) {
        checkPattern(loc, patterns.get(p), loc.patternPath(p), diagnostics);
      }
    }
    for (int c = 0; c < document.crossTablePatterns().size(); c++) {
      checkCrossTableParameters(document, document.crossTablePatterns().get(c), EntityLocation.crossTablePath(c),
          diagnostics);
    }
  }

  private void checkIncludedKeys(TableDefinition table, IndexDefinition index, String path, Diagnostics diagnostics) {
    if (index.projectionKind().orElse(null) != ProjectionKind.INCLUDE || index.includedAttributes() == null) return;
    Set<String> keys = new LinkedHashSet<>(table.keyAttributes());
    keys.addAll(index.keyAttributes());
    for (int a = 0; a < index.includedAttributes().size(); a++) {
      String attr = index.includedAttributes().get(a);
      if (keys.contains(attr)) {
        diagnostics.consistency(path + ".included_attributes[" + a + "]", "index '" + index.name()
            + "' lists key attribute '" + attr + "' in included_attributes; key attributes are always projected");
      }
    }
  }

  private void checkSortKeyPresence(EntityLocation loc, Diagnostics diagnostics) {
    TableDefinition table = loc.table();
    EntityDefinition entity = loc.entity();
    if (table.hasSortKey() && entity.skTemplate() == null) {
      diagnostics.consistency(loc.path() + ".sk_template", "table " + table.name() + " has sort key '"
          + table.sortKey() + "' but entity " + entity.name() + " declares no sk_template");
    }
    if (!table.hasSortKey() && entity.skTemplate() != null) {
      diagnostics.consistency(loc.path() + ".sk_template", "entity " + entity.name()
          + " declares sk_template but table " + table.name() + " has no sort key");
    }
  }

  /** Distinct field names that map to the same camelCase accessor. Exact duplicates are a uniqueness error. */
  private void checkGeneratedFieldNames(EntityLocation loc, Diagnostics diagnostics) {
    Map<String, String> byCamel = new HashMap<>();
    List<FieldDefinition> fields = loc.entity().fields();
    for (int f = 0; f < fields.size(); f++) {
      String name = fields.get(f).name();
      if (name == null || name.isEmpty()) continue;
      String first = byCamel.putIfAbsent(Names.toCamelCase(name), name);
      if (first != null && !first.equals(name)) {
        diagnostics.consistency(loc.fieldPath(f) + ".name", "field '" + name + "' of entity " + loc.entity().name()
            + " and field '" + first + "' both generate the member name '" + Names.toCamelCase(name) + "'");
      }
    }
  }

  private void checkMappings(EntityLocation loc, Diagnostics diagnostics) {
    EntityDefinition entity = loc.entity();
    for (int m = 0; m < entity.indexMappings().size(); m++) {
      IndexKeyMapping mapping = entity.indexMappings().get(m);
      Optional<IndexDefinition> index = loc.table().index(mapping.indexName());
      if (index.isEmpty()) continue;
      String path = loc.mappingPath(m);
      if (mapping.skTemplate() != null && !index.get().hasSortKey()) {
        diagnostics.consistency(path + ".sk_template", "index '" + index.get().name()
            + "' has no sort key but entity " + entity.name() + " maps sk_template");
      }
      List<String> missing = Projections.unprojectedRequiredFields(loc.table(), index.get(), entity);
      if (!missing.isEmpty() && index.get().projectionKind().orElse(null) == ProjectionKind.INCLUDE) {
        diagnostics.warning(DiagnosticKind.CONSISTENCY, path, "INCLUDE projection of index '" + index.get().name()
            + "' omits required field(s) " + missing + " of entity " + entity.name()
            + "; reads through this index return raw attribute maps");
      }
    }
  }

  private void checkPattern(EntityLocation loc, AccessPatternDefinition pattern, String path,
      Diagnostics diagnostics) {
    Optional<Operation> op = pattern.operationKind();
    if (pattern.isConsistentRead() && pattern.usesIndex()) {
      diagnostics.consistency(path + ".consistent_read", "pattern '" + pattern.name()
          + "' requests consistent_read on index '" + pattern.indexName()
          + "'; global secondary indexes only support eventually consistent reads");
    }
    if (pattern.usesIndex() && op.isPresent() && op.get() != Operation.QUERY && op.get() != Operation.SCAN) {
      diagnostics.consistency(path + ".index_name", "pattern '" + pattern.name() + "' sets index_name but "
          + pattern.operation() + " cannot read from an index");
    }
    if (pattern.usesIndex() && loc.table().index(pattern.indexName()).isPresent()
        && loc.entity().indexMapping(pattern.indexName()).isEmpty()) {
      diagnostics.consistency(path + ".index_name", "pattern '" + pattern.name() + "' queries index '"
          + pattern.indexName() + "' but entity " + loc.entity().name() + " has no gsi_mapping for it");
    }

    if (pattern.rangeCondition() != null && op.isPresent()) {
      if (op.get() != Operation.QUERY) {
        diagnostics.consistency(path + ".range_condition", "range_condition is only valid for Query, pattern '"
            + pattern.name() + "' uses " + pattern.operation());
      } else if (!queriedKeyHasSortKey(loc, pattern)) {
        diagnostics.consistency(path + ".range_condition", "pattern '" + pattern.name()
            + "' uses a range condition but the queried key has no sort key");
      }
    }

    if (pattern.filterExpression() == null || op.isEmpty()) return;
    if (!op.get().supportsFilter()) {
      diagnostics.consistency(path + ".filter_expression", "filter_expression is only valid for Query or Scan, pattern '"
          + pattern.name() + "' uses " + pattern.operation());
      return;
    }
    if (op.get() == Operation.QUERY) {
      Set<String> keys = keyAttributes(loc, pattern);
      List<FilterCondition> conditions = pattern.filterExpression().conditions();
      for (int i = 0; i < conditions.size(); i++) {
        String field = conditions.get(i).field();
        if (keys.contains(field)) {
          diagnostics.consistency(path + ".filter_expression.conditions[" + i + "].field", "filter on key attribute '"
              + field + "' in Query pattern '" + pattern.name() + "'; use the key condition instead");
        }
      }
    }
  }

  private boolean queriedKeyHasSortKey(EntityLocation loc, AccessPatternDefinition pattern) {
    if (!pattern.usesIndex()) return loc.table().hasSortKey();
    return loc.table().index(pattern.indexName()).map(IndexDefinition::hasSortKey).orElse(true);
  }

  /**
   * Attributes a Query addresses through its key condition: table keys and the fields of the
   * entity's key templates, plus the index keys and mapping template fields for index queries.
   */
  private Set<String> keyAttributes(EntityLocation loc, AccessPatternDefinition pattern) {
    Set<String> keys = new LinkedHashSet<>(loc.table().keyAttributes());
    List<String> templates = new ArrayList<>();
    if (loc.entity().pkTemplate() != null) templates.add(loc.entity().pkTemplate());
    if (loc.entity().skTemplate() != null) templates.add(loc.entity().skTemplate());
    if (pattern.usesIndex()) {
      loc.table().index(pattern.indexName()).ifPresent(i -> keys.addAll(i.keyAttributes()));
      loc.entity().indexMapping(pattern.indexName()).ifPresent(m -> {
        templates.addAll(m.pkTemplate().values());
        if (m.skTemplate() != null) templates.addAll(m.skTemplate().values());
      });
    }
    for (String template : templates) {
      KeyTemplateParser.tryParse(template).ifPresent(t -> keys.addAll(t.fieldNames()));
    }
    return keys;
  }

  private void checkCrossTableParameters(SchemaDocument document, CrossTableTransactionPattern pattern, String path,
      Diagnostics diagnostics) {
    for (int i = 0; i < pattern.parameters().size(); i++) {
      ParameterDefinition p = pattern.parameters().get(i);
      if (p.isEntity() || p.type() == null || p.kind().isEmpty()) continue;
      Set<String> fieldTypes = new LinkedHashSet<>();
      document.entities().forEach(e -> e.field(p.name()).map(FieldDefinition::type).ifPresent(fieldTypes::add));
      if (!fieldTypes.isEmpty() && !fieldTypes.contains(p.type())) {
        diagnostics.consistency(path + ".parameters[" + i + "].type", "parameter '" + p.name() + "' of transaction '"
            + pattern.name() + "' has type " + p.type() + " but fields named '" + p.name() + "' have type(s) "
            + fieldTypes);
      }
    }
  }
}
