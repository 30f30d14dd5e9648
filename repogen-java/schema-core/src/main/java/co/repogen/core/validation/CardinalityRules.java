package co.repogen.core.validation;

import co.repogen.core.diagnostics.Diagnostics;
import co.repogen.core.model.AccessPatternDefinition;
import co.repogen.core.model.IndexDefinition;
import co.repogen.core.model.IndexKeyMapping;
import co.repogen.core.model.KeySpec;
import co.repogen.core.model.Operation;
import co.repogen.core.model.RangeCondition;
import co.repogen.core.model.SchemaDocument;
import co.repogen.core.model.TableDefinition;
import co.repogen.core.template.KeyTemplateCompiler;

import java.util.List;
import java.util.Optional;

/**
 * Counts: multi-attribute key arrays, mapping arity against index arity, range condition
 * parameters and transaction participants.
 */
public final class CardinalityRules implements ValidationRule {
  public static final int MAX_TRANSACTION_ITEMS = 100;

  @Override
  public String name() {
    return "cardinality";
  }

  @Override
  public void check(SchemaDocument document, Diagnostics diagnostics) {
    for (int t = 0; t < document.tables().size(); t++) {
      TableDefinition table = document.tables().get(t);
      for (int g = 0; g < table.indexes().size(); g++) {
        IndexDefinition index = table.indexes().get(g);
        String path = EntityLocation.indexPath(t, g);
        checkKeyArity(index.partitionKey(), index.name(), "partition", path + ".partition_key", diagnostics);
        if (index.sortKey() != null) {
          checkKeyArity(index.sortKey(), index.name(), "sort", path + ".sort_key", diagnostics);
        }
      }
    }

    for (EntityLocation loc : EntityLocation.all(document)) {
      for (int m = 0; m < loc.entity().indexMappings().size(); m++) {
        IndexKeyMapping mapping = loc.entity().indexMappings().get(m);
        String mappingPath = loc.mappingPath(m);
        loc.table().index(mapping.indexName())
            .ifPresent(index -> checkMappingArity(mapping, index, mappingPath, diagnostics));
      }
      List<AccessPatternDefinition> patterns = loc.entity().accessPatterns();
      for (int p = 0; p < patterns.size(); p++) {
        checkRangeParameters(loc, patterns.get(p), loc.patternPath(p), diagnostics);
      }
    }

    for (int c = 0; c < document.crossTablePatterns().size(); c++) {
      int count = document.crossTablePatterns().get(c).participants().size();
      if (count > MAX_TRANSACTION_ITEMS) {
        diagnostics.cardinality(EntityLocation.crossTablePath(c) + ".entities_involved",
            "transaction has " + count + " participants, at most " + MAX_TRANSACTION_ITEMS + " are allowed");
      }
    }
  }

  private void checkKeyArity(KeySpec key, String indexName, String role, String path, Diagnostics diagnostics) {
    if (!key.multiAttribute()) return;
    if (key.size() < 1 || key.size() > KeyTemplateCompiler.MAX_KEY_ATTRIBUTES) {
      diagnostics.cardinality(path, "index '" + indexName + "' declares a multi-attribute " + role + " key with "
          + key.size() + " attributes, expected 1-" + KeyTemplateCompiler.MAX_KEY_ATTRIBUTES);
    }
  }

  private void checkMappingArity(IndexKeyMapping mapping, IndexDefinition index, String path, Diagnostics diagnostics) {
    KeySpec pk = mapping.pkTemplate();
    if ((pk.multiAttribute() || index.partitionKey().multiAttribute()) && pk.size() != index.partitionKey().size()) {
      diagnostics.cardinality(path + ".pk_template", "mapping for index '" + index.name() + "' supplies " + pk.size()
          + " partition key template(s), the index declares " + index.partitionKey().size() + " attribute(s)");
    }
    KeySpec sk = mapping.skTemplate();
    if (sk != null && index.hasSortKey()
        && (sk.multiAttribute() || index.sortKey().multiAttribute()) && sk.size() != index.sortKey().size()) {
      diagnostics.cardinality(path + ".sk_template", "mapping for index '" + index.name() + "' supplies " + sk.size()
          + " sort key template(s), the index declares " + index.sortKey().size() + " attribute(s)");
    }
  }

  /**
   * Range queries take the partition key values followed by the range values, counted over
   * all parameters of the pattern. A table partition key is one value; an index partition key
   * takes one value per attribute. A multi-attribute index sort key may also take equality
   * values for leading sort attributes before the ranged one.
   */
  private void checkRangeParameters(EntityLocation loc, AccessPatternDefinition pattern, String path,
      Diagnostics diagnostics) {
    Optional<RangeCondition> range = pattern.rangeConditionKind();
    if (range.isEmpty() || pattern.operationKind().orElse(null) != Operation.QUERY) return;
    // an empty parameter list is a structural error already
    if (pattern.parameters().isEmpty()) return;

    int pkCount = 1;
    int maxExtra = 0;
    boolean exact = true;
    String target = "table " + loc.table().name();
    if (pattern.usesIndex()) {
      Optional<IndexDefinition> index = loc.table().index(pattern.indexName());
      if (index.isEmpty()) return;
      pkCount = index.get().partitionKey().size();
      if (index.get().hasSortKey()) {
        maxExtra = Math.max(0, index.get().sortKey().size() - 1);
      }
      exact = false;
      target = "index " + pattern.indexName();
    }

    int actual = pattern.parameters().size();
    int min = pkCount + range.get().valueCount();
    int max = min + maxExtra;
    if (actual < min || actual > max) {
      String expected = min == max ? String.valueOf(min) : min + "-" + max;
      diagnostics.cardinality(path + ".parameters", "pattern '" + pattern.name() + "' uses range condition '"
          + pattern.rangeCondition() + "' on " + target + " and needs " + (exact ? "exactly " : "") + expected
          + " parameter(s) (" + pkCount + " partition key + " + range.get().valueCount() + " range"
          + (maxExtra > 0 ? ", up to " + maxExtra + " leading sort key equalities" : "") + "), found " + actual);
    }
  }
}
