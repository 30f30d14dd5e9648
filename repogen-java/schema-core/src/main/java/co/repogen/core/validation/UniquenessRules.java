package co.repogen.core.validation;

import co.repogen.core.diagnostics.Diagnostics;
import co.repogen.core.model.AccessPatternDefinition;
import co.repogen.core.model.CrossTableTransactionPattern;
import co.repogen.core.model.EntityDefinition;
import co.repogen.core.model.ParameterDefinition;
import co.repogen.core.model.SchemaDocument;
import co.repogen.core.model.TableDefinition;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Duplicate names and ids. Each duplicate is reported once, at the later location, naming
 * the first one.
 *
 * <p>Scopes: table names, entity names and pattern ids are global (pattern ids include
 * cross-table patterns); field, index, pattern and parameter names are local to their owner.
 */
public final class UniquenessRules implements ValidationRule {

  @Override
  public String name() {
    return "uniqueness";
  }

  @Override
  public void check(SchemaDocument document, Diagnostics diagnostics) {
    Map<String, String> tables = new HashMap<>();
    Map<String, String> entities = new HashMap<>();
    Map<Integer, String> patternIds = new HashMap<>();

    for (int t = 0; t < document.tables().size(); t++) {
      TableDefinition table = document.tables().get(t);
      String tablePath = EntityLocation.tablePath(t);
      claim(tables, table.name(), tablePath + ".table_config.table_name", "table name", diagnostics);

      Map<String, String> indexes = new HashMap<>();
      for (int g = 0; g < table.indexes().size(); g++) {
        claim(indexes, table.indexes().get(g).name(), EntityLocation.indexPath(t, g) + ".name",
            "index name in table " + table.name(), diagnostics);
      }
    }

    for (EntityLocation loc : EntityLocation.all(document)) {
      EntityDefinition entity = loc.entity();
      claim(entities, entity.name(), loc.path(), "entity name", diagnostics);

      Map<String, String> fields = new HashMap<>();
      for (int f = 0; f < entity.fields().size(); f++) {
        claim(fields, entity.fields().get(f).name(), loc.fieldPath(f) + ".name",
            "field name in entity " + entity.name(), diagnostics);
      }

      Map<String, String> mappings = new HashMap<>();
      for (int m = 0; m < entity.indexMappings().size(); m++) {
        claim(mappings, entity.indexMappings().get(m).indexName(), loc.mappingPath(m) + ".name",
            "index mapping in entity " + entity.name(), diagnostics);
      }

      Map<String, String> patternNames = new HashMap<>();
      for (int p = 0; p < entity.accessPatterns().size(); p++) {
        AccessPatternDefinition pattern = entity.accessPatterns().get(p);
        String path = loc.patternPath(p);
        claim(patternNames, pattern.name(), path + ".name", "pattern name in entity " + entity.name(), diagnostics);
        claimId(patternIds, pattern.patternId(), path + ".pattern_id", diagnostics);
        checkParameters(pattern.parameters(), path, pattern.name(), diagnostics);
      }
    }

    for (int c = 0; c < document.crossTablePatterns().size(); c++) {
      CrossTableTransactionPattern pattern = document.crossTablePatterns().get(c);
      String path = EntityLocation.crossTablePath(c);
      claimId(patternIds, pattern.patternId(), path + ".pattern_id", diagnostics);
      checkParameters(pattern.parameters(), path, pattern.name(), diagnostics);
    }
  }

  private void checkParameters(List<ParameterDefinition> parameters, String path, String patternName,
      Diagnostics diagnostics) {
    Map<String, String> names = new HashMap<>();
    for (int i = 0; i < parameters.size(); i++) {
      claim(names, parameters.get(i).name(), path + ".parameters[" + i + "].name",
          "parameter name in pattern " + patternName, diagnostics);
    }
  }

  private static void claim(Map<String, String> seen, String name, String path, String what, Diagnostics diagnostics) {
    if (name == null) return;
    String first = seen.putIfAbsent(name, path);
    if (first != null) {
      diagnostics.uniqueness(path, first, "duplicate " + what + " '" + name + "', first declared at " + first, name);
    }
  }

  private static void claimId(Map<Integer, String> seen, Integer id, String path, Diagnostics diagnostics) {
    if (id == null) return;
    String first = seen.putIfAbsent(id, path);
    if (first != null) {
      diagnostics.uniqueness(path, first, "duplicate pattern_id " + id + ", first declared at " + first,
          String.valueOf(id));
    }
  }
}
