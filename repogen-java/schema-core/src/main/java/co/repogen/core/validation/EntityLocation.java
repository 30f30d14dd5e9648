package co.repogen.core.validation;

import co.repogen.core.model.EntityDefinition;
import co.repogen.core.model.SchemaDocument;
import co.repogen.core.model.TableDefinition;

import java.util.ArrayList;
import java.util.List;

/**
 * An entity together with its owning table and document path.
 */
record EntityLocation(int tableIndex, TableDefinition table, EntityDefinition entity) {

  static List<EntityLocation> all(SchemaDocument document) {
    List<EntityLocation> out = new ArrayList<>();
    for (int t = 0; t < document.tables().size(); t++) {
      TableDefinition table = document.tables().get(t);
      for (EntityDefinition entity : table.entities()) {
        out.add(new EntityLocation(t, table, entity));
      }
    }
    return out;
  }

  static String tablePath(int tableIndex) {
    return "tables[" + tableIndex + "]";
  }

  static String indexPath(int tableIndex, int indexIndex) {
    return tablePath(tableIndex) + ".gsi_list[" + indexIndex + "]";
  }

  static String crossTablePath(int patternIndex) {
    return "cross_table_access_patterns[" + patternIndex + "]";
  }

  String path() {
    return tablePath(tableIndex) + ".entities." + entity.name();
  }

  String fieldPath(int i) {
    return path() + ".fields[" + i + "]";
  }

  String mappingPath(int i) {
    return path() + ".gsi_mappings[" + i + "]";
  }

  String patternPath(int i) {
    return path() + ".access_patterns[" + i + "]";
  }
}
