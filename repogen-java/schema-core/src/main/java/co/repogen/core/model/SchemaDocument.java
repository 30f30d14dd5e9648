package co.repogen.core.model;

import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Root of a loaded schema. Immutable.
 */
public record SchemaDocument(List<TableDefinition> tables, List<CrossTableTransactionPattern> crossTablePatterns) {

  public SchemaDocument {
    tables = List.copyOf(tables);
    crossTablePatterns = List.copyOf(crossTablePatterns);
  }

  public static SchemaDocument empty() {
    return new SchemaDocument(List.of(), List.of());
  }

  public Optional<TableDefinition> table(String tableName) {
    return tables.stream().filter(t -> tableName.equals(t.name())).findFirst();
  }

  public Stream<EntityDefinition> entities() {
    return tables.stream().flatMap(t -> t.entities().stream());
  }

  public List<String> tableNames() {
    return tables.stream().map(TableDefinition::name).toList();
  }

  public List<String> entityNames() {
    return entities().map(EntityDefinition::name).toList();
  }
}
