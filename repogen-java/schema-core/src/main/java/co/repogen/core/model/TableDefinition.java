package co.repogen.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * @param partitionKey  partition key attribute name
 * @param sortKey       sort key attribute name, null when the table has none
 */
public record TableDefinition(
    String name,
    String partitionKey,
    String sortKey,
    List<IndexDefinition> indexes,
    List<EntityDefinition> entities
) {

  public TableDefinition {
    indexes = List.copyOf(indexes);
    entities = List.copyOf(entities);
  }

  public boolean hasSortKey() {
    return sortKey != null && !sortKey.isEmpty();
  }

  public Optional<IndexDefinition> index(String indexName) {
    return indexes.stream().filter(i -> indexName.equals(i.name())).findFirst();
  }

  public Optional<EntityDefinition> entity(String entityName) {
    return entities.stream().filter(e -> entityName.equals(e.name())).findFirst();
  }

  public List<String> indexNames() {
    return indexes.stream().map(IndexDefinition::name).toList();
  }

  public List<String> entityNames() {
    return entities.stream().map(EntityDefinition::name).toList();
  }

  public List<String> keyAttributes() {
    List<String> keys = new ArrayList<>();
    if (partitionKey != null) keys.add(partitionKey);
    if (hasSortKey()) keys.add(sortKey);
    return keys;
  }
}
