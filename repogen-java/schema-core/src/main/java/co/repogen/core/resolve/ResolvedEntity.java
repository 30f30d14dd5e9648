package co.repogen.core.resolve;

import co.repogen.core.model.EntityDefinition;
import co.repogen.core.model.TableDefinition;
import co.repogen.core.template.CompiledKey;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * An entity with compiled keys and resolved patterns.
 *
 * @param sortKey              null when the table has no sort key
 * @param itemCollection       shares its partition key template with another entity of the table
 * @param sortKeyPrefix        literal text before the first sort key placeholder
 * @param consistentCrudGet    a folded GetItem pattern asked for strongly consistent reads
 */
public record ResolvedEntity(
    EntityDefinition definition,
    TableDefinition table,
    CompiledKey partitionKey,
    CompiledKey sortKey,
    List<ResolvedIndexKey> indexKeys,
    List<ResolvedPattern> patterns,
    CrudMethods crud,
    boolean itemCollection,
    String sortKeyPrefix,
    boolean consistentCrudGet
) {

  public ResolvedEntity {
    indexKeys = List.copyOf(indexKeys);
    patterns = List.copyOf(patterns);
  }

  public String name() {
    return definition.name();
  }

  public Optional<ResolvedIndexKey> indexKey(String indexName) {
    return indexKeys.stream().filter(k -> k.indexName().equals(indexName)).findFirst();
  }

  /** Patterns that get their own generated method. */
  public List<ResolvedPattern> ownMethods() {
    return patterns.stream().filter(p -> !p.isFolded()).toList();
  }

  public List<String> primaryKeyFields() {
    List<String> fields = new ArrayList<>(partitionKey.fieldNames());
    if (sortKey != null) {
      for (String f : sortKey.fieldNames()) {
        if (!fields.contains(f)) fields.add(f);
      }
    }
    return fields;
  }
}
