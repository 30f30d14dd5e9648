package co.repogen.core.resolve;

import co.repogen.core.model.IndexDefinition;
import co.repogen.core.template.CompiledKey;

/**
 * An entity's compiled keys for one secondary index.
 *
 * @param sortKey          null when the entity or index sets no sort key
 * @param rawProjection    reads through this index cannot rebuild the entity
 */
public record ResolvedIndexKey(IndexDefinition index, CompiledKey partitionKey, CompiledKey sortKey,
    boolean rawProjection) {

  public String indexName() {
    return index.name();
  }
}
