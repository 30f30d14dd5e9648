package co.repogen.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A global secondary index of a table.
 *
 * @param projection          raw projection value, {@code ALL} when omitted
 * @param includedAttributes  non-null only when the document lists them
 */
public record IndexDefinition(
    String name,
    KeySpec partitionKey,
    KeySpec sortKey,
    String projection,
    List<String> includedAttributes
) {

  public IndexDefinition {
    includedAttributes = includedAttributes == null ? null : List.copyOf(includedAttributes);
  }

  public Optional<ProjectionKind> projectionKind() {
    return ProjectionKind.of(projection);
  }

  public boolean hasSortKey() {
    return sortKey != null && sortKey.size() > 0;
  }

  /** Partition and sort key attribute names. */
  public List<String> keyAttributes() {
    List<String> keys = new ArrayList<>();
    if (partitionKey != null) keys.addAll(partitionKey.values());
    if (sortKey != null) keys.addAll(sortKey.values());
    return keys;
  }
}
