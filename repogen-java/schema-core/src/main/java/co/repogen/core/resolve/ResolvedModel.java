package co.repogen.core.resolve;

import java.util.List;
import java.util.stream.Stream;

/**
 * Output of {@link PatternResolver}: everything a renderer needs, read-only.
 */
public record ResolvedModel(
    List<ResolvedTable> tables,
    List<ResolvedTransaction> transactions,
    List<PatternRegistryEntry> registry
) {

  public ResolvedModel {
    tables = List.copyOf(tables);
    transactions = List.copyOf(transactions);
    registry = List.copyOf(registry);
  }

  /** All entities, tables in document order, entities in table order. */
  public List<ResolvedEntity> entities() {
    return tables.stream().flatMap(t -> t.entities().stream()).toList();
  }

  public Stream<ResolvedPattern> patterns() {
    return entities().stream().flatMap(e -> e.patterns().stream());
  }

  public boolean hasTransactions() {
    return !transactions.isEmpty();
  }
}
