package co.repogen.core.resolve;

import co.repogen.core.model.TableDefinition;

import java.util.List;

public record ResolvedTable(TableDefinition definition, List<ResolvedEntity> entities) {

  public ResolvedTable {
    entities = List.copyOf(entities);
  }

  public String name() {
    return definition.name();
  }
}
