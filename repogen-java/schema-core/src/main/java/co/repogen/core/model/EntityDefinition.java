package co.repogen.core.model;

import java.util.List;
import java.util.Optional;

/**
 * An entity type stored in a table.
 *
 * @param name        unique across the whole document
 * @param entityType  discriminator tag written to items
 * @param skTemplate  null when the table has no sort key
 */
public record EntityDefinition(
    String name,
    String entityType,
    String pkTemplate,
    String skTemplate,
    List<IndexKeyMapping> indexMappings,
    List<FieldDefinition> fields,
    List<AccessPatternDefinition> accessPatterns
) {

  public EntityDefinition {
    indexMappings = List.copyOf(indexMappings);
    fields = List.copyOf(fields);
    accessPatterns = List.copyOf(accessPatterns);
  }

  public Optional<FieldDefinition> field(String fieldName) {
    return fields.stream().filter(f -> fieldName.equals(f.name())).findFirst();
  }

  public List<String> fieldNames() {
    return fields.stream().map(FieldDefinition::name).toList();
  }

  public Optional<IndexKeyMapping> indexMapping(String indexName) {
    return indexMappings.stream().filter(m -> indexName.equals(m.indexName())).findFirst();
  }
}
