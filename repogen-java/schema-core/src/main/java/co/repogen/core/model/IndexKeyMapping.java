package co.repogen.core.model;

/**
 * How an entity populates the keys of one secondary index.
 *
 * @param indexName   name in the table's {@code gsi_list}
 * @param pkTemplate  partition key template(s)
 * @param skTemplate  sort key template(s), null when the entity sets none
 */
public record IndexKeyMapping(String indexName, KeySpec pkTemplate, KeySpec skTemplate) {
}
