package co.repogen.core.resolve;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Flat description of one access pattern, keyed by pattern id, for driving generated code
 * from an external test harness. Serialized as one entry of {@code access_pattern_mapping.json}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"pattern_id", "description", "entity", "repository", "service", "method_name", "parameters",
    "return_type", "operation", "index_name", "range_condition", "consistent_read", "entities_involved",
    "transaction_type"})
public record PatternRegistryEntry(
    @JsonProperty("pattern_id") int patternId,
    @JsonProperty("description") String description,
    @JsonProperty("entity") String entity,
    @JsonProperty("repository") String repository,
    @JsonProperty("service") String service,
    @JsonProperty("method_name") String methodName,
    @JsonProperty("parameters") List<Parameter> parameters,
    @JsonProperty("return_type") String returnType,
    @JsonProperty("operation") String operation,
    @JsonProperty("index_name") String indexName,
    @JsonProperty("range_condition") String rangeCondition,
    @JsonProperty("consistent_read") Boolean consistentRead,
    @JsonProperty("entities_involved") List<Participant> entitiesInvolved,
    @JsonProperty("transaction_type") String transactionType
) {
  public static final String TRANSACTION_SERVICE = "TransactionService";
  public static final String CROSS_TABLE = "cross_table";

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record Parameter(
      @JsonProperty("name") String name,
      @JsonProperty("type") String type,
      @JsonProperty("entity_type") String entityType
  ) {
  }

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record Participant(
      @JsonProperty("table") String table,
      @JsonProperty("entity") String entity,
      @JsonProperty("action") String action
  ) {
  }

  public boolean isTransaction() {
    return CROSS_TABLE.equals(transactionType);
  }

  /** Copy with the method name spelled for a target language. */
  public PatternRegistryEntry withMethodName(String name) {
    return new PatternRegistryEntry(patternId, description, entity, repository, service, name, parameters,
        returnType, operation, indexName, rangeCondition, consistentRead, entitiesInvolved, transactionType);
  }
}
