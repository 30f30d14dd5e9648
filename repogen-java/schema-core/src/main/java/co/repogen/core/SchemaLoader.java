package co.repogen.core;

import co.repogen.core.diagnostics.Diagnostics;
import co.repogen.core.model.AccessPatternDefinition;
import co.repogen.core.model.CrossTableTransactionPattern;
import co.repogen.core.model.EntityDefinition;
import co.repogen.core.model.FieldDefinition;
import co.repogen.core.model.FilterCondition;
import co.repogen.core.model.FilterExpressionSpec;
import co.repogen.core.model.IndexDefinition;
import co.repogen.core.model.IndexKeyMapping;
import co.repogen.core.model.KeySpec;
import co.repogen.core.model.ParameterDefinition;
import co.repogen.core.model.ProjectionKind;
import co.repogen.core.model.SchemaDocument;
import co.repogen.core.model.TableDefinition;
import co.repogen.core.model.TransactionParticipant;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Reads a schema document into a {@link SchemaDocument}.
 *
 * <p>Checks shape only: JSON types, required keys and non-empty required arrays. Names and
 * enum values are kept as written for the validator. Unknown keys are ignored. Problems are
 * reported as structural diagnostics; nothing in a document makes this class throw.
 */
public final class SchemaLoader {
  private static final Logger log = LoggerFactory.getLogger(SchemaLoader.class);
  private static final ObjectMapper JSON = new ObjectMapper();

  private SchemaLoader() {
  }

  public static LoadResult load(Path path) throws IOException {
    return load(Files.readString(path));
  }

  public static LoadResult load(String json) {
    JsonNode root;
    try {
      root = JSON.readTree(json);
    } catch (JsonProcessingException e) {
      Diagnostics diagnostics = new Diagnostics();
      diagnostics.structural("$", "malformed JSON: " + e.getOriginalMessage());
      return new LoadResult(SchemaDocument.empty(), diagnostics);
    }
    return load(root);
  }

  public static LoadResult load(JsonNode root) {
    Diagnostics diagnostics = new Diagnostics();
    SchemaDocument document = new Reader(diagnostics).document(root);
    log.debug("Loaded schema with {} table(s), {} structural problem(s)", document.tables().size(), diagnostics.size());
    return new LoadResult(document, diagnostics);
  }

  /** Converts a raw {@code Map}/{@code List} tree into a {@link JsonNode} first. */
  public static LoadResult load(Map<String, ?> document) {
    JsonNode root = JSON.valueToTree(document);
    return load(root);
  }

  private static final class Reader {
    private final Diagnostics diagnostics;

    Reader(Diagnostics diagnostics) {
      this.diagnostics = diagnostics;
    }

    SchemaDocument document(JsonNode root) {
      if (root == null || !root.isObject()) {
        diagnostics.structural("$", "schema document must be a JSON object");
        return SchemaDocument.empty();
      }
      JsonNode tablesNode = root.get("tables");
      if (tablesNode == null || tablesNode.isNull()) {
        diagnostics.structural("tables", "missing required section 'tables'");
        return SchemaDocument.empty();
      }
      if (!tablesNode.isArray()) {
        diagnostics.structural("tables", "'tables' must be an array");
        return SchemaDocument.empty();
      }
      JsonNode crossNode = root.get("cross_table_access_patterns");
      if (crossNode != null && !crossNode.isNull() && !crossNode.isArray()) {
        diagnostics.structural("cross_table_access_patterns", "'cross_table_access_patterns' must be an array");
        return SchemaDocument.empty();
      }
      if (tablesNode.isEmpty()) {
        diagnostics.structural("tables", "'tables' must not be empty");
      }

      List<TableDefinition> tables = new ArrayList<>();
      for (int i = 0; i < tablesNode.size(); i++) {
        TableDefinition t = table(tablesNode.get(i), "tables[" + i + "]");
        if (t != null) tables.add(t);
      }

      List<CrossTableTransactionPattern> cross = new ArrayList<>();
      if (crossNode != null && crossNode.isArray()) {
        for (int i = 0; i < crossNode.size(); i++) {
          CrossTableTransactionPattern p = crossTablePattern(crossNode.get(i), "cross_table_access_patterns[" + i + "]");
          if (p != null) cross.add(p);
        }
      }
      return new SchemaDocument(tables, cross);
    }

    // =========================================================================
    // Tables and indexes
    // =========================================================================

    private TableDefinition table(JsonNode node, String path) {
      if (!requireObject(node, path, "table")) return null;
      JsonNode config = node.get("table_config");
      String name = null;
      String pk = null;
      String sk = null;
      if (requireObject(config, path + ".table_config", "table_config")) {
        name = requiredText(config, "table_name", path + ".table_config");
        pk = requiredText(config, "partition_key", path + ".table_config");
        sk = optionalText(config, "sort_key", path + ".table_config");
      }
      if (name == null) return null;

      List<IndexDefinition> indexes = new ArrayList<>();
      JsonNode gsiList = optionalArray(node, "gsi_list", path);
      if (gsiList != null) {
        for (int g = 0; g < gsiList.size(); g++) {
          IndexDefinition index = index(gsiList.get(g), path + ".gsi_list[" + g + "]");
          if (index != null) indexes.add(index);
        }
      }

      List<EntityDefinition> entities = new ArrayList<>();
      JsonNode entitiesNode = node.get("entities");
      String entitiesPath = path + ".entities";
      if (entitiesNode == null || entitiesNode.isNull()) {
        diagnostics.structural(entitiesPath, "missing required key 'entities'");
      } else if (!entitiesNode.isObject()) {
        diagnostics.structural(entitiesPath, "'entities' must be an object keyed by entity name");
      } else {
        if (entitiesNode.isEmpty()) diagnostics.structural(entitiesPath, "'entities' must not be empty");
        Iterator<Map.Entry<String, JsonNode>> it = entitiesNode.fields();
        while (it.hasNext()) {
          Map.Entry<String, JsonNode> e = it.next();
          EntityDefinition entity = entity(e.getKey(), e.getValue(), entitiesPath + "." + e.getKey());
          if (entity != null) entities.add(entity);
        }
      }
      return new TableDefinition(name, pk, sk, indexes, entities);
    }

    private IndexDefinition index(JsonNode node, String path) {
      if (!requireObject(node, path, "gsi")) return null;
      String name = requiredText(node, "name", path);
      KeySpec pk = keySpec(node, "partition_key", path, true);
      KeySpec sk = keySpec(node, "sort_key", path, false);
      String projection = optionalText(node, "projection", path);
      List<String> included = optionalTextArray(node, "included_attributes", path);
      if (name == null || pk == null) return null;
      return new IndexDefinition(name, pk, sk, projection == null ? ProjectionKind.ALL.wire() : projection, included);
    }

    // =========================================================================
    // Entities
    // =========================================================================

    private EntityDefinition entity(String name, JsonNode node, String path) {
      if (!requireObject(node, path, "entity")) return null;
      String entityType = requiredText(node, "entity_type", path);
      String pkTemplate = requiredText(node, "pk_template", path);
      String skTemplate = optionalText(node, "sk_template", path);

      List<IndexKeyMapping> mappings = new ArrayList<>();
      JsonNode mappingsNode = optionalArray(node, "gsi_mappings", path);
      if (mappingsNode != null) {
        for (int m = 0; m < mappingsNode.size(); m++) {
          IndexKeyMapping mapping = mapping(mappingsNode.get(m), path + ".gsi_mappings[" + m + "]");
          if (mapping != null) mappings.add(mapping);
        }
      }

      List<FieldDefinition> fields = new ArrayList<>();
      JsonNode fieldsNode = requiredArray(node, "fields", path, true);
      if (fieldsNode != null) {
        for (int f = 0; f < fieldsNode.size(); f++) {
          FieldDefinition field = field(fieldsNode.get(f), path + ".fields[" + f + "]");
          if (field != null) fields.add(field);
        }
      }

      List<AccessPatternDefinition> patterns = new ArrayList<>();
      JsonNode patternsNode = optionalArray(node, "access_patterns", path);
      if (patternsNode != null) {
        for (int p = 0; p < patternsNode.size(); p++) {
          AccessPatternDefinition pattern = accessPattern(patternsNode.get(p), path + ".access_patterns[" + p + "]");
          if (pattern != null) patterns.add(pattern);
        }
      }
      return new EntityDefinition(name, entityType, pkTemplate, skTemplate, mappings, fields, patterns);
    }

    private IndexKeyMapping mapping(JsonNode node, String path) {
      if (!requireObject(node, path, "gsi mapping")) return null;
      String name = requiredText(node, "name", path);
      KeySpec pk = keySpec(node, "pk_template", path, true);
      KeySpec sk = keySpec(node, "sk_template", path, false);
      if (name == null || pk == null) return null;
      return new IndexKeyMapping(name, pk, sk);
    }

    private FieldDefinition field(JsonNode node, String path) {
      if (!requireObject(node, path, "field")) return null;
      String name = requiredText(node, "name", path);
      String type = requiredText(node, "type", path);
      Boolean required = requiredBoolean(node, "required", path);
      String itemType = optionalText(node, "item_type", path);
      if (name == null) return null;
      return new FieldDefinition(name, type, Boolean.TRUE.equals(required), itemType);
    }

    // =========================================================================
    // Access patterns
    // =========================================================================

    private AccessPatternDefinition accessPattern(JsonNode node, String path) {
      if (!requireObject(node, path, "access pattern")) return null;
      Integer id = requiredInt(node, "pattern_id", path);
      String name = requiredText(node, "name", path);
      String description = requiredText(node, "description", path);
      String operation = requiredText(node, "operation", path);
      String returnType = requiredText(node, "return_type", path);
      String indexName = optionalText(node, "index_name", path);
      String range = optionalText(node, "range_condition", path);
      Boolean consistentRead = optionalBoolean(node, "consistent_read", path);
      FilterExpressionSpec filter = null;
      if (node.has("filter_expression") && !node.get("filter_expression").isNull()) {
        filter = filterExpression(node.get("filter_expression"), path + ".filter_expression");
      }
      List<ParameterDefinition> parameters = parameters(node, path, false);
      if (name == null) return null;
      return new AccessPatternDefinition(id, name, description, operation, indexName, range, consistentRead,
          filter, parameters, returnType);
    }

    private List<ParameterDefinition> parameters(JsonNode node, String path, boolean required) {
      List<ParameterDefinition> out = new ArrayList<>();
      JsonNode params = required ? requiredArray(node, "parameters", path, false) : optionalArray(node, "parameters", path);
      if (params == null) return out;
      for (int i = 0; i < params.size(); i++) {
        String pPath = path + ".parameters[" + i + "]";
        JsonNode p = params.get(i);
        if (!requireObject(p, pPath, "parameter")) continue;
        String name = requiredText(p, "name", pPath);
        String type = requiredText(p, "type", pPath);
        String entityType = optionalText(p, "entity_type", pPath);
        if (name != null) out.add(new ParameterDefinition(name, type, entityType));
      }
      return out;
    }

    private FilterExpressionSpec filterExpression(JsonNode node, String path) {
      if (!requireObject(node, path, "filter_expression")) return null;
      JsonNode conditionsNode = requiredArray(node, "conditions", path, true);
      String logical = optionalText(node, "logical_operator", path);
      List<FilterCondition> conditions = new ArrayList<>();
      if (conditionsNode != null) {
        for (int i = 0; i < conditionsNode.size(); i++) {
          String cPath = path + ".conditions[" + i + "]";
          JsonNode c = conditionsNode.get(i);
          if (!requireObject(c, cPath, "filter condition")) continue;
          String field = requiredText(c, "field", cPath);
          if (field == null) continue;
          conditions.add(new FilterCondition(
              field,
              optionalText(c, "operator", cPath),
              optionalText(c, "function", cPath),
              optionalText(c, "param", cPath),
              optionalText(c, "param2", cPath),
              optionalTextArray(c, "params", cPath)));
        }
      }
      return new FilterExpressionSpec(conditions, logical);
    }

    private CrossTableTransactionPattern crossTablePattern(JsonNode node, String path) {
      if (!requireObject(node, path, "cross-table pattern")) return null;
      Integer id = requiredInt(node, "pattern_id", path);
      String name = requiredText(node, "name", path);
      String description = requiredText(node, "description", path);
      String operation = requiredText(node, "operation", path);
      String returnType = requiredText(node, "return_type", path);
      List<TransactionParticipant> participants = new ArrayList<>();
      JsonNode involved = requiredArray(node, "entities_involved", path, true);
      if (involved != null) {
        for (int i = 0; i < involved.size(); i++) {
          String iPath = path + ".entities_involved[" + i + "]";
          JsonNode p = involved.get(i);
          if (!requireObject(p, iPath, "participant")) continue;
          String table = requiredText(p, "table", iPath);
          String entity = requiredText(p, "entity", iPath);
          String action = requiredText(p, "action", iPath);
          String condition = optionalText(p, "condition", iPath);
          if (table != null && entity != null) {
            participants.add(new TransactionParticipant(table, entity, action, condition));
          }
        }
      }
      List<ParameterDefinition> parameters = parameters(node, path, true);
      if (name == null) return null;
      return new CrossTableTransactionPattern(id, name, description, operation, participants, parameters, returnType);
    }

    // =========================================================================
    // Shape helpers
    // =========================================================================

    private boolean requireObject(JsonNode node, String path, String what) {
      if (node == null || node.isNull()) {
        diagnostics.structural(path, "missing " + what);
        return false;
      }
      if (!node.isObject()) {
        diagnostics.structural(path, what + " must be an object");
        return false;
      }
      return true;
    }

    private String requiredText(JsonNode node, String key, String path) {
      JsonNode v = node.get(key);
      if (v == null || v.isNull()) {
        diagnostics.structural(path + "." + key, "missing required key '" + key + "'");
        return null;
      }
      if (!v.isTextual()) {
        diagnostics.structural(path + "." + key, "'" + key + "' must be a string");
        return null;
      }
      if (v.asText().isEmpty()) {
        diagnostics.structural(path + "." + key, "'" + key + "' must not be empty");
        return null;
      }
      return v.asText();
    }

    private String optionalText(JsonNode node, String key, String path) {
      JsonNode v = node.get(key);
      if (v == null || v.isNull()) return null;
      if (!v.isTextual()) {
        diagnostics.structural(path + "." + key, "'" + key + "' must be a string");
        return null;
      }
      return v.asText();
    }

    private Integer requiredInt(JsonNode node, String key, String path) {
      JsonNode v = node.get(key);
      if (v == null || v.isNull()) {
        diagnostics.structural(path + "." + key, "missing required key '" + key + "'");
        return null;
      }
      if (!v.isIntegralNumber() || !v.canConvertToInt()) {
        diagnostics.structural(path + "." + key, "'" + key + "' must be an integer");
        return null;
      }
      return v.intValue();
    }

    private Boolean requiredBoolean(JsonNode node, String key, String path) {
      JsonNode v = node.get(key);
      if (v == null || v.isNull()) {
        diagnostics.structural(path + "." + key, "missing required key '" + key + "'");
        return null;
      }
      return booleanValue(v, key, path);
    }

    private Boolean optionalBoolean(JsonNode node, String key, String path) {
      JsonNode v = node.get(key);
      if (v == null || v.isNull()) return null;
      return booleanValue(v, key, path);
    }

    private Boolean booleanValue(JsonNode v, String key, String path) {
      if (!v.isBoolean()) {
        diagnostics.structural(path + "." + key, "'" + key + "' must be a boolean");
        return null;
      }
      return v.booleanValue();
    }

    private JsonNode requiredArray(JsonNode node, String key, String path, boolean nonEmpty) {
      JsonNode v = node.get(key);
      if (v == null || v.isNull()) {
        diagnostics.structural(path + "." + key, "missing required key '" + key + "'");
        return null;
      }
      if (!v.isArray()) {
        diagnostics.structural(path + "." + key, "'" + key + "' must be an array");
        return null;
      }
      if (nonEmpty && v.isEmpty()) {
        diagnostics.structural(path + "." + key, "'" + key + "' must not be empty");
      }
      return v;
    }

    private JsonNode optionalArray(JsonNode node, String key, String path) {
      JsonNode v = node.get(key);
      if (v == null || v.isNull()) return null;
      if (!v.isArray()) {
        diagnostics.structural(path + "." + key, "'" + key + "' must be an array");
        return null;
      }
      return v;
    }

    private List<String> optionalTextArray(JsonNode node, String key, String path) {
      JsonNode v = optionalArray(node, key, path);
      if (v == null) return null;
      List<String> out = new ArrayList<>();
      for (int i = 0; i < v.size(); i++) {
        JsonNode e = v.get(i);
        if (e.isTextual()) out.add(e.asText());
        else diagnostics.structural(path + "." + key + "[" + i + "]", "'" + key + "' entries must be strings");
      }
      return out;
    }

    /**
     * A key attribute or template: a string, or an array of strings for multi-attribute keys.
     * Array length is checked by the validator, not here.
     */
    private KeySpec keySpec(JsonNode node, String key, String path, boolean required) {
      JsonNode v = node.get(key);
      String keyPath = path + "." + key;
      if (v == null || v.isNull()) {
        if (required) diagnostics.structural(keyPath, "missing required key '" + key + "'");
        return null;
      }
      if (v.isTextual()) {
        if (v.asText().isEmpty()) {
          diagnostics.structural(keyPath, "'" + key + "' must not be empty");
          return null;
        }
        return KeySpec.single(v.asText());
      }
      if (v.isArray()) {
        List<String> values = new ArrayList<>();
        boolean ok = true;
        for (int i = 0; i < v.size(); i++) {
          JsonNode e = v.get(i);
          if (e.isTextual() && !e.asText().isEmpty()) {
            values.add(e.asText());
          } else {
            diagnostics.structural(keyPath + "[" + i + "]", "'" + key + "' entries must be non-empty strings");
            ok = false;
          }
        }
        return ok ? KeySpec.multi(values) : null;
      }
      diagnostics.structural(keyPath, "'" + key + "' must be a string or an array of strings");
      return null;
    }
  }
}
