package co.repogen.core.usage;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Per-entity illustrative values used by generated usage examples. Read leniently;
 * {@link co.repogen.core.validation.UsageDataValidator} reports problems.
 */
public record UsageData(Map<String, EntityUsage> entities) {
  public static final String SAMPLE = "sample_data";
  public static final String ALTERNATE = "access_pattern_data";
  public static final String UPDATE = "update_data";

  private static final ObjectMapper JSON = new ObjectMapper();
  private static final TypeReference<Map<String, Object>> VALUES = new TypeReference<>() {};

  public UsageData {
    entities = Collections.unmodifiableMap(new LinkedHashMap<>(entities));
  }

  public static UsageData empty() {
    return new UsageData(Map.of());
  }

  public static UsageData from(JsonNode root) {
    Map<String, EntityUsage> out = new LinkedHashMap<>();
    if (root == null || !root.path("entities").isObject()) return new UsageData(out);
    Iterator<Map.Entry<String, JsonNode>> it = root.get("entities").fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> e = it.next();
      JsonNode node = e.getValue();
      out.put(e.getKey(), new EntityUsage(section(node, SAMPLE), section(node, ALTERNATE), section(node, UPDATE)));
    }
    return new UsageData(out);
  }

  private static Map<String, Object> section(JsonNode entity, String name) {
    JsonNode node = entity.path(name);
    return node.isObject() ? JSON.convertValue(node, VALUES) : Map.of();
  }

  public Optional<EntityUsage> entity(String name) {
    return Optional.ofNullable(entities.get(name));
  }

  public boolean isEmpty() {
    return entities.isEmpty();
  }
}
