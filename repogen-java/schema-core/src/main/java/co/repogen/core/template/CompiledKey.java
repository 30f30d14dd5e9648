package co.repogen.core.template;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A compiled partition or sort key: one template, or 1-4 independent templates for
 * multi-attribute index keys.
 */
public record CompiledKey(List<KeyTemplate> parts, boolean multiAttribute) {

  public CompiledKey {
    parts = List.copyOf(parts);
    if (parts.isEmpty()) throw new IllegalArgumentException("a key needs at least one template");
  }

  public static CompiledKey single(KeyTemplate template) {
    return new CompiledKey(List.of(template), false);
  }

  public KeyTemplate first() {
    return parts.get(0);
  }

  public int size() {
    return parts.size();
  }

  public List<String> fieldNames() {
    Set<String> names = new LinkedHashSet<>();
    for (KeyTemplate t : parts) names.addAll(t.fieldNames());
    return new ArrayList<>(names);
  }

  /**
   * Build the key value. Multi-attribute keys yield an ordered list of per-attribute values.
   */
  public Object apply(Map<String, ?> values) {
    if (!multiAttribute) return parts.get(0).apply(values);
    List<Object> tuple = new ArrayList<>(parts.size());
    for (KeyTemplate t : parts) tuple.add(t.apply(values));
    return List.copyOf(tuple);
  }
}
