package co.repogen.core.usage;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Illustrative values for one entity.
 *
 * @param sample     values for create examples ({@code sample_data})
 * @param alternate  values for access pattern examples ({@code access_pattern_data})
 * @param update     values for update examples ({@code update_data})
 */
public record EntityUsage(Map<String, Object> sample, Map<String, Object> alternate, Map<String, Object> update) {

  public EntityUsage {
    sample = freeze(sample);
    alternate = freeze(alternate);
    update = freeze(update);
  }

  private static Map<String, Object> freeze(Map<String, Object> values) {
    return values == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }
}
