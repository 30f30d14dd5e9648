package co.repogen.generators;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * DynamoDB request pieces for one access pattern or transaction item, independent of the
 * target language.
 *
 * @param key            primary key attributes, for item operations
 * @param attributes     non-key attributes written from scalar parameters
 * @param keyCondition   Query key condition, or null
 * @param filter         filter expression, or null
 * @param update         SET expression over {@code attributes}, or null
 * @param updateEntity   entity parameter whose non-key attributes are all written, or null
 * @param condition      condition expression, or null
 * @param names          expression attribute name placeholders
 * @param values         expression attribute value placeholders
 */
public record ExpressionPlan(
    List<NamedValue> key,
    List<NamedValue> attributes,
    String keyCondition,
    String filter,
    String update,
    String updateEntity,
    String condition,
    Map<String, String> names,
    List<NamedValue> values
) {

    /** An attribute, or a name or value placeholder, with the value that fills it. */
    public record NamedValue(String name, ValueSource source) {
    }

    public ExpressionPlan {
        key = List.copyOf(key);
        attributes = List.copyOf(attributes);
        names = Collections.unmodifiableMap(new LinkedHashMap<>(names));
        values = List.copyOf(values);
    }

    public boolean hasNames() {
        return !names.isEmpty();
    }

    public boolean hasValues() {
        return !values.isEmpty();
    }
}
