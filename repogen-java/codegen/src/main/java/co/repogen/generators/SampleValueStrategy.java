package co.repogen.generators;

import co.repogen.core.Names;
import co.repogen.core.model.EntityDefinition;
import co.repogen.core.model.FieldDefinition;
import co.repogen.core.model.FieldKind;
import co.repogen.core.usage.EntityUsage;
import co.repogen.core.usage.UsageData;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Picks illustrative values for usage examples: usage data first, then guesses from the
 * name, then a default for the type.
 */
public class SampleValueStrategy {
    public static final String SAMPLE_UUID = "123e4567-e89b-12d3-a456-426614174000";
    public static final String SAMPLE_TIMESTAMP = "2024-01-01T00:00:00Z";
    public static final String RANGE_START_DATE = "2024-01-01";
    public static final String RANGE_END_DATE = "2024-12-31";

    private static final List<String> LOWER_BOUND_WORDS = List.of("start", "min", "from", "since", "after", "begin");
    private static final List<String> UPPER_BOUND_WORDS = List.of("end", "max", "to", "until", "before");

    /**
     * Values for a complete sample entity: every required field, plus optional fields the
     * usage data provides. Field order follows the entity.
     */
    public Map<String, Object> entityValues(EntityDefinition entity, UsageData usage) {
        Map<String, Object> sample = usage.entity(entity.name()).map(EntityUsage::sample).orElse(Map.of());
        Map<String, Object> values = new LinkedHashMap<>();
        for (FieldDefinition field : entity.fields()) {
            FieldKind kind = field.kind().orElse(FieldKind.STRING);
            if (sample.containsKey(field.name())) {
                values.put(field.name(), sample.get(field.name()));
            } else if (field.required()) {
                values.put(field.name(), guess(field.name(), kind));
            }
        }
        return values;
    }

    /**
     * Value for a pattern parameter named {@code name}. Looks in {@code access_pattern_data},
     * then {@code sample_data}, then applies range and name heuristics.
     */
    public Object parameterValue(String entityName, String name, FieldKind kind, UsageData usage) {
        Optional<EntityUsage> data = usage.entity(entityName);
        if (data.isPresent()) {
            if (data.get().alternate().containsKey(name)) return data.get().alternate().get(name);
            if (data.get().sample().containsKey(name)) return data.get().sample().get(name);
        }
        return guess(name, kind);
    }

    /**
     * Value for updating {@code field}: {@code update_data}, then the parameter lookup.
     */
    public Object updateValue(String entityName, String field, FieldKind kind, UsageData usage) {
        Optional<Object> update = usage.entity(entityName)
            .map(EntityUsage::update)
            .filter(m -> m.containsKey(field))
            .map(m -> m.get(field));
        return update.orElseGet(() -> parameterValue(entityName, field, kind, usage));
    }

    /** Usage independent guess from the name and type. */
    public Object guess(String name, FieldKind kind) {
        List<String> words = Names.words(name);
        if (words.stream().anyMatch(LOWER_BOUND_WORDS::contains)) return lowerBound(kind);
        if (words.stream().anyMatch(UPPER_BOUND_WORDS::contains)) return upperBound(kind);
        if (kind == FieldKind.STRING || kind == FieldKind.UUID) {
            return fromName(words, kind).orElseGet(() -> typeDefault(name, kind));
        }
        return typeDefault(name, kind);
    }

    protected Object lowerBound(FieldKind kind) {
        return switch (kind) {
            case INTEGER -> 0L;
            case DECIMAL -> BigDecimal.ZERO;
            default -> RANGE_START_DATE;
        };
    }

    protected Object upperBound(FieldKind kind) {
        return switch (kind) {
            case INTEGER -> 9999L;
            case DECIMAL -> new BigDecimal("9999");
            default -> RANGE_END_DATE;
        };
    }

    protected Optional<Object> fromName(List<String> words, FieldKind kind) {
        if (words.isEmpty()) return Optional.empty();
        String last = words.get(words.size() - 1);
        if (last.equals("id")) {
            if (kind == FieldKind.UUID || words.size() == 1) return Optional.of(SAMPLE_UUID);
            return Optional.of(String.join("-", words.subList(0, words.size() - 1)) + "-001");
        }
        if (words.contains("email")) return Optional.of("user@example.com");
        if (words.contains("status")) return Optional.of("ACTIVE");
        if (last.equals("at") || words.contains("date") || words.contains("time") || words.contains("timestamp")) {
            return Optional.of(SAMPLE_TIMESTAMP);
        }
        if (words.contains("url")) return Optional.of("https://example.com");
        if (words.contains("phone")) return Optional.of("+15550100");
        if (words.contains("name")) return Optional.of("Example " + Names.cap(words.get(0)));
        return Optional.empty();
    }

    protected Object typeDefault(String name, FieldKind kind) {
        return switch (kind) {
            case STRING -> "sample-" + String.join("-", Names.words(name));
            case UUID -> SAMPLE_UUID;
            case INTEGER -> 1L;
            case DECIMAL -> new BigDecimal("9.99");
            case BOOLEAN -> Boolean.TRUE;
            case ARRAY -> List.of();
            case OBJECT -> Map.of();
        };
    }
}
