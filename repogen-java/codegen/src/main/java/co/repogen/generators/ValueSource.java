package co.repogen.generators;

import co.repogen.core.template.KeyTemplate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Where a generated method gets one expression value from.
 *
 * @param template         key template to apply, for {@link Kind#TEMPLATE} and {@link Kind#ENTITY_TEMPLATE}
 * @param bindings         template field to parameter name, for {@link Kind#TEMPLATE}
 * @param entityParameter  entity parameter whose fields fill the template, for {@link Kind#ENTITY_TEMPLATE}
 * @param parameter        parameter passed through, for {@link Kind#PARAMETER}
 * @param literal          constant text, or the prefix put before a {@link Kind#PARAMETER} value
 */
public record ValueSource(
    Kind kind,
    KeyTemplate template,
    Map<String, String> bindings,
    String entityParameter,
    String parameter,
    String literal
) {

    public enum Kind {
        TEMPLATE,
        ENTITY_TEMPLATE,
        PARAMETER,
        LITERAL
    }

    public ValueSource {
        bindings = Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
        literal = literal == null ? "" : literal;
    }

    public static ValueSource template(KeyTemplate template, Map<String, String> bindings) {
        return new ValueSource(Kind.TEMPLATE, template, bindings, null, null, null);
    }

    public static ValueSource entityTemplate(KeyTemplate template, String entityParameter) {
        return new ValueSource(Kind.ENTITY_TEMPLATE, template, Map.of(), entityParameter, null, null);
    }

    public static ValueSource parameter(String parameter) {
        return new ValueSource(Kind.PARAMETER, null, Map.of(), null, parameter, null);
    }

    public static ValueSource prefixed(String prefix, String parameter) {
        return new ValueSource(Kind.PARAMETER, null, Map.of(), null, parameter, prefix);
    }

    public static ValueSource literal(String text) {
        return new ValueSource(Kind.LITERAL, null, Map.of(), null, null, text);
    }
}
