package co.repogen.generators.python;

import co.repogen.core.model.FieldKind;
import co.repogen.core.template.KeyTemplate;
import co.repogen.core.template.Segment;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Python type names, literals and key value expressions.
 */
final class PythonSyntax {

    private static final Pattern NUMBER = Pattern.compile("-?\\d+(\\.\\d+)?([eE][-+]?\\d+)?");

    static final Set<String> KEYWORDS = Set.of("False", "None", "True", "and", "as", "assert", "async", "await",
        "break", "class", "continue", "def", "del", "elif", "else", "except", "finally", "for", "from", "global",
        "if", "import", "in", "is", "lambda", "nonlocal", "not", "or", "pass", "raise", "return", "try", "while",
        "with", "yield");

    private PythonSyntax() {
    }

    static String type(FieldKind kind, FieldKind itemKind) {
        return switch (kind) {
            case STRING, UUID -> "str";
            case INTEGER -> "int";
            case DECIMAL -> "Decimal";
            case BOOLEAN -> "bool";
            case ARRAY -> "list[" + (itemKind == null || itemKind == FieldKind.ARRAY ? "Any" : type(itemKind, null)) + "]";
            case OBJECT -> "dict[str, Any]";
        };
    }

    static String quote(String text) {
        return "'" + text.replace("\\", "\\\\").replace("'", "\\'").replace("\n", "\\n") + "'";
    }

    // =========================================================================
    // Key values
    // =========================================================================

    /**
     * Expression building a key value from a template: the raw number for numeric
     * passthrough templates, a string literal for constants, an f-string otherwise.
     */
    static String templateValue(KeyTemplate template, Function<String, String> fields) {
        if (template.numericPassthrough()) {
            return fields.apply(template.segments().get(0).text());
        }
        if (template.isConstant()) {
            return quote(template.source());
        }
        StringBuilder f = new StringBuilder("f'");
        for (Segment s : template.segments()) {
            if (s.isField()) {
                f.append('{').append(fields.apply(s.text())).append('}');
            } else {
                f.append(fstringText(s.text()));
            }
        }
        return f.append('\'').toString();
    }

    /** Value with a constant prefix in front, as a string. */
    static String prefixed(String prefix, String expression) {
        if (prefix == null || prefix.isEmpty()) return expression;
        return "f'" + fstringText(prefix) + "{" + expression + "}'";
    }

    /** Tuple of the parts of a multi-attribute key. */
    static String tuple(List<String> parts) {
        return parts.size() == 1 ? "(" + parts.get(0) + ",)" : "(" + String.join(", ", parts) + ")";
    }

    private static String fstringText(String text) {
        return text.replace("\\", "\\\\").replace("'", "\\'").replace("{", "{{").replace("}", "}}");
    }

    // =========================================================================
    // Literals
    // =========================================================================

    static String literal(Object value, FieldKind kind) {
        return literal(value, kind, null);
    }

    static String literal(Object value, FieldKind kind, FieldKind itemKind) {
        if (value == null) return "None";
        return switch (kind) {
            case STRING, UUID -> quote(String.valueOf(value));
            case INTEGER -> isNumber(value)
                ? new BigDecimal(String.valueOf(value)).toBigInteger().toString()
                : literal(value, infer(value));
            case DECIMAL -> isNumber(value)
                ? "Decimal(" + quote(new BigDecimal(String.valueOf(value)).toPlainString()) + ")"
                : literal(value, infer(value));
            case BOOLEAN -> (value instanceof Boolean b ? b : Boolean.parseBoolean(value.toString())) ? "True" : "False";
            case ARRAY -> {
                List<?> items = value instanceof List<?> list ? list : List.of(value);
                List<String> elements = new ArrayList<>();
                for (Object item : items) elements.add(literal(item, itemKind == null ? infer(item) : itemKind));
                yield "[" + String.join(", ", elements) + "]";
            }
            case OBJECT -> {
                if (!(value instanceof Map<?, ?> map)) yield "{}";
                List<String> entries = new ArrayList<>();
                for (Map.Entry<?, ?> e : map.entrySet()) {
                    entries.add(quote(String.valueOf(e.getKey())) + ": " + literal(e.getValue(), infer(e.getValue())));
                }
                yield "{" + String.join(", ", entries) + "}";
            }
        };
    }

    static FieldKind infer(Object value) {
        if (value instanceof Boolean) return FieldKind.BOOLEAN;
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof BigInteger) {
            return FieldKind.INTEGER;
        }
        if (value instanceof Number) return FieldKind.DECIMAL;
        if (value instanceof List<?>) return FieldKind.ARRAY;
        if (value instanceof Map<?, ?>) return FieldKind.OBJECT;
        return FieldKind.STRING;
    }

    private static boolean isNumber(Object value) {
        return value instanceof Number || NUMBER.matcher(String.valueOf(value)).matches();
    }
}
