package co.repogen.generators.java;

import co.repogen.core.model.FieldKind;
import co.repogen.core.template.KeyTemplate;
import co.repogen.core.template.Segment;
import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.CodeBlock;
import com.squareup.javapoet.ParameterizedTypeName;
import com.squareup.javapoet.TypeName;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Java types, literals and key value expressions of generated code.
 */
final class JavaTypes {

    private static final Pattern NUMBER = Pattern.compile("-?\\d+(\\.\\d+)?([eE][-+]?\\d+)?");

    static final ClassName STRING = ClassName.get(String.class);
    static final ClassName LONG = ClassName.get(Long.class);
    static final ClassName BIG_DECIMAL = ClassName.get(BigDecimal.class);
    static final ClassName BOOLEAN = ClassName.get(Boolean.class);
    static final ClassName OBJECT = ClassName.get(Object.class);
    static final ClassName LIST = ClassName.get("java.util", "List");
    static final ClassName MAP = ClassName.get("java.util", "Map");
    static final ClassName ARRAY_LIST = ClassName.get("java.util", "ArrayList");
    static final ClassName LINKED_HASH_MAP = ClassName.get("java.util", "LinkedHashMap");
    static final ClassName OPTIONAL = ClassName.get("java.util", "Optional");
    static final ClassName OBJECTS = ClassName.get("java.util", "Objects");

    // AWS SDK v2, low-level client
    static final String MODEL_PACKAGE = "software.amazon.awssdk.services.dynamodb.model";
    static final ClassName DYNAMO_DB_CLIENT = ClassName.get(
        "software.amazon.awssdk.services.dynamodb", "DynamoDbClient");
    static final ClassName DYNAMO_DB_CLIENT_BUILDER = ClassName.get(
        "software.amazon.awssdk.services.dynamodb", "DynamoDbClientBuilder");
    static final ClassName REGION = ClassName.get("software.amazon.awssdk.regions", "Region");
    static final ClassName ATTRIBUTE_VALUE = model("AttributeValue");

    static final ParameterizedTypeName ITEM = ParameterizedTypeName.get(MAP, STRING, ATTRIBUTE_VALUE);
    static final ParameterizedTypeName ITEM_LIST = ParameterizedTypeName.get(LIST, ITEM);
    static final ParameterizedTypeName NAMES = ParameterizedTypeName.get(MAP, STRING, STRING);
    static final ParameterizedTypeName OBJECT_MAP = ParameterizedTypeName.get(MAP, STRING, OBJECT);
    static final ParameterizedTypeName OBJECT_LIST = ParameterizedTypeName.get(LIST, OBJECT);

    private JavaTypes() {
    }

    static ClassName model(String simpleName) {
        return ClassName.get(MODEL_PACKAGE, simpleName);
    }

    static TypeName listOf(TypeName element) {
        return ParameterizedTypeName.get(LIST, element);
    }

    static TypeName optionalOf(TypeName element) {
        return ParameterizedTypeName.get(OPTIONAL, element);
    }

    /** Boxed type of a single value; arrays and objects stay untyped. */
    static TypeName scalar(FieldKind kind) {
        return switch (kind) {
            case STRING, UUID -> STRING;
            case INTEGER -> LONG;
            case DECIMAL -> BIG_DECIMAL;
            case BOOLEAN -> BOOLEAN;
            case ARRAY -> OBJECT_LIST;
            case OBJECT -> OBJECT_MAP;
        };
    }

    static TypeName field(FieldKind kind, FieldKind itemKind) {
        if (kind == FieldKind.ARRAY) {
            return listOf(itemKind == null ? STRING : scalar(itemKind));
        }
        return scalar(kind);
    }

    /** {@code AttributeValues} method reading an attribute of this kind. */
    static String reader(FieldKind kind) {
        return switch (kind) {
            case STRING, UUID -> "asString";
            case INTEGER -> "asLong";
            case DECIMAL -> "asDecimal";
            case BOOLEAN -> "asBoolean";
            case ARRAY -> "asList";
            case OBJECT -> "asMap";
        };
    }

    // =========================================================================
    // Key values
    // =========================================================================

    /** A Java expression and the field kind of its value. */
    record Operand(CodeBlock expression, FieldKind kind) {
    }

    /**
     * Expression building a key value from a template. Numeric passthrough templates yield
     * the raw number, all others a String.
     */
    static CodeBlock templateValue(KeyTemplate template, Function<String, Operand> fields) {
        if (template.numericPassthrough()) {
            return fields.apply(template.segments().get(0).text()).expression();
        }
        if (template.isConstant()) {
            return CodeBlock.of("$S", template.source());
        }
        List<CodeBlock> parts = new ArrayList<>();
        for (Segment s : template.segments()) {
            parts.add(s.isField() ? asText(fields.apply(s.text())) : CodeBlock.of("$S", s.text()));
        }
        return CodeBlock.join(parts, " + ");
    }

    /** Type of {@link #templateValue}. */
    static TypeName templateType(KeyTemplate template, Function<String, FieldKind> kinds) {
        if (!template.numericPassthrough()) return STRING;
        return scalar(kinds.apply(template.segments().get(0).text()));
    }

    static CodeBlock asText(Operand operand) {
        FieldKind kind = operand.kind() == null ? FieldKind.STRING : operand.kind();
        return switch (kind) {
            case STRING, UUID -> operand.expression();
            case DECIMAL -> CodeBlock.of("$L.toPlainString()", operand.expression());
            default -> CodeBlock.of("$T.valueOf($L)", STRING, operand.expression());
        };
    }

    /** Range operand with the template's literal prefix in front. */
    static CodeBlock prefixed(String prefix, Operand operand) {
        if (prefix == null || prefix.isEmpty()) return operand.expression();
        return CodeBlock.of("$S + $L", prefix, asText(operand));
    }

    // =========================================================================
    // Literals
    // =========================================================================

    static CodeBlock literal(Object value, FieldKind kind) {
        return literal(value, kind, null);
    }

    /** Literal of a field value; array elements take {@code itemKind} when it is known. */
    static CodeBlock literal(Object value, FieldKind kind, FieldKind itemKind) {
        if (value == null) return CodeBlock.of("null");
        return switch (kind) {
            case STRING, UUID -> CodeBlock.of("$S", String.valueOf(value));
            case INTEGER -> isNumber(value)
                ? CodeBlock.of("$LL", new BigDecimal(String.valueOf(value)).longValue())
                : literal(value, infer(value));
            case DECIMAL -> isNumber(value)
                ? CodeBlock.of("new $T($S)", BIG_DECIMAL, new BigDecimal(String.valueOf(value)).toPlainString())
                : literal(value, infer(value));
            case BOOLEAN -> CodeBlock.of("$L", value instanceof Boolean b ? b : Boolean.parseBoolean(value.toString()));
            case ARRAY -> listLiteral(value, itemKind);
            case OBJECT -> mapLiteral(value);
        };
    }

    private static CodeBlock listLiteral(Object value, FieldKind itemKind) {
        List<?> items = value instanceof List<?> list ? list : List.of(value);
        List<CodeBlock> elements = new ArrayList<>();
        for (Object item : items) elements.add(literal(item, itemKind == null ? infer(item) : itemKind));
        return CodeBlock.of("$T.of($L)", LIST, CodeBlock.join(elements, ", "));
    }

    private static CodeBlock mapLiteral(Object value) {
        if (!(value instanceof Map<?, ?> map) || map.isEmpty()) return CodeBlock.of("$T.of()", MAP);
        List<CodeBlock> entries = new ArrayList<>();
        if (map.size() <= 10) {
            for (Map.Entry<?, ?> e : map.entrySet()) {
                entries.add(CodeBlock.of("$S, $L", String.valueOf(e.getKey()), literal(e.getValue(), infer(e.getValue()))));
            }
            return CodeBlock.of("$T.of($L)", MAP, CodeBlock.join(entries, ", "));
        }
        for (Map.Entry<?, ?> e : map.entrySet()) {
            entries.add(CodeBlock.of("$T.entry($S, $L)", MAP, String.valueOf(e.getKey()),
                literal(e.getValue(), infer(e.getValue()))));
        }
        return CodeBlock.of("$T.ofEntries($L)", MAP, CodeBlock.join(entries, ", "));
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
