package co.repogen.generators;

import co.repogen.core.model.FilterCondition;
import co.repogen.core.model.FilterExpressionSpec;
import co.repogen.core.model.FilterFunction;
import co.repogen.core.model.FilterOperator;
import co.repogen.core.model.TransactionAction;
import co.repogen.core.resolve.KeyPlanStep;
import co.repogen.core.resolve.KeyRole;
import co.repogen.core.resolve.ParameterRole;
import co.repogen.core.resolve.ResolvedEntity;
import co.repogen.core.resolve.ResolvedIndexKey;
import co.repogen.core.resolve.ResolvedParameter;
import co.repogen.core.resolve.ResolvedParticipant;
import co.repogen.core.resolve.ResolvedPattern;
import co.repogen.core.resolve.ResolvedTransaction;
import co.repogen.core.resolve.ResponseShape;
import co.repogen.core.template.KeyTemplate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds the key, key condition, filter, update and condition expressions of generated
 * methods from resolved patterns. Renderers only translate the result into their language.
 */
public final class ExpressionPlanner {

    /** Item attribute holding the entity discriminator. */
    public static final String ENTITY_TYPE_ATTRIBUTE = "entity_type";

    private static final Pattern VALUE_PLACEHOLDER = Pattern.compile(":([A-Za-z_][A-Za-z0-9_]*)");

    private ExpressionPlanner() {
    }

    public static ExpressionPlan plan(ResolvedEntity entity, ResolvedPattern pattern) {
        Builder b = new Builder();
        switch (pattern.operation()) {
            case GET_ITEM, DELETE_ITEM -> addKey(b, pattern);
            case UPDATE_ITEM -> {
                addKey(b, pattern);
                addUpdate(b, entity, pattern);
            }
            case QUERY -> {
                addKeyCondition(b, entity, pattern);
                addFilter(b, pattern.filter());
            }
            case SCAN -> addFilter(b, pattern.filter());
            case PUT_ITEM, BATCH_GET_ITEM, BATCH_WRITE_ITEM -> {
                // whole items, no expressions
            }
        }
        return b.build();
    }

    /**
     * Plan one item of a cross-table transaction against its target entity.
     */
    public static ExpressionPlan plan(ResolvedEntity target, ResolvedParticipant participant, ResolvedTransaction tx) {
        Builder b = new Builder();
        if (participant.entityParameter() != null) {
            b.key.add(new ExpressionPlan.NamedValue(target.table().partitionKey(),
                ValueSource.entityTemplate(target.partitionKey().first(), participant.entityParameter())));
            if (target.sortKey() != null) {
                b.key.add(new ExpressionPlan.NamedValue(target.table().sortKey(),
                    ValueSource.entityTemplate(target.sortKey().first(), participant.entityParameter())));
            }
        } else {
            b.key.add(new ExpressionPlan.NamedValue(target.table().partitionKey(),
                ValueSource.template(target.partitionKey().first(), restrict(participant.keyBindings(),
                    target.partitionKey().first()))));
            if (target.sortKey() != null) {
                b.key.add(new ExpressionPlan.NamedValue(target.table().sortKey(),
                    ValueSource.template(target.sortKey().first(), restrict(participant.keyBindings(),
                        target.sortKey().first()))));
            }
        }

        if (participant.action() == TransactionAction.UPDATE || participant.action() == TransactionAction.PUT) {
            if (participant.entityParameter() != null) {
                b.updateEntity = participant.entityParameter();
            } else {
                Set<String> keyFields = new LinkedHashSet<>(target.primaryKeyFields());
                for (ResolvedParameter p : tx.parameters()) {
                    if (p.isEntity() || keyFields.contains(p.name())) continue;
                    if (target.definition().field(p.name()).isEmpty()) continue;
                    b.attributes.add(new ExpressionPlan.NamedValue(p.name(), ValueSource.parameter(p.name())));
                }
                if (participant.action() == TransactionAction.UPDATE) {
                    if (b.attributes.isEmpty()) {
                        b.attributes.add(new ExpressionPlan.NamedValue(ENTITY_TYPE_ATTRIBUTE,
                            ValueSource.literal(target.definition().entityType())));
                    }
                    b.update = setExpression(b);
                }
            }
        }

        if (participant.condition() != null && !participant.condition().isBlank()) {
            b.condition = participant.condition();
            Matcher m = VALUE_PLACEHOLDER.matcher(participant.condition());
            Set<String> seen = new LinkedHashSet<>();
            while (m.find()) {
                String name = m.group(1);
                boolean declared = tx.parameters().stream().anyMatch(p -> p.name().equals(name));
                if (declared && seen.add(name)) {
                    b.values.add(new ExpressionPlan.NamedValue(":" + name, ValueSource.parameter(name)));
                }
            }
        } else if (participant.action() == TransactionAction.CONDITION_CHECK) {
            b.condition = "attribute_exists(" + b.name("#c0", target.table().partitionKey()) + ")";
        }
        return b.build();
    }

    private static Map<String, String> restrict(Map<String, String> bindings, KeyTemplate template) {
        Map<String, String> out = new LinkedHashMap<>();
        for (String field : template.fieldNames()) {
            String param = bindings.get(field);
            if (param == null) {
                throw new IllegalStateException("no binding for key field '" + field + "' of " + template.source());
            }
            out.put(field, param);
        }
        return out;
    }

    // =========================================================================
    // Single-table patterns
    // =========================================================================

    private static void addKey(Builder b, ResolvedPattern pattern) {
        for (KeyPlanStep step : pattern.keyPlan()) {
            if (step.isRange()) {
                throw new IllegalStateException("range step in item operation " + pattern.methodName());
            }
            b.key.add(new ExpressionPlan.NamedValue(step.attribute(), source(step)));
        }
    }

    private static ValueSource source(KeyPlanStep step) {
        return step.readsEntity()
            ? ValueSource.entityTemplate(step.template(), step.entityParameter())
            : ValueSource.template(step.template(), step.bindings());
    }

    private static void addKeyCondition(Builder b, ResolvedEntity entity, ResolvedPattern pattern) {
        List<String> parts = new ArrayList<>();
        int i = 0;
        boolean sortStep = false;
        for (KeyPlanStep step : pattern.keyPlan()) {
            String name = b.name("#k" + i, step.attribute());
            String value = ":k" + i;
            if (step.role() == KeyRole.SORT) sortStep = true;
            if (!step.isRange()) {
                b.value(value, source(step));
                parts.add(name + " = " + value);
            } else {
                String prefix = step.template().numericPassthrough() ? "" : step.template().literalPrefix();
                List<String> operands = step.rangeParameters();
                b.value(value, ValueSource.prefixed(prefix, operands.get(0)));
                parts.add(switch (step.condition()) {
                    case BEGINS_WITH -> "begins_with(" + name + ", " + value + ")";
                    case BETWEEN -> {
                        b.value(value + "_2", ValueSource.prefixed(prefix, operands.get(1)));
                        yield name + " BETWEEN " + value + " AND " + value + "_2";
                    }
                    case GREATER_THAN, GREATER_THAN_OR_EQUAL, LESS_THAN, LESS_THAN_OR_EQUAL ->
                        name + " " + step.condition().wire() + " " + value;
                });
            }
            i++;
        }
        if (!sortStep && needsCollectionPrefix(entity, pattern)) {
            String name = b.name("#k" + i, entity.table().sortKey());
            b.value(":k" + i, ValueSource.literal(entity.sortKeyPrefix()));
            parts.add("begins_with(" + name + ", :k" + i + ")");
        }
        if (parts.isEmpty()) {
            throw new IllegalStateException("query " + pattern.methodName() + " has no key condition");
        }
        b.keyCondition = String.join(" AND ", parts);
    }

    /**
     * A base table query of an item collection without a sort key condition would also
     * return the other entities of the collection.
     */
    private static boolean needsCollectionPrefix(ResolvedEntity entity, ResolvedPattern pattern) {
        return !pattern.usesIndex()
            && entity.itemCollection()
            && entity.table().hasSortKey()
            && pattern.responseShape() != ResponseShape.MIXED
            && !entity.sortKeyPrefix().isEmpty();
    }

    private static void addUpdate(Builder b, ResolvedEntity entity, ResolvedPattern pattern) {
        for (ResolvedParameter p : pattern.parameters()) {
            if (p.isEntity()) {
                b.updateEntity = p.name();
                return;
            }
        }
        Map<String, String> available = new LinkedHashMap<>();
        for (KeyPlanStep step : pattern.keyPlan()) available.putAll(step.bindings());
        Set<String> written = new LinkedHashSet<>();
        for (ResolvedParameter p : pattern.parameters(ParameterRole.BODY)) {
            b.attributes.add(new ExpressionPlan.NamedValue(p.name(), ValueSource.parameter(p.name())));
            available.put(p.name(), p.name());
            written.add(p.name());
        }
        if (written.isEmpty()) return;

        // keep index keys derived from updated fields in step
        Set<String> attributes = new LinkedHashSet<>(written);
        for (ResolvedIndexKey index : entity.indexKeys()) {
            refreshIndexKey(b, index.index().partitionKey().values(), index.partitionKey().parts(), available,
                written, attributes);
            if (index.sortKey() != null) {
                refreshIndexKey(b, index.index().sortKey().values(), index.sortKey().parts(), available,
                    written, attributes);
            }
        }
        b.update = setExpression(b);
    }

    private static void refreshIndexKey(Builder b, List<String> attrs, List<KeyTemplate> parts,
        Map<String, String> available, Set<String> written, Set<String> attributes) {
        for (int i = 0; i < parts.size(); i++) {
            KeyTemplate t = parts.get(i);
            String attribute = attrs.get(Math.min(i, attrs.size() - 1));
            List<String> fields = t.fieldNames();
            if (fields.isEmpty() || !available.keySet().containsAll(fields)) continue;
            if (fields.stream().noneMatch(written::contains)) continue;
            if (!attributes.add(attribute)) continue;
            Map<String, String> bindings = new LinkedHashMap<>();
            fields.forEach(f -> bindings.put(f, available.get(f)));
            b.attributes.add(new ExpressionPlan.NamedValue(attribute, ValueSource.template(t, bindings)));
        }
    }

    private static String setExpression(Builder b) {
        List<String> sets = new ArrayList<>();
        for (int i = 0; i < b.attributes.size(); i++) {
            ExpressionPlan.NamedValue attribute = b.attributes.get(i);
            String name = b.name("#u" + i, attribute.name());
            b.value(":u" + i, attribute.source());
            sets.add(name + " = :u" + i);
        }
        return "SET " + String.join(", ", sets);
    }

    // =========================================================================
    // Filters
    // =========================================================================

    private static void addFilter(Builder b, FilterExpressionSpec spec) {
        if (spec == null || spec.conditions().isEmpty()) return;
        List<String> parts = new ArrayList<>();
        for (int i = 0; i < spec.conditions().size(); i++) {
            parts.add(condition(b, spec.conditions().get(i), i));
        }
        b.filter = String.join(" " + spec.effectiveLogicalOperator() + " ", parts);
    }

    private static String condition(Builder b, FilterCondition c, int i) {
        String name = b.name("#f" + i, c.field());
        String value = ":f" + i;
        FilterFunction fn = c.function() == null ? null : FilterFunction.of(c.function())
            .orElseThrow(() -> new IllegalStateException("filter function " + c.function()));
        if (fn != null && fn != FilterFunction.SIZE) {
            return switch (fn) {
                case ATTRIBUTE_EXISTS -> "attribute_exists(" + name + ")";
                case ATTRIBUTE_NOT_EXISTS -> "attribute_not_exists(" + name + ")";
                case CONTAINS, BEGINS_WITH -> {
                    b.value(value, ValueSource.parameter(c.param()));
                    yield fn.wire() + "(" + name + ", " + value + ")";
                }
                case SIZE -> throw new IllegalStateException("size on '" + c.field() + "' needs an operator");
            };
        }
        FilterOperator op = FilterOperator.of(c.operator())
            .orElseThrow(() -> new IllegalStateException("filter operator " + c.operator()));
        String target = fn == FilterFunction.SIZE ? "size(" + name + ")" : name;
        return switch (op) {
            case BETWEEN -> {
                b.value(value, ValueSource.parameter(c.param()));
                b.value(value + "_2", ValueSource.parameter(c.param2()));
                yield target + " BETWEEN " + value + " AND " + value + "_2";
            }
            case IN -> {
                List<String> placeholders = new ArrayList<>();
                for (int j = 0; j < c.params().size(); j++) {
                    String p = value + "_" + j;
                    b.value(p, ValueSource.parameter(c.params().get(j)));
                    placeholders.add(p);
                }
                yield target + " IN (" + String.join(", ", placeholders) + ")";
            }
            case EQ, NE, LT, LE, GT, GE -> {
                b.value(value, ValueSource.parameter(c.param()));
                yield target + " " + op.wire() + " " + value;
            }
        };
    }

    private static final class Builder {
        final List<ExpressionPlan.NamedValue> key = new ArrayList<>();
        final List<ExpressionPlan.NamedValue> attributes = new ArrayList<>();
        final Map<String, String> names = new LinkedHashMap<>();
        final List<ExpressionPlan.NamedValue> values = new ArrayList<>();
        String keyCondition;
        String filter;
        String update;
        String updateEntity;
        String condition;

        String name(String placeholder, String attribute) {
            names.put(placeholder, attribute);
            return placeholder;
        }

        void value(String placeholder, ValueSource source) {
            values.add(new ExpressionPlan.NamedValue(placeholder, source));
        }

        ExpressionPlan build() {
            return new ExpressionPlan(key, attributes, keyCondition, filter, update, updateEntity, condition, names,
                values);
        }
    }
}
