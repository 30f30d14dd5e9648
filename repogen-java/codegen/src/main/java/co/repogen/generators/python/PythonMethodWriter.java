package co.repogen.generators.python;

import co.repogen.core.model.EntityDefinition;
import co.repogen.core.model.FieldDefinition;
import co.repogen.core.model.FieldKind;
import co.repogen.core.model.Operation;
import co.repogen.core.model.ParameterKind;
import co.repogen.core.model.TransactionAction;
import co.repogen.core.model.TransactionOperation;
import co.repogen.core.resolve.ResolvedEntity;
import co.repogen.core.resolve.ResolvedModel;
import co.repogen.core.resolve.ResolvedParameter;
import co.repogen.core.resolve.ResolvedParticipant;
import co.repogen.core.resolve.ResolvedPattern;
import co.repogen.core.resolve.ResolvedTransaction;
import co.repogen.core.resolve.ResponseShape;
import co.repogen.generators.ExpressionPlan;
import co.repogen.generators.ExpressionPlanner;
import co.repogen.generators.ValueSource;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Signatures and bodies of repository pattern methods and transaction methods. Bodies are
 * lists of lines indented relative to the method body.
 */
final class PythonMethodWriter {

    /** Local names used by generated method bodies. */
    private static final Set<String> RESERVED = Set.of("self", "key", "keys", "names", "values", "item", "items",
        "params", "response", "update", "assignments", "attribute", "value", "entry", "i", "success", "result");

    private static final String INDENT = "    ";
    private static final String BODY_INDENT = "        ";

    private final PythonProfile profile;
    private final Map<String, ResolvedEntity> entities = new LinkedHashMap<>();

    PythonMethodWriter(PythonProfile profile, ResolvedModel model) {
        this.profile = profile;
        for (ResolvedEntity e : model.entities()) entities.put(e.name(), e);
    }

    /** Template view of one generated class method: docstring and body come indented. */
    static Map<String, Object> view(String name, String signature, String returns, List<String> doc,
            List<String> body) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("name", name);
        view.put("signature", signature);
        view.put("returns", returns);
        view.put("doc", docstring(doc));
        view.put("body", body.stream()
            .map(line -> line.isEmpty() ? line : BODY_INDENT + line)
            .collect(Collectors.joining("\n")));
        return view;
    }

    /** Docstring text, lines after the first indented to the method body. */
    static String docstring(List<String> lines) {
        return lines.stream()
            .map(line -> line.replace("\\", "\\\\").replace("\"\"\"", "\\\"\"\""))
            .map(line -> line.isEmpty() ? line : BODY_INDENT + line)
            .collect(Collectors.joining("\n")).strip();
    }

    String variable(String name) {
        String var = profile.fieldName(name);
        return RESERVED.contains(var) ? var + "_param" : var;
    }

    String signature(List<ResolvedParameter> parameters, ResolvedPattern pattern, String entityClass) {
        List<String> parts = new ArrayList<>();
        parts.add("self");
        for (ResolvedParameter p : parameters) {
            parts.add(variable(p.name()) + ": " + parameterType(p, pattern, entityClass));
        }
        return String.join(", ", parts);
    }

    private String parameterType(ResolvedParameter p, ResolvedPattern pattern, String entityClass) {
        if (p.isEntity()) return profile.className(p.entityType());
        if (pattern != null && p.kind() == ParameterKind.ARRAY && isBatch(pattern.operation())) {
            return "list[" + entityClass + "]";
        }
        return profile.parameterType(p.kind(), null);
    }

    private static boolean isBatch(Operation operation) {
        return operation == Operation.BATCH_GET_ITEM || operation == Operation.BATCH_WRITE_ITEM;
    }

    // =========================================================================
    // Access pattern methods
    // =========================================================================

    Map<String, Object> pattern(ResolvedEntity entity, ResolvedPattern pattern) {
        String entityClass = profile.className(entity.name());
        List<String> doc = new ArrayList<>();
        if (pattern.description() != null && !pattern.description().isBlank()) {
            doc.add(pattern.description());
            doc.add("");
        }
        doc.add("Access pattern #" + pattern.id() + ": " + pattern.operation().wire()
            + (pattern.usesIndex() ? " on index " + pattern.indexName() : "") + ".");
        if (pattern.responseShape().isRaw()) {
            doc.add("Returns raw items: the entity cannot be rebuilt from what this read returns.");
        }

        List<String> body = new ArrayList<>();
        ExpressionPlan plan = ExpressionPlanner.plan(entity, pattern);
        switch (pattern.operation()) {
            case GET_ITEM -> {
                body.add("key = " + dict(plan.key()));
                body.add("items = self._get_items(key" + (pattern.consistentRead() ? ", consistent_read=True" : "") + ")");
                returnRead(body, pattern, entityClass);
            }
            case QUERY, SCAN -> {
                boolean query = pattern.operation() == Operation.QUERY;
                body.add("params: dict[str, Any] = {");
                if (pattern.usesIndex()) body.add(INDENT + "'IndexName': " + PythonSyntax.quote(pattern.indexName()) + ",");
                if (query) body.add(INDENT + "'KeyConditionExpression': " + PythonSyntax.quote(plan.keyCondition()) + ",");
                if (plan.filter() != null) body.add(INDENT + "'FilterExpression': " + PythonSyntax.quote(plan.filter()) + ",");
                addExpressionArguments(body, plan);
                if (pattern.consistentRead()) body.add(INDENT + "'ConsistentRead': True,");
                body.add("}");
                String firstOnly = pattern.responseShape().isList() ? "" : ", first_only=True";
                body.add("items = self._" + (query ? "query" : "scan") + "(params" + firstOnly + ")");
                returnRead(body, pattern, entityClass);
            }
            case PUT_ITEM -> putItem(body, entity, pattern, entityClass);
            case UPDATE_ITEM -> updateItem(body, entity, pattern, plan, entityClass);
            case DELETE_ITEM -> {
                body.add("key = " + dict(plan.key()));
                body.add("items = self._delete_items(key)");
                returnRead(body, pattern, entityClass);
            }
            case BATCH_GET_ITEM -> {
                body.add("keys = " + batchKeys(entity, pattern, entityClass));
                body.add("items = self._batch_get(keys)");
                returnRead(body, pattern, entityClass);
            }
            case BATCH_WRITE_ITEM -> {
                batchItems(body, entity, pattern, entityClass);
                body.add("success = self._batch_put(items)");
                returnWritten(body, pattern, entityClass, "success");
            }
        }
        return view(profile.methodName(pattern.methodName()), signature(pattern.parameters(), pattern, entityClass),
            returnType(pattern, entityClass), doc, body);
    }

    private String returnType(ResolvedPattern pattern, String entityClass) {
        boolean mayMiss = pattern.operation().isRead() || pattern.operation() == Operation.DELETE_ITEM;
        return switch (pattern.responseShape()) {
            case ENTITY -> mayMiss ? entityClass + " | None" : entityClass;
            case ENTITY_LIST -> "list[" + entityClass + "]";
            case ATTRIBUTE_MAP -> mayMiss ? "dict[str, Any] | None" : "dict[str, Any]";
            case ATTRIBUTE_MAP_LIST, MIXED -> "list[dict[str, Any]]";
            case SUCCESS_FLAG -> "bool";
            case NONE -> "None";
        };
    }

    private void putItem(List<String> body, ResolvedEntity entity, ResolvedPattern pattern, String entityClass) {
        String entityParam = pattern.parameters().stream()
            .filter(ResolvedParameter::isEntity)
            .map(ResolvedParameter::name)
            .findFirst()
            .orElse(null);
        addItem(body, entity, pattern, entityClass, entityParam);
        body.add("self.table.put_item(Item=item)");
        if (entityParam != null && pattern.responseShape() == ResponseShape.ENTITY) {
            body.add("return " + variable(entityParam));
            return;
        }
        body.add("items = [item]");
        returnWritten(body, pattern, entityClass, "True");
    }

    private void addItem(List<String> body, ResolvedEntity entity, ResolvedPattern pattern, String entityClass,
            String entityParam) {
        if (entityParam != null) {
            body.add("item = " + variable(entityParam) + ".to_item()");
        } else {
            List<String> keyFields = entity.primaryKeyFields();
            Set<String> declared = pattern.parameters().stream().map(ResolvedParameter::name).collect(Collectors.toSet());
            if (declared.containsAll(keyFields)) {
                body.add("item = " + entityClass + ".key_for(" + keyFields.stream().map(this::variable)
                    .collect(Collectors.joining(", ")) + ")");
            } else {
                body.add("item: dict[str, Any] = {}");
            }
            body.add("item[" + PythonSyntax.quote(ExpressionPlanner.ENTITY_TYPE_ATTRIBUTE) + "] = "
                + entityClass + ".ENTITY_TYPE");
        }
        for (ResolvedParameter p : pattern.parameters()) {
            if (p.isEntity()) continue;
            body.add("item[" + PythonSyntax.quote(p.name()) + "] = " + variable(p.name()));
        }
    }

    private void updateItem(List<String> body, ResolvedEntity entity, ResolvedPattern pattern, ExpressionPlan plan,
            String entityClass) {
        body.add("key = " + dict(plan.key()));
        Map<String, String> names = new LinkedHashMap<>(plan.names());
        names.put("#pk", entity.table().partitionKey());
        body.add("names = " + names(names));
        body.add("values = " + dict(plan.values()));
        String update = plan.update() == null ? null : PythonSyntax.quote(plan.update());
        if (plan.updateEntity() != null) {
            addEntityAssignments(body, plan.updateEntity());
            update = "update";
        }
        body.add("params: dict[str, Any] = {");
        body.add(INDENT + "'Key': key,");
        if (update != null) body.add(INDENT + "'UpdateExpression': " + update + ",");
        body.add(INDENT + "'ConditionExpression': 'attribute_exists(#pk)',");
        body.add(INDENT + "'ExpressionAttributeNames': names,");
        body.add(INDENT + "'ReturnValues': 'ALL_NEW',");
        body.add("}");
        body.add("if values:");
        body.add(INDENT + "params['ExpressionAttributeValues'] = values");

        if (pattern.responseShape() == ResponseShape.SUCCESS_FLAG) {
            body.add("try:");
            body.add(INDENT + "self.table.update_item(**params)");
            body.add(INDENT + "return True");
            body.add("except self.table.meta.client.exceptions.ConditionalCheckFailedException:");
            body.add(INDENT + "return False");
            return;
        }
        body.add("response = self.table.update_item(**params)");
        body.add("items = [response['Attributes']]");
        returnWritten(body, pattern, entityClass, "True");
    }

    /** SET assignments for every non-key attribute of an entity parameter, into {@code update}. */
    private void addEntityAssignments(List<String> body, String entityParameter) {
        body.add("item = " + variable(entityParameter) + ".to_item()");
        body.add("for attribute in key:");
        body.add(INDENT + "item.pop(attribute, None)");
        body.add("assignments = []");
        body.add("for i, (attribute, value) in enumerate(item.items()):");
        body.add(INDENT + "names[f'#a{i}'] = attribute");
        body.add(INDENT + "values[f':a{i}'] = value");
        body.add(INDENT + "assignments.append(f'#a{i} = :a{i}')");
        body.add("update = 'SET ' + ', '.join(assignments)");
    }

    private String batchKeys(ResolvedEntity entity, ResolvedPattern pattern, String entityClass) {
        List<String> parts = new ArrayList<>();
        for (ResolvedParameter p : pattern.parameters()) {
            if (p.kind() == ParameterKind.ARRAY) {
                parts.add("[entry.key() for entry in " + variable(p.name()) + "]");
            } else if (p.isEntity()) {
                parts.add("[" + variable(p.name()) + ".key()]");
            }
        }
        if (parts.isEmpty()) {
            List<String> keyFields = entity.primaryKeyFields();
            Set<String> declared = pattern.parameters().stream().map(ResolvedParameter::name).collect(Collectors.toSet());
            if (!declared.containsAll(keyFields)) {
                throw new IllegalStateException("batch get " + pattern.methodName()
                    + " needs an entity, array or full primary key parameter");
            }
            parts.add("[" + entityClass + ".key_for(" + keyFields.stream().map(this::variable)
                .collect(Collectors.joining(", ")) + ")]");
        }
        return String.join(" + ", parts);
    }

    private void batchItems(List<String> body, ResolvedEntity entity, ResolvedPattern pattern, String entityClass) {
        List<String> parts = new ArrayList<>();
        for (ResolvedParameter p : pattern.parameters()) {
            if (p.kind() == ParameterKind.ARRAY) {
                parts.add("[entry.to_item() for entry in " + variable(p.name()) + "]");
            } else if (p.isEntity()) {
                parts.add("[" + variable(p.name()) + ".to_item()]");
            }
        }
        if (parts.isEmpty()) {
            addItem(body, entity, pattern, entityClass, null);
            body.add("items = [item]");
        } else {
            body.add("items = " + String.join(" + ", parts));
        }
    }

    private static void returnRead(List<String> body, ResolvedPattern pattern, String entityClass) {
        switch (pattern.responseShape()) {
            case ENTITY -> body.add("return " + entityClass + ".from_item(items[0]) if items else None");
            case ENTITY_LIST -> body.add("return [" + entityClass + ".from_item(item) for item in items]");
            case ATTRIBUTE_MAP -> body.add("return items[0] if items else None");
            case ATTRIBUTE_MAP_LIST, MIXED -> body.add("return items");
            case SUCCESS_FLAG -> body.add("return bool(items)");
            case NONE -> {
                // the request succeeding is the result
            }
        }
    }

    private static void returnWritten(List<String> body, ResolvedPattern pattern, String entityClass, String success) {
        switch (pattern.responseShape()) {
            case ENTITY -> body.add("return " + entityClass + ".from_item(items[0])");
            case ENTITY_LIST -> body.add("return [" + entityClass + ".from_item(item) for item in items]");
            case ATTRIBUTE_MAP -> body.add("return items[0]");
            case ATTRIBUTE_MAP_LIST, MIXED -> body.add("return items");
            case SUCCESS_FLAG -> body.add("return " + success);
            case NONE -> {
                // None
            }
        }
    }

    // =========================================================================
    // Transactions
    // =========================================================================

    Map<String, Object> transaction(ResolvedTransaction tx) {
        boolean write = tx.operation() == TransactionOperation.TRANSACT_WRITE;
        List<String> doc = new ArrayList<>();
        if (tx.description() != null && !tx.description().isBlank()) {
            doc.add(tx.description());
            doc.add("");
        }
        doc.add("Access pattern #" + tx.id() + ": " + tx.operation().wire() + " over "
            + tx.participants().stream().map(p -> p.action().wire() + " " + p.entity())
            .collect(Collectors.joining(", ")) + ".");

        List<String> body = new ArrayList<>();
        body.add("items: list[dict[str, Any]] = []");
        for (int i = 0; i < tx.participants().size(); i++) {
            ResolvedParticipant participant = tx.participants().get(i);
            ResolvedEntity target = entities.get(participant.entity());
            if (target == null) {
                throw new IllegalStateException("transaction " + tx.methodName() + " names unknown entity "
                    + participant.entity());
            }
            body.add("");
            body.add("# " + participant.action().wire() + " " + participant.entity());
            addParticipant(body, i, participant, target, ExpressionPlanner.plan(target, participant, tx));
        }
        body.add("");

        if (write) {
            switch (tx.returnType()) {
                case BOOLEAN -> {
                    body.add("try:");
                    body.add(INDENT + "self.client.transact_write_items(TransactItems=items)");
                    body.add(INDENT + "return True");
                    body.add("except self.client.exceptions.TransactionCanceledException:");
                    body.add(INDENT + "return False");
                }
                case OBJECT -> {
                    body.add("self.client.transact_write_items(TransactItems=items)");
                    body.add("return {" + tx.parameters().stream()
                        .map(p -> PythonSyntax.quote(p.name()) + ": " + variable(p.name()))
                        .collect(Collectors.joining(", ")) + "}");
                }
                case ARRAY -> {
                    body.add("self.client.transact_write_items(TransactItems=items)");
                    body.add("return [" + tx.parameters().stream().map(p -> variable(p.name()))
                        .collect(Collectors.joining(", ")) + "]");
                }
            }
        } else {
            body.add("response = self.client.transact_get_items(TransactItems=items)");
            switch (tx.returnType()) {
                case BOOLEAN -> body.add("return all('Item' in entry for entry in response['Responses'])");
                case OBJECT -> {
                    body.add("result: dict[str, Any] = {}");
                    Map<String, Integer> seen = new LinkedHashMap<>();
                    for (int i = 0; i < tx.participants().size(); i++) {
                        String entity = tx.participants().get(i).entity();
                        int n = seen.merge(entity, 1, Integer::sum);
                        body.add("result[" + PythonSyntax.quote(n == 1 ? entity : entity + n)
                            + "] = deserialize(response['Responses'][" + i + "].get('Item', {}))");
                    }
                    body.add("return result");
                }
                case ARRAY -> body.add("return [deserialize(entry.get('Item', {})) for entry in response['Responses']]");
            }
        }

        String returns = switch (tx.returnType()) {
            case BOOLEAN -> "bool";
            case OBJECT -> "dict[str, Any]";
            case ARRAY -> write ? "list[Any]" : "list[dict[str, Any]]";
        };
        return view(profile.methodName(tx.methodName()), signature(tx.parameters(), null, null), returns, doc, body);
    }

    private void addParticipant(List<String> body, int n, ResolvedParticipant participant, ResolvedEntity target,
            ExpressionPlan plan) {
        String table = PythonRenderer.tableConstant(participant.table());
        TransactionAction action = participant.action();
        List<String> request = new ArrayList<>();
        request.add("'TableName': " + table);

        if (action == TransactionAction.PUT) {
            String item = "item" + n;
            if (plan.updateEntity() != null) {
                body.add(item + " = " + variable(plan.updateEntity()) + ".to_item()");
            } else {
                body.add(item + " = " + dict(plan.key()));
                body.add(item + "[" + PythonSyntax.quote(ExpressionPlanner.ENTITY_TYPE_ATTRIBUTE) + "] = "
                    + profile.className(target.name()) + ".ENTITY_TYPE");
                for (ExpressionPlan.NamedValue a : plan.attributes()) {
                    body.add(item + "[" + PythonSyntax.quote(a.name()) + "] = " + value(a.source()));
                }
            }
            request.add("'Item': serialize(" + item + ")");
            addConditionArguments(request, plan);
            body.add("items.append({'Put': {" + String.join(", ", request) + "}})");
            return;
        }

        request.add("'Key': serialize(" + dict(plan.key()) + ")");
        switch (action) {
            case UPDATE -> {
                if (plan.updateEntity() != null) {
                    body.add("key = " + dict(plan.key()));
                    body.add("names = " + names(plan.names()));
                    body.add("values = " + dict(plan.values()));
                    addEntityAssignments(body, plan.updateEntity());
                    request.add("'UpdateExpression': update");
                    if (plan.condition() != null) request.add("'ConditionExpression': " + PythonSyntax.quote(plan.condition()));
                    request.add("'ExpressionAttributeNames': names");
                    request.add("'ExpressionAttributeValues': serialize(values)");
                } else {
                    if (plan.update() != null) request.add("'UpdateExpression': " + PythonSyntax.quote(plan.update()));
                    addConditionArguments(request, plan);
                }
                body.add("items.append({'Update': {" + String.join(", ", request) + "}})");
            }
            case DELETE -> {
                addConditionArguments(request, plan);
                body.add("items.append({'Delete': {" + String.join(", ", request) + "}})");
            }
            case CONDITION_CHECK -> {
                addConditionArguments(request, plan);
                body.add("items.append({'ConditionCheck': {" + String.join(", ", request) + "}})");
            }
            case GET -> body.add("items.append({'Get': {" + String.join(", ", request) + "}})");
            case PUT -> throw new IllegalStateException("handled above");
        }
    }

    private void addConditionArguments(List<String> request, ExpressionPlan plan) {
        if (plan.condition() != null) request.add("'ConditionExpression': " + PythonSyntax.quote(plan.condition()));
        if (plan.hasNames()) request.add("'ExpressionAttributeNames': " + names(plan.names()));
        if (plan.hasValues()) request.add("'ExpressionAttributeValues': serialize(" + dict(plan.values()) + ")");
    }

    // =========================================================================
    // Expression plumbing
    // =========================================================================

    private void addExpressionArguments(List<String> body, ExpressionPlan plan) {
        if (plan.hasNames()) body.add(INDENT + "'ExpressionAttributeNames': " + names(plan.names()) + ",");
        if (plan.hasValues()) body.add(INDENT + "'ExpressionAttributeValues': " + dict(plan.values()) + ",");
    }

    private static String names(Map<String, String> names) {
        return "{" + names.entrySet().stream()
            .map(e -> PythonSyntax.quote(e.getKey()) + ": " + PythonSyntax.quote(e.getValue()))
            .collect(Collectors.joining(", ")) + "}";
    }

    private String dict(List<ExpressionPlan.NamedValue> entries) {
        return "{" + entries.stream()
            .map(e -> PythonSyntax.quote(e.name()) + ": " + value(e.source()))
            .collect(Collectors.joining(", ")) + "}";
    }

    String value(ValueSource source) {
        return switch (source.kind()) {
            case TEMPLATE -> PythonSyntax.templateValue(source.template(), f -> variable(source.bindings().get(f)));
            case ENTITY_TEMPLATE -> PythonSyntax.templateValue(source.template(),
                f -> variable(source.entityParameter()) + "." + profile.fieldName(f));
            case PARAMETER -> PythonSyntax.prefixed(source.literal(), variable(source.parameter()));
            case LITERAL -> PythonSyntax.quote(source.literal());
        };
    }

    /** Kind of an entity field, string when unknown. */
    static FieldKind kindOf(EntityDefinition entity, String field) {
        return entity.field(field).flatMap(FieldDefinition::kind).orElse(FieldKind.STRING);
    }
}
