package co.repogen.generators.java;

import co.repogen.core.Names;
import co.repogen.core.model.EntityDefinition;
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
import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.CodeBlock;
import com.squareup.javapoet.FieldSpec;
import com.squareup.javapoet.MethodSpec;
import com.squareup.javapoet.ParameterizedTypeName;
import com.squareup.javapoet.TypeName;
import com.squareup.javapoet.TypeSpec;

import javax.lang.model.element.Modifier;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Repository classes and the cross-table transaction service.
 */
final class JavaRepositoryWriter {

    private static final ClassName GET_ITEM_REQUEST = JavaTypes.model("GetItemRequest");
    private static final ClassName GET_ITEM_RESPONSE = JavaTypes.model("GetItemResponse");
    private static final ClassName PUT_ITEM_REQUEST = JavaTypes.model("PutItemRequest");
    private static final ClassName UPDATE_ITEM_REQUEST = JavaTypes.model("UpdateItemRequest");
    private static final ClassName UPDATE_ITEM_RESPONSE = JavaTypes.model("UpdateItemResponse");
    private static final ClassName DELETE_ITEM_REQUEST = JavaTypes.model("DeleteItemRequest");
    private static final ClassName DELETE_ITEM_RESPONSE = JavaTypes.model("DeleteItemResponse");
    private static final ClassName QUERY_REQUEST = JavaTypes.model("QueryRequest");
    private static final ClassName SCAN_REQUEST = JavaTypes.model("ScanRequest");
    private static final ClassName BATCH_GET_ITEM_REQUEST = JavaTypes.model("BatchGetItemRequest");
    private static final ClassName KEYS_AND_ATTRIBUTES = JavaTypes.model("KeysAndAttributes");
    private static final ClassName BATCH_WRITE_ITEM_REQUEST = JavaTypes.model("BatchWriteItemRequest");
    private static final ClassName BATCH_WRITE_ITEM_RESPONSE = JavaTypes.model("BatchWriteItemResponse");
    private static final ClassName WRITE_REQUEST = JavaTypes.model("WriteRequest");
    private static final ClassName PUT_REQUEST = JavaTypes.model("PutRequest");
    private static final ClassName RETURN_VALUE = JavaTypes.model("ReturnValue");
    private static final ClassName CONDITIONAL_CHECK_FAILED = JavaTypes.model("ConditionalCheckFailedException");
    private static final ClassName TRANSACT_WRITE_ITEM = JavaTypes.model("TransactWriteItem");
    private static final ClassName TRANSACT_WRITE_ITEMS_REQUEST = JavaTypes.model("TransactWriteItemsRequest");
    private static final ClassName TRANSACT_GET_ITEM = JavaTypes.model("TransactGetItem");
    private static final ClassName TRANSACT_GET_ITEMS_REQUEST = JavaTypes.model("TransactGetItemsRequest");
    private static final ClassName TRANSACT_GET_ITEMS_RESPONSE = JavaTypes.model("TransactGetItemsResponse");
    private static final ClassName ITEM_RESPONSE = JavaTypes.model("ItemResponse");
    private static final ClassName TRANSACTION_CANCELED = JavaTypes.model("TransactionCanceledException");
    private static final ClassName PUT = JavaTypes.model("Put");
    private static final ClassName UPDATE = JavaTypes.model("Update");
    private static final ClassName DELETE = JavaTypes.model("Delete");
    private static final ClassName CONDITION_CHECK = JavaTypes.model("ConditionCheck");
    private static final ClassName GET = JavaTypes.model("Get");

    /** Local variable names used by generated method bodies. */
    private static final Set<String> RESERVED = Set.of("key", "keys", "names", "values", "item", "items", "request",
        "response", "writes", "result", "assignments", "entry", "i", "e", "dynamoDb", "tableName");

    private final JavaLayout layout;
    private final JavaProfile profile;
    private final JavaEntityWriter entities;
    private final Map<String, EntityDefinition> definitions = new HashMap<>();
    private final Map<String, ResolvedEntity> resolved = new HashMap<>();

    JavaRepositoryWriter(JavaLayout layout, JavaProfile profile, JavaEntityWriter entities, ResolvedModel model) {
        this.layout = layout;
        this.profile = profile;
        this.entities = entities;
        for (ResolvedEntity e : model.entities()) {
            definitions.put(e.name(), e.definition());
            resolved.put(e.name(), e);
        }
    }

    // =========================================================================
    // Repository
    // =========================================================================

    String repository(ResolvedEntity entity) {
        ClassName entityClass = layout.entity(entity.name());
        ClassName repoClass = layout.repository(entity.name());
        ClassName clientClass = layout.client();

        TypeSpec.Builder tb = TypeSpec.classBuilder(repoClass)
            .addModifiers(Modifier.PUBLIC)
            .addJavadoc("Repository for $L items of table $L.\n", entity.name(), entity.table().name())
            .addJavadoc("CRUD methods plus one method per access pattern.\n");

        tb.addField(FieldSpec.builder(JavaTypes.DYNAMO_DB_CLIENT, "dynamoDb", Modifier.PRIVATE, Modifier.FINAL).build());
        tb.addField(FieldSpec.builder(String.class, "tableName", Modifier.PRIVATE, Modifier.FINAL).build());

        tb.addMethod(MethodSpec.constructorBuilder()
            .addModifiers(Modifier.PUBLIC)
            .addParameter(clientClass, "client")
            .addStatement("this(client.getDynamoDbClient(), client.getTableName())")
            .build());

        tb.addMethod(MethodSpec.constructorBuilder()
            .addModifiers(Modifier.PUBLIC)
            .addJavadoc("Constructor for dependency injection and testing.\n")
            .addParameter(JavaTypes.DYNAMO_DB_CLIENT, "dynamoDb")
            .addParameter(String.class, "tableName")
            .addStatement("this.dynamoDb = dynamoDb")
            .addStatement("this.tableName = tableName")
            .build());

        addCrudMethods(tb, entity, entityClass);

        for (ResolvedPattern pattern : entity.ownMethods()) {
            tb.addMethod(patternMethod(entity, entityClass, pattern));
        }

        return JavaSupportWriter.write(layout.packageOf("repository"), tb.build());
    }

    private void addCrudMethods(TypeSpec.Builder tb, ResolvedEntity entity, ClassName entityClass) {
        ClassName keysClass = layout.keys(entity.name());
        String var = entityVariable(entity.name());
        List<String> keyFields = entity.primaryKeyFields();
        String keyArgs = keyFields.stream().map(this::variable).collect(Collectors.joining(", "));

        tb.addMethod(MethodSpec.methodBuilder(profile.methodName(entity.crud().create()))
            .addModifiers(Modifier.PUBLIC)
            .addJavadoc(crudJavadoc(entity, entity.crud().create(), "Store a new $L. Fails if the key is taken.\n"))
            .addParameter(entityClass, var)
            .returns(entityClass)
            .addStatement("dynamoDb.putItem($L)", putRequest(entity, var, "attribute_not_exists(#pk)"))
            .addStatement("return $L", var)
            .build());

        MethodSpec.Builder get = MethodSpec.methodBuilder(profile.methodName(entity.crud().get()))
            .addModifiers(Modifier.PUBLIC)
            .addJavadoc(crudJavadoc(entity, entity.crud().get(), "Get a $L by primary key.\n"))
            .returns(JavaTypes.optionalOf(entityClass));
        addKeyParameters(get, entity);
        CodeBlock.Builder getRequest = CodeBlock.builder()
            .add("$T.builder()", GET_ITEM_REQUEST)
            .add("\n.tableName(tableName)")
            .add("\n.key($T.key($L))", keysClass, keyArgs);
        if (entity.consistentCrudGet()) getRequest.add("\n.consistentRead(true)");
        getRequest.add("\n.build()");
        get.addStatement("$T response = dynamoDb.getItem($L)", GET_ITEM_RESPONSE, getRequest.build())
            .addStatement("return response.hasItem() ? $T.of($T.fromItem(response.item())) : $T.empty()",
                JavaTypes.OPTIONAL, entityClass, JavaTypes.OPTIONAL);
        tb.addMethod(get.build());

        tb.addMethod(MethodSpec.methodBuilder(profile.methodName(entity.crud().update()))
            .addModifiers(Modifier.PUBLIC)
            .addJavadoc(crudJavadoc(entity, entity.crud().update(), "Replace an existing $L. Fails if it does not exist.\n"))
            .addParameter(entityClass, var)
            .returns(entityClass)
            .addStatement("dynamoDb.putItem($L)", putRequest(entity, var, "attribute_exists(#pk)"))
            .addStatement("return $L", var)
            .build());

        MethodSpec.Builder delete = MethodSpec.methodBuilder(profile.methodName(entity.crud().delete()))
            .addModifiers(Modifier.PUBLIC)
            .addJavadoc(crudJavadoc(entity, entity.crud().delete(), "Delete a $L by primary key.\n"))
            .addJavadoc("@return whether an item was deleted\n")
            .returns(TypeName.BOOLEAN);
        addKeyParameters(delete, entity);
        delete.addStatement("$T response = dynamoDb.deleteItem($L)", DELETE_ITEM_RESPONSE, CodeBlock.builder()
                .add("$T.builder()", DELETE_ITEM_REQUEST)
                .add("\n.tableName(tableName)")
                .add("\n.key($T.key($L))", keysClass, keyArgs)
                .add("\n.returnValues($T.ALL_OLD)", RETURN_VALUE)
                .add("\n.build()")
                .build())
            .addStatement("return response.hasAttributes()");
        tb.addMethod(delete.build());
    }

    private CodeBlock crudJavadoc(ResolvedEntity entity, String method, String summary) {
        CodeBlock.Builder doc = CodeBlock.builder().add(summary, entity.name());
        List<Integer> served = entity.patterns().stream()
            .filter(p -> method.equals(p.crudMethod()))
            .map(ResolvedPattern::id)
            .toList();
        if (!served.isEmpty()) {
            doc.add("Serves access pattern $L.\n",
                served.stream().map(id -> "#" + id).collect(Collectors.joining(", ")));
        }
        return doc.build();
    }

    private CodeBlock putRequest(ResolvedEntity entity, String var, String condition) {
        return CodeBlock.builder()
            .add("$T.builder()", PUT_ITEM_REQUEST)
            .add("\n.tableName(tableName)")
            .add("\n.item($L.toItem())", var)
            .add("\n.conditionExpression($S)", condition)
            .add("\n.expressionAttributeNames($T.of($S, $S))", JavaTypes.MAP, "#pk", entity.table().partitionKey())
            .add("\n.build()")
            .build();
    }

    private void addKeyParameters(MethodSpec.Builder method, ResolvedEntity entity) {
        for (String f : entity.primaryKeyFields()) {
            method.addParameter(entities.typeOf(entity.definition(), f), variable(f));
        }
    }

    // =========================================================================
    // Access pattern methods
    // =========================================================================

    private MethodSpec patternMethod(ResolvedEntity entity, ClassName entityClass, ResolvedPattern pattern) {
        Scope scope = new Scope(pattern.parameters());
        MethodSpec.Builder m = MethodSpec.methodBuilder(profile.methodName(pattern.methodName()))
            .addModifiers(Modifier.PUBLIC)
            .returns(returnType(pattern, entityClass));
        if (pattern.description() != null && !pattern.description().isBlank()) {
            m.addJavadoc("$L\n\n", pattern.description());
        }
        m.addJavadoc("<p>Access pattern #$L: $L$L.\n", pattern.id(), pattern.operation().wire(),
            pattern.usesIndex() ? " on index " + pattern.indexName() : "");
        if (pattern.responseShape().isRaw()) {
            m.addJavadoc("Returns raw items: the entity cannot be rebuilt from what this read returns.\n");
        }
        for (ResolvedParameter p : pattern.parameters()) {
            m.addParameter(parameterType(p, pattern, entityClass), scope.var(p.name()));
        }

        ExpressionPlan plan = ExpressionPlanner.plan(entity, pattern);
        switch (pattern.operation()) {
            case GET_ITEM -> getItem(m, pattern, plan, scope);
            case QUERY -> query(m, entity, pattern, plan, scope);
            case SCAN -> scan(m, pattern, plan, scope);
            case PUT_ITEM -> putItem(m, entity, pattern, scope);
            case UPDATE_ITEM -> updateItem(m, entity, pattern, plan, scope);
            case DELETE_ITEM -> deleteItem(m, pattern, plan, scope);
            case BATCH_GET_ITEM -> batchGet(m, entity, pattern, scope);
            case BATCH_WRITE_ITEM -> batchWrite(m, entity, pattern, scope);
        }
        return m.build();
    }

    private TypeName returnType(ResolvedPattern pattern, ClassName entityClass) {
        boolean mayMiss = pattern.operation().isRead() || pattern.operation() == Operation.DELETE_ITEM;
        return switch (pattern.responseShape()) {
            case ENTITY -> mayMiss ? JavaTypes.optionalOf(entityClass) : entityClass;
            case ENTITY_LIST -> JavaTypes.listOf(entityClass);
            case ATTRIBUTE_MAP -> mayMiss ? JavaTypes.optionalOf(JavaTypes.ITEM) : JavaTypes.ITEM;
            case ATTRIBUTE_MAP_LIST, MIXED -> JavaTypes.ITEM_LIST;
            case SUCCESS_FLAG -> TypeName.BOOLEAN;
            case NONE -> TypeName.VOID;
        };
    }

    private TypeName parameterType(ResolvedParameter p, ResolvedPattern pattern, ClassName entityClass) {
        if (p.isEntity()) return layout.entity(p.entityType());
        if (p.kind() == ParameterKind.ARRAY && isBatch(pattern.operation())) return JavaTypes.listOf(entityClass);
        return JavaTypes.scalar(p.valueKind());
    }

    private static boolean isBatch(Operation operation) {
        return operation == Operation.BATCH_GET_ITEM || operation == Operation.BATCH_WRITE_ITEM;
    }

    private void getItem(MethodSpec.Builder m, ResolvedPattern pattern, ExpressionPlan plan, Scope scope) {
        addKey(m, "key", plan, scope);
        CodeBlock.Builder request = CodeBlock.builder()
            .add("$T.builder()", GET_ITEM_REQUEST)
            .add("\n.tableName(tableName)")
            .add("\n.key(key)");
        if (pattern.consistentRead()) request.add("\n.consistentRead(true)");
        request.add("\n.build()");
        m.addStatement("$T response = dynamoDb.getItem($L)", GET_ITEM_RESPONSE, request.build())
            .addStatement("$T items = response.hasItem() ? $T.of(response.item()) : $T.of()",
                JavaTypes.ITEM_LIST, JavaTypes.LIST, JavaTypes.LIST);
        returnRead(m, pattern, layout.entity(scopeEntity(pattern)));
    }

    private void query(MethodSpec.Builder m, ResolvedEntity entity, ResolvedPattern pattern, ExpressionPlan plan,
            Scope scope) {
        addExpressionMaps(m, "", plan, scope);
        CodeBlock.Builder request = CodeBlock.builder()
            .add("$T request = $T.builder()", QUERY_REQUEST, QUERY_REQUEST)
            .add("\n.tableName(tableName)");
        if (pattern.usesIndex()) {
            if (entity.indexKey(pattern.indexName()).isPresent()) {
                request.add("\n.indexName($T.$L)", layout.keys(entity.name()),
                    JavaEntityWriter.indexConstant(pattern.indexName()));
            } else {
                request.add("\n.indexName($S)", pattern.indexName());
            }
        }
        request.add("\n.keyConditionExpression($S)", plan.keyCondition());
        if (plan.filter() != null) request.add("\n.filterExpression($S)", plan.filter());
        addExpressionArguments(request, "", plan);
        if (pattern.consistentRead()) request.add("\n.consistentRead(true)");
        request.add("\n.build()");
        m.addStatement(request.build());
        collectPages(m, pattern, "queryPaginator");
        returnRead(m, pattern, layout.entity(entity.name()));
    }

    private void scan(MethodSpec.Builder m, ResolvedPattern pattern, ExpressionPlan plan, Scope scope) {
        addExpressionMaps(m, "", plan, scope);
        CodeBlock.Builder request = CodeBlock.builder()
            .add("$T request = $T.builder()", SCAN_REQUEST, SCAN_REQUEST)
            .add("\n.tableName(tableName)");
        if (plan.filter() != null) request.add("\n.filterExpression($S)", plan.filter());
        addExpressionArguments(request, "", plan);
        if (pattern.consistentRead()) request.add("\n.consistentRead(true)");
        request.add("\n.build()");
        m.addStatement(request.build());
        collectPages(m, pattern, "scanPaginator");
        returnRead(m, pattern, layout.entity(scopeEntity(pattern)));
    }

    private void collectPages(MethodSpec.Builder m, ResolvedPattern pattern, String paginator) {
        m.addStatement("$T items = new $T<>()", JavaTypes.ITEM_LIST, JavaTypes.ARRAY_LIST)
            .beginControlFlow("for ($T item : dynamoDb.$L(request).items())", JavaTypes.ITEM, paginator)
            .addStatement("items.add(item)");
        if (!pattern.responseShape().isList()) {
            m.addStatement("break");
        }
        m.endControlFlow();
    }

    private void putItem(MethodSpec.Builder m, ResolvedEntity entity, ResolvedPattern pattern, Scope scope) {
        String entityParam = firstEntityParameter(pattern);
        addItem(m, entity, pattern, scope, entityParam);
        m.addStatement("dynamoDb.putItem($L)", CodeBlock.builder()
            .add("$T.builder()", PUT_ITEM_REQUEST)
            .add("\n.tableName(tableName)")
            .add("\n.item(item)")
            .add("\n.build()")
            .build());
        if (entityParam != null && pattern.responseShape() == ResponseShape.ENTITY) {
            m.addStatement("return $L", scope.var(entityParam));
            return;
        }
        m.addStatement("$T items = $T.of(item)", JavaTypes.ITEM_LIST, JavaTypes.LIST);
        returnWritten(m, pattern, layout.entity(entity.name()), CodeBlock.of("true"));
    }

    /** Declares {@code item}: the entity parameter's item or one built from scalar parameters. */
    private void addItem(MethodSpec.Builder m, ResolvedEntity entity, ResolvedPattern pattern, Scope scope,
            String entityParam) {
        ClassName values = layout.attributeValues();
        if (entityParam != null) {
            m.addStatement("$T item = $L.toItem()", JavaTypes.ITEM, scope.var(entityParam));
        } else {
            List<String> keyFields = entity.primaryKeyFields();
            if (keyFields.stream().allMatch(scope::has)) {
                m.addStatement("$T item = $T.key($L)", JavaTypes.ITEM, layout.keys(entity.name()),
                    keyFields.stream().map(scope::var).collect(Collectors.joining(", ")));
            } else {
                m.addStatement("$T item = new $T<>()", JavaTypes.ITEM, JavaTypes.LINKED_HASH_MAP);
            }
            m.addStatement("item.put($S, $T.of($T.ENTITY_TYPE))", ExpressionPlanner.ENTITY_TYPE_ATTRIBUTE, values,
                layout.entity(entity.name()));
        }
        for (ResolvedParameter p : pattern.parameters()) {
            if (p.isEntity()) continue;
            m.addStatement("item.put($S, $T.of($L))", p.name(), values, scope.var(p.name()));
        }
    }

    private void updateItem(MethodSpec.Builder m, ResolvedEntity entity, ResolvedPattern pattern, ExpressionPlan plan,
            Scope scope) {
        addKey(m, "key", plan, scope);
        CodeBlock updateExpression = addUpdateMaps(m, "", plan, scope);
        m.addStatement("names.put($S, $S)", "#pk", entity.table().partitionKey());

        CodeBlock.Builder request = CodeBlock.builder()
            .add("$T.builder()", UPDATE_ITEM_REQUEST)
            .add("\n.tableName(tableName)")
            .add("\n.key(key)");
        if (updateExpression != null) request.add("\n.updateExpression($L)", updateExpression);
        request.add("\n.conditionExpression($S)", "attribute_exists(#pk)")
            .add("\n.expressionAttributeNames(names)");
        if (plan.updateEntity() != null || plan.hasValues()) request.add("\n.expressionAttributeValues(values)");
        request.add("\n.returnValues($T.ALL_NEW)", RETURN_VALUE)
            .add("\n.build()");

        if (pattern.responseShape() == ResponseShape.SUCCESS_FLAG) {
            m.beginControlFlow("try")
                .addStatement("dynamoDb.updateItem($L)", request.build())
                .addStatement("return true")
                .nextControlFlow("catch ($T e)", CONDITIONAL_CHECK_FAILED)
                .addStatement("return false")
                .endControlFlow();
            return;
        }
        m.addStatement("$T response = dynamoDb.updateItem($L)", UPDATE_ITEM_RESPONSE, request.build());
        if (pattern.responseShape() != ResponseShape.NONE) {
            m.addStatement("$T items = $T.of(response.attributes())", JavaTypes.ITEM_LIST, JavaTypes.LIST);
        }
        returnWritten(m, pattern, layout.entity(entity.name()), CodeBlock.of("true"));
    }

    /**
     * Declares {@code names} and {@code values} for an update and returns the update
     * expression, or null when nothing is set.
     */
    private CodeBlock addUpdateMaps(MethodSpec.Builder m, String suffix, ExpressionPlan plan, Scope scope) {
        String names = "names" + suffix;
        String values = "values" + suffix;
        m.addStatement("$T $L = new $T<>()", JavaTypes.NAMES, names, JavaTypes.LINKED_HASH_MAP);
        plan.names().forEach((placeholder, attribute) ->
            m.addStatement("$L.put($S, $S)", names, placeholder, attribute));
        if (plan.updateEntity() == null && !plan.hasValues()) {
            return plan.update() == null ? null : CodeBlock.of("$S", plan.update());
        }
        m.addStatement("$T $L = new $T<>()", JavaTypes.ITEM, values, JavaTypes.LINKED_HASH_MAP);
        for (ExpressionPlan.NamedValue v : plan.values()) {
            m.addStatement("$L.put($S, $T.of($L))", values, v.name(), layout.attributeValues(), value(v.source(), scope));
        }
        if (plan.updateEntity() == null) {
            return plan.update() == null ? null : CodeBlock.of("$S", plan.update());
        }

        // every non-key attribute of the entity
        String item = "item" + suffix;
        String assignments = "assignments" + suffix;
        String key = "key" + suffix;
        m.addStatement("$T $L = $L.toItem()", JavaTypes.ITEM, item, scope.var(plan.updateEntity()))
            .addStatement("$L.keySet().forEach($L::remove)", key, item)
            .addStatement("$T $L = new $T<>()", JavaTypes.listOf(JavaTypes.STRING), assignments, JavaTypes.ARRAY_LIST)
            .addStatement("int i = 0")
            .beginControlFlow("for ($T entry : $L.entrySet())",
                ParameterizedTypeName.get(ClassName.get(Map.Entry.class), JavaTypes.STRING, JavaTypes.ATTRIBUTE_VALUE),
                item)
            .addStatement("$L.put($S + i, entry.getKey())", names, "#a")
            .addStatement("$L.put($S + i, entry.getValue())", values, ":a")
            .addStatement("$L.add($S + i + $S + i)", assignments, "#a", " = :a")
            .addStatement("i++")
            .endControlFlow();
        return CodeBlock.of("$S + $T.join($S, $L)", "SET ", JavaTypes.STRING, ", ", assignments);
    }

    private void deleteItem(MethodSpec.Builder m, ResolvedPattern pattern, ExpressionPlan plan, Scope scope) {
        addKey(m, "key", plan, scope);
        m.addStatement("$T response = dynamoDb.deleteItem($L)", DELETE_ITEM_RESPONSE, CodeBlock.builder()
                .add("$T.builder()", DELETE_ITEM_REQUEST)
                .add("\n.tableName(tableName)")
                .add("\n.key(key)")
                .add("\n.returnValues($T.ALL_OLD)", RETURN_VALUE)
                .add("\n.build()")
                .build())
            .addStatement("$T items = response.hasAttributes() ? $T.of(response.attributes()) : $T.of()",
                JavaTypes.ITEM_LIST, JavaTypes.LIST, JavaTypes.LIST);
        returnRead(m, pattern, layout.entity(scopeEntity(pattern)));
    }

    private void batchGet(MethodSpec.Builder m, ResolvedEntity entity, ResolvedPattern pattern, Scope scope) {
        ClassName entityClass = layout.entity(entity.name());
        m.addStatement("$T keys = new $T<>()", JavaTypes.ITEM_LIST, JavaTypes.ARRAY_LIST);
        boolean any = false;
        for (ResolvedParameter p : pattern.parameters()) {
            if (p.kind() == ParameterKind.ARRAY) {
                m.beginControlFlow("for ($T entry : $L)", entityClass, scope.var(p.name()))
                    .addStatement("keys.add(entry.toKey())")
                    .endControlFlow();
                any = true;
            } else if (p.isEntity()) {
                m.addStatement("keys.add($L.toKey())", scope.var(p.name()));
                any = true;
            }
        }
        if (!any) {
            List<String> keyFields = entity.primaryKeyFields();
            if (!keyFields.stream().allMatch(scope::has)) {
                throw new IllegalStateException("batch get " + pattern.methodName()
                    + " needs an entity, array or full primary key parameter");
            }
            m.addStatement("keys.add($T.key($L))", layout.keys(entity.name()),
                keyFields.stream().map(scope::var).collect(Collectors.joining(", ")));
        }
        m.addStatement("$T items = keys.isEmpty() ? $T.of() : dynamoDb.batchGetItem($L)\n.responses()"
                + "\n.getOrDefault(tableName, $T.of())", JavaTypes.ITEM_LIST, JavaTypes.LIST, CodeBlock.builder()
                .add("$T.builder()", BATCH_GET_ITEM_REQUEST)
                .add("\n.requestItems($T.of(tableName, $T.builder().keys(keys).build()))", JavaTypes.MAP,
                    KEYS_AND_ATTRIBUTES)
                .add("\n.build()")
                .build(),
            JavaTypes.LIST);
        returnRead(m, pattern, entityClass);
    }

    private void batchWrite(MethodSpec.Builder m, ResolvedEntity entity, ResolvedPattern pattern, Scope scope) {
        ClassName entityClass = layout.entity(entity.name());
        m.addStatement("$T items = new $T<>()", JavaTypes.ITEM_LIST, JavaTypes.ARRAY_LIST);
        boolean any = false;
        for (ResolvedParameter p : pattern.parameters()) {
            if (p.kind() == ParameterKind.ARRAY) {
                m.beginControlFlow("for ($T entry : $L)", entityClass, scope.var(p.name()))
                    .addStatement("items.add(entry.toItem())")
                    .endControlFlow();
                any = true;
            } else if (p.isEntity()) {
                m.addStatement("items.add($L.toItem())", scope.var(p.name()));
                any = true;
            }
        }
        if (!any) {
            addItem(m, entity, pattern, scope, null);
            m.addStatement("items.add(item)");
        }
        m.addStatement("$T writes = new $T<>()", JavaTypes.listOf(WRITE_REQUEST), JavaTypes.ARRAY_LIST)
            .beginControlFlow("for ($T entry : items)", JavaTypes.ITEM)
            .addStatement("writes.add($T.builder().putRequest($T.builder().item(entry).build()).build())",
                WRITE_REQUEST, PUT_REQUEST)
            .endControlFlow()
            .addStatement("$T response = dynamoDb.batchWriteItem($L)", BATCH_WRITE_ITEM_RESPONSE, CodeBlock.builder()
                .add("$T.builder()", BATCH_WRITE_ITEM_REQUEST)
                .add("\n.requestItems($T.of(tableName, writes))", JavaTypes.MAP)
                .add("\n.build()")
                .build());
        returnWritten(m, pattern, entityClass, CodeBlock.of("response.unprocessedItems().isEmpty()"));
    }

    /** Return from a read whose results are in {@code items}. */
    private void returnRead(MethodSpec.Builder m, ResolvedPattern pattern, ClassName entityClass) {
        switch (pattern.responseShape()) {
            case ENTITY -> m.addStatement("return items.isEmpty() ? $T.empty() : $T.of($T.fromItem(items.get(0)))",
                JavaTypes.OPTIONAL, JavaTypes.OPTIONAL, entityClass);
            case ENTITY_LIST -> m.addStatement("return items.stream().map($T::fromItem).toList()", entityClass);
            case ATTRIBUTE_MAP -> m.addStatement("return items.isEmpty() ? $T.empty() : $T.of(items.get(0))",
                JavaTypes.OPTIONAL, JavaTypes.OPTIONAL);
            case ATTRIBUTE_MAP_LIST, MIXED -> m.addStatement("return items");
            case SUCCESS_FLAG -> m.addStatement("return !items.isEmpty()");
            case NONE -> {
                // reads with no result only check that the request succeeds
            }
        }
    }

    /** Return from a write whose written items are in {@code items}. */
    private void returnWritten(MethodSpec.Builder m, ResolvedPattern pattern, ClassName entityClass, CodeBlock success) {
        switch (pattern.responseShape()) {
            case ENTITY -> m.addStatement("return $T.fromItem(items.get(0))", entityClass);
            case ENTITY_LIST -> m.addStatement("return items.stream().map($T::fromItem).toList()", entityClass);
            case ATTRIBUTE_MAP -> m.addStatement("return items.get(0)");
            case ATTRIBUTE_MAP_LIST, MIXED -> m.addStatement("return items");
            case SUCCESS_FLAG -> m.addStatement("return $L", success);
            case NONE -> {
                // void
            }
        }
    }

    /** Entity whose items a single-table pattern returns: its repository entity. */
    private String scopeEntity(ResolvedPattern pattern) {
        return resolved.values().stream()
            .filter(e -> e.patterns().contains(pattern))
            .map(ResolvedEntity::name)
            .findFirst()
            .orElseThrow(() -> new IllegalStateException("pattern " + pattern.id() + " has no entity"));
    }

    private static String firstEntityParameter(ResolvedPattern pattern) {
        return pattern.parameters().stream()
            .filter(ResolvedParameter::isEntity)
            .map(ResolvedParameter::name)
            .findFirst()
            .orElse(null);
    }

    // =========================================================================
    // Transactions
    // =========================================================================

    String transactionService(List<ResolvedTransaction> transactions) {
        ClassName serviceClass = layout.transactionService();

        TypeSpec.Builder tb = TypeSpec.classBuilder(serviceClass)
            .addModifiers(Modifier.PUBLIC)
            .addJavadoc("Atomic operations spanning several tables.\n");

        tb.addField(FieldSpec.builder(JavaTypes.DYNAMO_DB_CLIENT, "dynamoDb", Modifier.PRIVATE, Modifier.FINAL).build());

        tb.addMethod(MethodSpec.constructorBuilder()
            .addModifiers(Modifier.PUBLIC)
            .addParameter(layout.client(), "client")
            .addStatement("this(client.getDynamoDbClient())")
            .build());

        tb.addMethod(MethodSpec.constructorBuilder()
            .addModifiers(Modifier.PUBLIC)
            .addJavadoc("Constructor for dependency injection and testing.\n")
            .addParameter(JavaTypes.DYNAMO_DB_CLIENT, "dynamoDb")
            .addStatement("this.dynamoDb = dynamoDb")
            .build());

        for (ResolvedTransaction tx : transactions) {
            tb.addMethod(transactionMethod(tx));
        }
        return JavaSupportWriter.write(layout.packageOf("transaction"), tb.build());
    }

    private MethodSpec transactionMethod(ResolvedTransaction tx) {
        Scope scope = new Scope(tx.parameters());
        boolean write = tx.operation() == TransactionOperation.TRANSACT_WRITE;
        MethodSpec.Builder m = MethodSpec.methodBuilder(profile.methodName(tx.methodName()))
            .addModifiers(Modifier.PUBLIC)
            .returns(transactionReturnType(tx));
        if (tx.description() != null && !tx.description().isBlank()) {
            m.addJavadoc("$L\n\n", tx.description());
        }
        m.addJavadoc("<p>Access pattern #$L: $L over $L.\n", tx.id(), tx.operation().wire(),
            tx.participants().stream().map(p -> p.action().wire() + " " + p.entity()).collect(Collectors.joining(", ")));
        for (ResolvedParameter p : tx.parameters()) {
            TypeName type = p.isEntity() ? layout.entity(p.entityType()) : JavaTypes.scalar(p.valueKind());
            m.addParameter(type, scope.var(p.name()));
        }

        ClassName itemType = write ? TRANSACT_WRITE_ITEM : TRANSACT_GET_ITEM;
        m.addStatement("$T items = new $T<>()", JavaTypes.listOf(itemType), JavaTypes.ARRAY_LIST);
        for (int i = 0; i < tx.participants().size(); i++) {
            ResolvedParticipant participant = tx.participants().get(i);
            ResolvedEntity target = resolved.get(participant.entity());
            if (target == null) {
                throw new IllegalStateException("transaction " + tx.methodName() + " names unknown entity "
                    + participant.entity());
            }
            ExpressionPlan plan = ExpressionPlanner.plan(target, participant, tx);
            m.addCode("\n// $L $L\n", participant.action().wire(), participant.entity());
            addParticipant(m, String.valueOf(i), participant, target, plan, scope);
        }
        m.addCode("\n");

        if (write) {
            CodeBlock request = CodeBlock.of("$T.builder().transactItems(items).build()", TRANSACT_WRITE_ITEMS_REQUEST);
            switch (tx.returnType()) {
                case BOOLEAN -> m.beginControlFlow("try")
                    .addStatement("dynamoDb.transactWriteItems($L)", request)
                    .addStatement("return true")
                    .nextControlFlow("catch ($T e)", TRANSACTION_CANCELED)
                    .addStatement("return false")
                    .endControlFlow();
                case OBJECT -> {
                    m.addStatement("dynamoDb.transactWriteItems($L)", request)
                        .addStatement("$T result = new $T<>()", JavaTypes.OBJECT_MAP, JavaTypes.LINKED_HASH_MAP);
                    for (ResolvedParameter p : tx.parameters()) {
                        m.addStatement("result.put($S, $L)", p.name(), scope.var(p.name()));
                    }
                    m.addStatement("return result");
                }
                case ARRAY -> {
                    m.addStatement("dynamoDb.transactWriteItems($L)", request)
                        .addStatement("$T result = new $T<>()", JavaTypes.OBJECT_LIST, JavaTypes.ARRAY_LIST);
                    for (ResolvedParameter p : tx.parameters()) {
                        m.addStatement("result.add($L)", scope.var(p.name()));
                    }
                    m.addStatement("return result");
                }
            }
            return m.build();
        }

        m.addStatement("$T response = dynamoDb.transactGetItems($T.builder().transactItems(items).build())",
            TRANSACT_GET_ITEMS_RESPONSE, TRANSACT_GET_ITEMS_REQUEST);
        switch (tx.returnType()) {
            case BOOLEAN -> m.addStatement("return response.responses().stream().allMatch($T::hasItem)", ITEM_RESPONSE);
            case OBJECT -> {
                m.addStatement("$T result = new $T<>()", ParameterizedTypeName.get(JavaTypes.MAP, JavaTypes.STRING,
                    JavaTypes.ITEM), JavaTypes.LINKED_HASH_MAP);
                Map<String, Integer> seen = new LinkedHashMap<>();
                for (int i = 0; i < tx.participants().size(); i++) {
                    String entity = tx.participants().get(i).entity();
                    int n = seen.merge(entity, 1, Integer::sum);
                    m.addStatement("result.put($S, response.responses().get($L).item())",
                        n == 1 ? entity : entity + n, i);
                }
                m.addStatement("return result");
            }
            case ARRAY -> m.addStatement("return response.responses().stream().map($T::item).toList()", ITEM_RESPONSE);
        }
        return m.build();
    }

    private TypeName transactionReturnType(ResolvedTransaction tx) {
        boolean write = tx.operation() == TransactionOperation.TRANSACT_WRITE;
        return switch (tx.returnType()) {
            case BOOLEAN -> TypeName.BOOLEAN;
            case OBJECT -> write
                ? JavaTypes.OBJECT_MAP
                : ParameterizedTypeName.get(JavaTypes.MAP, JavaTypes.STRING, JavaTypes.ITEM);
            case ARRAY -> write ? JavaTypes.OBJECT_LIST : JavaTypes.ITEM_LIST;
        };
    }

    private void addParticipant(MethodSpec.Builder m, String n, ResolvedParticipant participant,
            ResolvedEntity target, ExpressionPlan plan, Scope scope) {
        ClassName config = layout.config(participant.table());
        TransactionAction action = participant.action();
        String key = "key" + n;

        if (action == TransactionAction.PUT) {
            String item = "item" + n;
            if (plan.updateEntity() != null) {
                m.addStatement("$T $L = $L.toItem()", JavaTypes.ITEM, item, scope.var(plan.updateEntity()));
            } else {
                addKey(m, item, plan, scope);
                m.addStatement("$L.put($S, $T.of($T.ENTITY_TYPE))", item, ExpressionPlanner.ENTITY_TYPE_ATTRIBUTE,
                    layout.attributeValues(), layout.entity(target.name()));
                for (ExpressionPlan.NamedValue a : plan.attributes()) {
                    m.addStatement("$L.put($S, $T.of($L))", item, a.name(), layout.attributeValues(),
                        value(a.source(), scope));
                }
            }
            addExpressionMaps(m, n, plan, scope);
            CodeBlock.Builder put = CodeBlock.builder()
                .add("$T.builder()", PUT)
                .add("\n.tableName($T.TABLE_NAME)", config)
                .add("\n.item($L)", item);
            addCondition(put, n, plan);
            m.addStatement("items.add($T.builder().put($L).build())", TRANSACT_WRITE_ITEM, put.add("\n.build()").build());
            return;
        }

        addKey(m, key, plan, scope);
        switch (action) {
            case UPDATE -> {
                CodeBlock updateExpression = addUpdateMaps(m, n, plan, scope);
                CodeBlock.Builder update = CodeBlock.builder()
                    .add("$T.builder()", UPDATE)
                    .add("\n.tableName($T.TABLE_NAME)", config)
                    .add("\n.key($L)", key);
                if (updateExpression != null) update.add("\n.updateExpression($L)", updateExpression);
                if (plan.condition() != null) update.add("\n.conditionExpression($S)", plan.condition());
                if (plan.hasNames() || plan.updateEntity() != null) update.add("\n.expressionAttributeNames(names$L)", n);
                if (plan.hasValues() || plan.updateEntity() != null) {
                    update.add("\n.expressionAttributeValues(values$L)", n);
                }
                m.addStatement("items.add($T.builder().update($L).build())", TRANSACT_WRITE_ITEM,
                    update.add("\n.build()").build());
            }
            case DELETE -> {
                addExpressionMaps(m, n, plan, scope);
                CodeBlock.Builder delete = CodeBlock.builder()
                    .add("$T.builder()", DELETE)
                    .add("\n.tableName($T.TABLE_NAME)", config)
                    .add("\n.key($L)", key);
                addCondition(delete, n, plan);
                m.addStatement("items.add($T.builder().delete($L).build())", TRANSACT_WRITE_ITEM,
                    delete.add("\n.build()").build());
            }
            case CONDITION_CHECK -> {
                addExpressionMaps(m, n, plan, scope);
                CodeBlock.Builder check = CodeBlock.builder()
                    .add("$T.builder()", CONDITION_CHECK)
                    .add("\n.tableName($T.TABLE_NAME)", config)
                    .add("\n.key($L)", key);
                addCondition(check, n, plan);
                m.addStatement("items.add($T.builder().conditionCheck($L).build())", TRANSACT_WRITE_ITEM,
                    check.add("\n.build()").build());
            }
            case GET -> m.addStatement("items.add($T.builder().get($L).build())", TRANSACT_GET_ITEM, CodeBlock.builder()
                .add("$T.builder()", GET)
                .add("\n.tableName($T.TABLE_NAME)", config)
                .add("\n.key($L)", key)
                .add("\n.build()")
                .build());
            case PUT -> throw new IllegalStateException("handled above");
        }
    }

    private static void addCondition(CodeBlock.Builder request, String n, ExpressionPlan plan) {
        if (plan.condition() != null) request.add("\n.conditionExpression($S)", plan.condition());
        addExpressionArguments(request, n, plan);
    }

    // =========================================================================
    // Expression plumbing
    // =========================================================================

    private void addKey(MethodSpec.Builder m, String var, ExpressionPlan plan, Scope scope) {
        m.addStatement("$T $L = new $T<>()", JavaTypes.ITEM, var, JavaTypes.LINKED_HASH_MAP);
        for (ExpressionPlan.NamedValue k : plan.key()) {
            m.addStatement("$L.put($S, $T.of($L))", var, k.name(), layout.attributeValues(), value(k.source(), scope));
        }
    }

    private void addExpressionMaps(MethodSpec.Builder m, String suffix, ExpressionPlan plan, Scope scope) {
        if (plan.hasNames()) {
            m.addStatement("$T names$L = new $T<>()", JavaTypes.NAMES, suffix, JavaTypes.LINKED_HASH_MAP);
            plan.names().forEach((placeholder, attribute) ->
                m.addStatement("names$L.put($S, $S)", suffix, placeholder, attribute));
        }
        if (plan.hasValues()) {
            m.addStatement("$T values$L = new $T<>()", JavaTypes.ITEM, suffix, JavaTypes.LINKED_HASH_MAP);
            for (ExpressionPlan.NamedValue v : plan.values()) {
                m.addStatement("values$L.put($S, $T.of($L))", suffix, v.name(), layout.attributeValues(),
                    value(v.source(), scope));
            }
        }
    }

    private static void addExpressionArguments(CodeBlock.Builder request, String suffix, ExpressionPlan plan) {
        if (plan.hasNames()) request.add("\n.expressionAttributeNames(names$L)", suffix);
        if (plan.hasValues()) request.add("\n.expressionAttributeValues(values$L)", suffix);
    }

    private CodeBlock value(ValueSource source, Scope scope) {
        return switch (source.kind()) {
            case TEMPLATE -> JavaTypes.templateValue(source.template(), f -> scope.operand(source.bindings().get(f)));
            case ENTITY_TEMPLATE -> {
                ResolvedParameter p = scope.param(source.entityParameter());
                EntityDefinition def = definitions.get(p.entityType());
                yield JavaTypes.templateValue(source.template(), f -> new JavaTypes.Operand(
                    CodeBlock.of("$L.get$L()", scope.var(p.name()), Names.cap(profile.fieldName(f))),
                    def == null ? FieldKind.STRING : entities.kindOf(def, f)));
            }
            case PARAMETER -> JavaTypes.prefixed(source.literal(), scope.operand(source.parameter()));
            case LITERAL -> CodeBlock.of("$S", source.literal());
        };
    }

    private String variable(String name) {
        String var = profile.fieldName(name);
        return RESERVED.contains(var) ? var + "Param" : var;
    }

    private String entityVariable(String entityName) {
        return variable(Names.uncap(profile.className(entityName)));
    }

    /** Parameters of one generated method and their Java variable names. */
    private final class Scope {
        private final Map<String, ResolvedParameter> params = new LinkedHashMap<>();

        Scope(List<ResolvedParameter> parameters) {
            for (ResolvedParameter p : parameters) params.put(p.name(), p);
        }

        boolean has(String name) {
            return params.containsKey(name);
        }

        ResolvedParameter param(String name) {
            ResolvedParameter p = params.get(name);
            if (p == null) throw new IllegalStateException("no parameter named '" + name + "'");
            return p;
        }

        String var(String name) {
            return variable(param(name).name());
        }

        JavaTypes.Operand operand(String name) {
            ResolvedParameter p = param(name);
            return new JavaTypes.Operand(CodeBlock.of("$L", var(name)), p.valueKind());
        }
    }
}
