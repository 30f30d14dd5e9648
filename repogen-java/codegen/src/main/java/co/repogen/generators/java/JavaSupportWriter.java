package co.repogen.generators.java;

import co.repogen.core.Names;
import co.repogen.core.resolve.ResolvedEntity;
import co.repogen.core.resolve.ResolvedTable;
import com.squareup.javapoet.ArrayTypeName;
import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.FieldSpec;
import com.squareup.javapoet.JavaFile;
import com.squareup.javapoet.MethodSpec;
import com.squareup.javapoet.ParameterizedTypeName;
import com.squareup.javapoet.TypeName;
import com.squareup.javapoet.TypeSpec;
import com.squareup.javapoet.TypeVariableName;
import com.squareup.javapoet.WildcardTypeName;

import javax.lang.model.element.Modifier;

/**
 * Shared runtime classes of generated code: the client wrapper, AttributeValue conversions
 * and one config class per table.
 */
final class JavaSupportWriter {

    private static final ClassName FUNCTION = ClassName.get("java.util.function", "Function");

    private final JavaLayout layout;

    JavaSupportWriter(JavaLayout layout) {
        this.layout = layout;
    }

    static String tableEnvironmentVariable(String tableName) {
        return Names.toConstantCase(tableName) + "_TABLE_NAME";
    }

    /** Name of the config method creating an entity's repository. */
    static String repositoryFactory(String entityName) {
        return Names.uncap(Names.toPascalCase(entityName)) + "Repository";
    }

    // =========================================================================
    // Client wrapper
    // =========================================================================

    String client() {
        ClassName clientClass = layout.client();
        ClassName builderClass = clientClass.nestedClass("Builder");
        ClassName ddb = JavaTypes.DYNAMO_DB_CLIENT;

        TypeSpec.Builder tb = TypeSpec.classBuilder(clientClass)
            .addModifiers(Modifier.PUBLIC)
            .addJavadoc("DI-friendly DynamoDB client wrapper bound to one table.\n")
            .addJavadoc("Supports builder pattern, endpoint override, and client injection.\n");

        tb.addField(FieldSpec.builder(ddb, "dynamoDbClient", Modifier.PRIVATE, Modifier.FINAL).build());
        tb.addField(FieldSpec.builder(String.class, "tableName", Modifier.PRIVATE, Modifier.FINAL).build());

        tb.addMethod(MethodSpec.constructorBuilder()
            .addModifiers(Modifier.PRIVATE)
            .addParameter(ddb, "dynamoDbClient")
            .addParameter(String.class, "tableName")
            .addStatement("this.dynamoDbClient = dynamoDbClient")
            .addStatement("this.tableName = tableName")
            .build());

        tb.addMethod(MethodSpec.methodBuilder("getDynamoDbClient")
            .addModifiers(Modifier.PUBLIC)
            .returns(ddb)
            .addStatement("return dynamoDbClient")
            .build());

        tb.addMethod(MethodSpec.methodBuilder("getTableName")
            .addModifiers(Modifier.PUBLIC)
            .returns(String.class)
            .addStatement("return tableName")
            .build());

        tb.addMethod(MethodSpec.methodBuilder("builder")
            .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
            .addJavadoc("Create a builder for configuration.\n")
            .returns(builderClass)
            .addStatement("return new Builder()")
            .build());

        tb.addMethod(MethodSpec.methodBuilder("wrap")
            .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
            .addJavadoc("Wrap an existing DynamoDbClient (for testing/DI).\n")
            .addParameter(ddb, "client")
            .addParameter(String.class, "tableName")
            .returns(clientClass)
            .addStatement("return new $T(client, tableName)", clientClass)
            .build());

        TypeSpec.Builder builder = TypeSpec.classBuilder("Builder")
            .addModifiers(Modifier.PUBLIC, Modifier.STATIC);
        builder.addField(String.class, "tableName", Modifier.PRIVATE);
        builder.addField(String.class, "region", Modifier.PRIVATE);
        builder.addField(String.class, "endpoint", Modifier.PRIVATE);
        builder.addField(ddb, "existingClient", Modifier.PRIVATE);

        builder.addMethod(setter(builderClass, "tableName", String.class, null));
        builder.addMethod(setter(builderClass, "region", String.class, null));
        builder.addMethod(setter(builderClass, "endpoint", String.class,
            "Override endpoint for local DynamoDB testing.\nExample: \"http://localhost:8000\"\n"));
        builder.addMethod(MethodSpec.methodBuilder("existingClient")
            .addModifiers(Modifier.PUBLIC)
            .addJavadoc("Use an existing client (for dependency injection).\n")
            .addParameter(ddb, "client")
            .returns(builderClass)
            .addStatement("this.existingClient = client")
            .addStatement("return this")
            .build());

        builder.addMethod(MethodSpec.methodBuilder("build")
            .addModifiers(Modifier.PUBLIC)
            .returns(clientClass)
            .beginControlFlow("if (existingClient != null)")
            .addStatement("return new $T(existingClient, tableName)", clientClass)
            .endControlFlow()
            .addCode("\n// Check environment overrides\n")
            .addStatement("String resolvedRegion = resolve(region, \"AWS_REGION\", \"AWS_DEFAULT_REGION\")")
            .addStatement("String resolvedEndpoint = resolve(endpoint, \"DYNAMODB_ENDPOINT\")")
            .addCode("\n")
            .addStatement("$T ddbBuilder = $T.builder()", JavaTypes.DYNAMO_DB_CLIENT_BUILDER, ddb)
            .beginControlFlow("if (resolvedRegion != null)")
            .addStatement("ddbBuilder.region($T.of(resolvedRegion))", JavaTypes.REGION)
            .endControlFlow()
            .beginControlFlow("if (resolvedEndpoint != null)")
            .addStatement("ddbBuilder.endpointOverride($T.create(resolvedEndpoint))", ClassName.get("java.net", "URI"))
            .endControlFlow()
            .addStatement("return new $T(ddbBuilder.build(), tableName)", clientClass)
            .build());

        builder.addMethod(MethodSpec.methodBuilder("resolve")
            .addModifiers(Modifier.PRIVATE)
            .addParameter(String.class, "value")
            .addParameter(ArrayTypeName.of(String.class), "envVars")
            .varargs(true)
            .returns(String.class)
            .beginControlFlow("if (value != null)")
            .addStatement("return value")
            .endControlFlow()
            .beginControlFlow("for (String env : envVars)")
            .addStatement("String v = System.getenv(env)")
            .beginControlFlow("if (v != null && !v.isEmpty())")
            .addStatement("return v")
            .endControlFlow()
            .endControlFlow()
            .addStatement("return null")
            .build());

        tb.addType(builder.build());
        return write(layout.packageOf("client"), tb.build());
    }

    private static MethodSpec setter(ClassName builderClass, String name, Class<?> type, String javadoc) {
        MethodSpec.Builder m = MethodSpec.methodBuilder(name)
            .addModifiers(Modifier.PUBLIC)
            .addParameter(type, name)
            .returns(builderClass)
            .addStatement("this.$L = $L", name, name)
            .addStatement("return this");
        if (javadoc != null) m.addJavadoc(javadoc);
        return m.build();
    }

    // =========================================================================
    // AttributeValue conversions
    // =========================================================================

    String attributeValues() {
        ClassName av = JavaTypes.ATTRIBUTE_VALUE;
        TypeVariableName t = TypeVariableName.get("T");
        TypeName anyList = ParameterizedTypeName.get(JavaTypes.LIST, WildcardTypeName.subtypeOf(Object.class));
        TypeName anyMap = ParameterizedTypeName.get(JavaTypes.MAP, WildcardTypeName.subtypeOf(Object.class),
            WildcardTypeName.subtypeOf(Object.class));

        TypeSpec.Builder tb = TypeSpec.classBuilder(layout.attributeValues())
            .addModifiers(Modifier.PUBLIC, Modifier.FINAL)
            .addJavadoc("Conversions between Java values and DynamoDB {@link $T}s.\n", av);

        tb.addMethod(MethodSpec.constructorBuilder().addModifiers(Modifier.PRIVATE).build());

        tb.addMethod(MethodSpec.methodBuilder("of")
            .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
            .addJavadoc("Strings become S, numbers N, booleans BOOL, lists L, maps M and null NULL.\n")
            .addParameter(Object.class, "value")
            .returns(av)
            .beginControlFlow("if (value == null)")
            .addStatement("return $T.builder().nul(true).build()", av)
            .endControlFlow()
            .beginControlFlow("if (value instanceof $T attribute)", av)
            .addStatement("return attribute")
            .endControlFlow()
            .beginControlFlow("if (value instanceof String s)")
            .addStatement("return $T.builder().s(s).build()", av)
            .endControlFlow()
            .beginControlFlow("if (value instanceof $T d)", JavaTypes.BIG_DECIMAL)
            .addStatement("return $T.builder().n(d.toPlainString()).build()", av)
            .endControlFlow()
            .beginControlFlow("if (value instanceof Number n)")
            .addStatement("return $T.builder().n(n.toString()).build()", av)
            .endControlFlow()
            .beginControlFlow("if (value instanceof Boolean b)")
            .addStatement("return $T.builder().bool(b).build()", av)
            .endControlFlow()
            .beginControlFlow("if (value instanceof $T list)", anyList)
            .addStatement("$T items = new $T<>()", JavaTypes.listOf(av), JavaTypes.ARRAY_LIST)
            .beginControlFlow("for (Object item : list)")
            .addStatement("items.add(of(item))")
            .endControlFlow()
            .addStatement("return $T.builder().l(items).build()", av)
            .endControlFlow()
            .beginControlFlow("if (value instanceof $T map)", anyMap)
            .addStatement("$T entries = new $T<>()", JavaTypes.ITEM, JavaTypes.LINKED_HASH_MAP)
            .addStatement("map.forEach((k, v) -> entries.put(String.valueOf(k), of(v)))")
            .addStatement("return $T.builder().m(entries).build()", av)
            .endControlFlow()
            .addStatement("return $T.builder().s(value.toString()).build()", av)
            .build());

        tb.addMethod(MethodSpec.methodBuilder("asString")
            .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
            .addParameter(av, "value")
            .returns(String.class)
            .addStatement("return isNull(value) ? null : value.s()")
            .build());

        tb.addMethod(MethodSpec.methodBuilder("asLong")
            .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
            .addParameter(av, "value")
            .returns(JavaTypes.LONG)
            .addStatement("return isNull(value) || value.n() == null ? null : Long.valueOf(value.n())")
            .build());

        tb.addMethod(MethodSpec.methodBuilder("asDecimal")
            .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
            .addParameter(av, "value")
            .returns(JavaTypes.BIG_DECIMAL)
            .addStatement("return isNull(value) || value.n() == null ? null : new $T(value.n())", JavaTypes.BIG_DECIMAL)
            .build());

        tb.addMethod(MethodSpec.methodBuilder("asBoolean")
            .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
            .addParameter(av, "value")
            .returns(JavaTypes.BOOLEAN)
            .addStatement("return isNull(value) ? null : value.bool()")
            .build());

        tb.addMethod(MethodSpec.methodBuilder("asList")
            .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
            .addTypeVariable(t)
            .addParameter(av, "value")
            .addParameter(ParameterizedTypeName.get(FUNCTION, av, t), "element")
            .returns(JavaTypes.listOf(t))
            .beginControlFlow("if (isNull(value) || !value.hasL())")
            .addStatement("return null")
            .endControlFlow()
            .addStatement("$T items = new $T<>()", JavaTypes.listOf(t), JavaTypes.ARRAY_LIST)
            .beginControlFlow("for ($T item : value.l())", av)
            .addStatement("items.add(element.apply(item))")
            .endControlFlow()
            .addStatement("return items")
            .build());

        tb.addMethod(MethodSpec.methodBuilder("asMap")
            .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
            .addParameter(av, "value")
            .returns(JavaTypes.OBJECT_MAP)
            .beginControlFlow("if (isNull(value) || !value.hasM())")
            .addStatement("return null")
            .endControlFlow()
            .addStatement("$T entries = new $T<>()", JavaTypes.OBJECT_MAP, JavaTypes.LINKED_HASH_MAP)
            .addStatement("value.m().forEach((k, v) -> entries.put(k, toJava(v)))")
            .addStatement("return entries")
            .build());

        tb.addMethod(MethodSpec.methodBuilder("toJava")
            .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
            .addJavadoc("Untyped value: String, BigDecimal, Boolean, List, Map or null.\n")
            .addParameter(av, "value")
            .returns(Object.class)
            .beginControlFlow("if (isNull(value))")
            .addStatement("return null")
            .endControlFlow()
            .beginControlFlow("if (value.s() != null)")
            .addStatement("return value.s()")
            .endControlFlow()
            .beginControlFlow("if (value.n() != null)")
            .addStatement("return new $T(value.n())", JavaTypes.BIG_DECIMAL)
            .endControlFlow()
            .beginControlFlow("if (value.bool() != null)")
            .addStatement("return value.bool()")
            .endControlFlow()
            .beginControlFlow("if (value.hasL())")
            .addStatement("return asList(value, $T::toJava)", layout.attributeValues())
            .endControlFlow()
            .beginControlFlow("if (value.hasM())")
            .addStatement("return asMap(value)")
            .endControlFlow()
            .beginControlFlow("if (value.hasSs())")
            .addStatement("return value.ss()")
            .endControlFlow()
            .beginControlFlow("if (value.hasNs())")
            .addStatement("return value.ns().stream().map($T::new).toList()", JavaTypes.BIG_DECIMAL)
            .endControlFlow()
            .addStatement("return null")
            .build());

        tb.addMethod(MethodSpec.methodBuilder("isNull")
            .addModifiers(Modifier.PRIVATE, Modifier.STATIC)
            .addParameter(av, "value")
            .returns(boolean.class)
            .addStatement("return value == null || Boolean.TRUE.equals(value.nul())")
            .build());

        return write(layout.packageOf("client"), tb.build());
    }

    // =========================================================================
    // Per-table config
    // =========================================================================

    String config(ResolvedTable table) {
        ClassName configClass = layout.config(table.name());
        ClassName clientClass = layout.client();
        ClassName builderClass = clientClass.nestedClass("Builder");
        String env = tableEnvironmentVariable(table.name());

        TypeSpec.Builder tb = TypeSpec.classBuilder(configClass)
            .addModifiers(Modifier.PUBLIC, Modifier.FINAL)
            .addJavadoc("Constants and repository factories for table $L.\n", table.name());

        tb.addField(FieldSpec.builder(String.class, "TABLE_NAME", Modifier.PUBLIC, Modifier.STATIC, Modifier.FINAL)
            .addJavadoc("Table name, overridable with the {@code $L} environment variable.\n", env)
            .initializer("$T.requireNonNullElse($T.getenv($S), $S)", JavaTypes.OBJECTS, System.class, env, table.name())
            .build());
        tb.addField(FieldSpec.builder(String.class, "PARTITION_KEY", Modifier.PUBLIC, Modifier.STATIC, Modifier.FINAL)
            .initializer("$S", table.definition().partitionKey())
            .build());
        if (table.definition().hasSortKey()) {
            tb.addField(FieldSpec.builder(String.class, "SORT_KEY", Modifier.PUBLIC, Modifier.STATIC, Modifier.FINAL)
                .initializer("$S", table.definition().sortKey())
                .build());
        }

        tb.addField(FieldSpec.builder(clientClass, "sharedClient", Modifier.PRIVATE, Modifier.STATIC, Modifier.VOLATILE)
            .build());

        tb.addMethod(MethodSpec.constructorBuilder().addModifiers(Modifier.PRIVATE).build());

        tb.addMethod(MethodSpec.methodBuilder("getClient")
            .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
            .addJavadoc("Get or create the shared client (lazy singleton).\n")
            .returns(clientClass)
            .beginControlFlow("if (sharedClient == null)")
            .beginControlFlow("synchronized ($T.class)", configClass)
            .beginControlFlow("if (sharedClient == null)")
            .addStatement("sharedClient = $T.builder()\n.tableName(TABLE_NAME)\n.build()", clientClass)
            .endControlFlow()
            .endControlFlow()
            .endControlFlow()
            .addStatement("return sharedClient")
            .build());

        tb.addMethod(MethodSpec.methodBuilder("clientBuilder")
            .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
            .addJavadoc("Create a custom client builder (for testing or custom config).\n")
            .returns(builderClass)
            .addStatement("return $T.builder()\n.tableName(TABLE_NAME)", clientClass)
            .build());

        for (ResolvedEntity entity : table.entities()) {
            String methodName = repositoryFactory(entity.name());
            ClassName repoClass = layout.repository(entity.name());

            tb.addMethod(MethodSpec.methodBuilder(methodName)
                .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
                .returns(repoClass)
                .addStatement("return new $T(getClient())", repoClass)
                .build());

            tb.addMethod(MethodSpec.methodBuilder(methodName)
                .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
                .addParameter(clientClass, "client")
                .returns(repoClass)
                .addStatement("return new $T(client)", repoClass)
                .build());
        }

        return write(layout.packageOf("config"), tb.build());
    }

    static String write(String pkg, TypeSpec type) {
        return JavaFile.builder(pkg, type)
            .skipJavaLangImports(true)
            .build()
            .toString();
    }
}
