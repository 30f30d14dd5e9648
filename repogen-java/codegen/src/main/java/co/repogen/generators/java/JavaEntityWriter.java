package co.repogen.generators.java;

import co.repogen.core.Names;
import co.repogen.core.model.EntityDefinition;
import co.repogen.core.model.FieldDefinition;
import co.repogen.core.model.FieldKind;
import co.repogen.core.resolve.ResolvedEntity;
import co.repogen.core.resolve.ResolvedIndexKey;
import co.repogen.core.template.CompiledKey;
import co.repogen.core.template.KeyTemplate;
import co.repogen.generators.ExpressionPlanner;
import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.CodeBlock;
import com.squareup.javapoet.FieldSpec;
import com.squareup.javapoet.JavaFile;
import com.squareup.javapoet.MethodSpec;
import com.squareup.javapoet.TypeName;
import com.squareup.javapoet.TypeSpec;

import javax.lang.model.element.Modifier;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Entity classes and their key helpers.
 */
final class JavaEntityWriter {

    /** One entity field as a Java bean property. */
    record BeanField(String attribute, String codeName, TypeName type, FieldKind kind, FieldKind itemKind) {
    }

    private final JavaLayout layout;
    private final JavaProfile profile;

    JavaEntityWriter(JavaLayout layout, JavaProfile profile) {
        this.layout = layout;
        this.profile = profile;
    }

    List<BeanField> fields(EntityDefinition entity) {
        List<BeanField> fields = new ArrayList<>();
        for (FieldDefinition f : entity.fields()) {
            FieldKind kind = f.kind().orElse(FieldKind.STRING);
            FieldKind itemKind = f.itemKind().orElse(null);
            fields.add(new BeanField(f.name(), profile.fieldName(f.name()), JavaTypes.field(kind, itemKind), kind,
                itemKind));
        }
        return fields;
    }

    FieldKind kindOf(EntityDefinition entity, String fieldName) {
        return entity.field(fieldName).flatMap(FieldDefinition::kind).orElse(FieldKind.STRING);
    }

    TypeName typeOf(EntityDefinition entity, String fieldName) {
        return JavaTypes.scalar(kindOf(entity, fieldName));
    }

    // =========================================================================
    // Entity
    // =========================================================================

    String entity(ResolvedEntity entity) {
        EntityDefinition def = entity.definition();
        ClassName entityClass = layout.entity(entity.name());
        ClassName keysClass = layout.keys(entity.name());
        ClassName values = layout.attributeValues();
        List<BeanField> fields = fields(def);

        TypeSpec.Builder tb = TypeSpec.classBuilder(entityClass)
            .addModifiers(Modifier.PUBLIC)
            .addJavadoc("$L item of table $L.\n", entity.name(), entity.table().name())
            .addJavadoc("Partition key: $L = $L\n", entity.table().partitionKey(), def.pkTemplate());
        if (entity.sortKey() != null) {
            tb.addJavadoc("Sort key: $L = $L\n", entity.table().sortKey(), def.skTemplate());
        } else {
            tb.addJavadoc("No sort key.\n");
        }

        tb.addField(FieldSpec.builder(String.class, "ENTITY_TYPE", Modifier.PUBLIC, Modifier.STATIC, Modifier.FINAL)
            .addJavadoc("Value of the {@code $L} attribute of every $L item.\n",
                ExpressionPlanner.ENTITY_TYPE_ATTRIBUTE, entity.name())
            .initializer("$S", def.entityType())
            .build());

        for (BeanField f : fields) {
            tb.addField(FieldSpec.builder(f.type(), f.codeName(), Modifier.PRIVATE).build());
        }

        addConstructors(tb, fields);
        for (BeanField f : fields) {
            tb.addMethod(MethodSpec.methodBuilder("get" + Names.cap(f.codeName()))
                .addModifiers(Modifier.PUBLIC)
                .returns(f.type())
                .addStatement("return $L", f.codeName())
                .build());
        }
        addSetters(tb, fields);

        String keyArgs = entity.primaryKeyFields().stream().map(profile::fieldName).collect(Collectors.joining(", "));
        tb.addMethod(MethodSpec.methodBuilder("toKey")
            .addModifiers(Modifier.PUBLIC)
            .addJavadoc("Primary key attributes of this item.\n")
            .returns(JavaTypes.ITEM)
            .addStatement("return $T.key($L)", keysClass, keyArgs)
            .build());

        MethodSpec.Builder toItem = MethodSpec.methodBuilder("toItem")
            .addModifiers(Modifier.PUBLIC)
            .addJavadoc("Full item: primary key, entity type, index keys whose fields are set, and every non-null field.\n")
            .returns(JavaTypes.ITEM)
            .addStatement("$T item = toKey()", JavaTypes.ITEM)
            .addStatement("item.put($S, $T.of(ENTITY_TYPE))", ExpressionPlanner.ENTITY_TYPE_ATTRIBUTE, values);
        for (ResolvedIndexKey index : entity.indexKeys()) {
            addIndexAttributes(toItem, entity, index, index.index().partitionKey().values(), index.partitionKey(),
                "PartitionKey");
            if (index.sortKey() != null && index.index().hasSortKey()) {
                addIndexAttributes(toItem, entity, index, index.index().sortKey().values(), index.sortKey(), "SortKey");
            }
        }
        for (BeanField f : fields) {
            toItem.beginControlFlow("if ($L != null)", f.codeName())
                .addStatement("item.put($S, $T.of($L))", f.attribute(), values, f.codeName())
                .endControlFlow();
        }
        toItem.addStatement("return item");
        tb.addMethod(toItem.build());

        MethodSpec.Builder fromItem = MethodSpec.methodBuilder("fromItem")
            .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
            .addJavadoc("Rebuild an entity from a DynamoDB item. Missing attributes stay null.\n")
            .addParameter(JavaTypes.ITEM, "item")
            .returns(entityClass)
            .addStatement("$T entity = new $T()", entityClass, entityClass);
        for (BeanField f : fields) {
            if (f.kind() == FieldKind.ARRAY) {
                FieldKind element = f.itemKind() == null ? FieldKind.STRING : f.itemKind();
                fromItem.addStatement("entity.$L = $T.asList(item.get($S), $T::$L)", f.codeName(), values,
                    f.attribute(), values, JavaTypes.reader(element));
            } else {
                fromItem.addStatement("entity.$L = $T.$L(item.get($S))", f.codeName(), values,
                    JavaTypes.reader(f.kind()), f.attribute());
            }
        }
        fromItem.addStatement("return entity");
        tb.addMethod(fromItem.build());

        addBuilderClass(tb, entityClass, fields);
        addEqualsHashCodeToString(tb, entityClass, fields);

        return JavaFile.builder(layout.basePackage(), tb.build())
            .skipJavaLangImports(true)
            .build()
            .toString();
    }

    /**
     * Index key attributes go into the item only when every field they are built from is set,
     * so sparse indexes stay sparse.
     */
    private void addIndexAttributes(MethodSpec.Builder method, ResolvedEntity entity, ResolvedIndexKey index,
            List<String> attributes, CompiledKey key, String suffix) {
        ClassName values = layout.attributeValues();
        for (int i = 0; i < key.size(); i++) {
            KeyTemplate template = key.parts().get(i);
            String attribute = attributes.get(Math.min(i, attributes.size() - 1));
            CodeBlock value = key.multiAttribute()
                ? JavaTypes.templateValue(template, f -> operand(entity, f))
                : CodeBlock.of("$T.$L($L)", layout.keys(entity.name()), indexKeyMethod(index, suffix),
                    argList(template.fieldNames()));
            List<String> guarded = template.fieldNames().stream()
                .map(f -> profile.fieldName(f) + " != null")
                .toList();
            if (guarded.isEmpty()) {
                method.addStatement("item.put($S, $T.of($L))", attribute, values, value);
            } else {
                method.beginControlFlow("if ($L)", String.join(" && ", guarded))
                    .addStatement("item.put($S, $T.of($L))", attribute, values, value)
                    .endControlFlow();
            }
        }
    }

    private JavaTypes.Operand operand(ResolvedEntity entity, String field) {
        return new JavaTypes.Operand(CodeBlock.of("$L", profile.fieldName(field)), kindOf(entity.definition(), field));
    }

    private String argList(List<String> fieldNames) {
        return fieldNames.stream().map(profile::fieldName).collect(Collectors.joining(", "));
    }

    static String indexKeyMethod(ResolvedIndexKey index, String suffix) {
        return Names.uncap(Names.toPascalCase(index.indexName())) + suffix;
    }

    static String indexConstant(String indexName) {
        return "INDEX_" + Names.toConstantCase(indexName);
    }

    // =========================================================================
    // Keys helper
    // =========================================================================

    String keys(ResolvedEntity entity) {
        EntityDefinition def = entity.definition();
        ClassName keysClass = layout.keys(entity.name());
        ClassName values = layout.attributeValues();

        TypeSpec.Builder tb = TypeSpec.classBuilder(keysClass)
            .addModifiers(Modifier.PUBLIC, Modifier.FINAL)
            .addJavadoc("Key attribute names and key value builders for $L items.\n", entity.name());

        tb.addField(FieldSpec.builder(String.class, "PARTITION_KEY_ATTRIBUTE",
                Modifier.PUBLIC, Modifier.STATIC, Modifier.FINAL)
            .addJavadoc("Partition key attribute of table $L.\n", entity.table().name())
            .initializer("$S", entity.table().partitionKey())
            .build());
        if (entity.sortKey() != null) {
            tb.addField(FieldSpec.builder(String.class, "SORT_KEY_ATTRIBUTE",
                    Modifier.PUBLIC, Modifier.STATIC, Modifier.FINAL)
                .addJavadoc("Sort key attribute of table $L.\n", entity.table().name())
                .initializer("$S", entity.table().sortKey())
                .build());
            if (!entity.sortKeyPrefix().isEmpty()) {
                tb.addField(FieldSpec.builder(String.class, "SORT_KEY_PREFIX",
                        Modifier.PUBLIC, Modifier.STATIC, Modifier.FINAL)
                    .addJavadoc("Literal start of every $L sort key.\n", entity.name())
                    .initializer("$S", entity.sortKeyPrefix())
                    .build());
            }
        }
        for (ResolvedIndexKey index : entity.indexKeys()) {
            tb.addField(FieldSpec.builder(String.class, indexConstant(index.indexName()),
                    Modifier.PUBLIC, Modifier.STATIC, Modifier.FINAL)
                .initializer("$S", index.indexName())
                .build());
        }

        tb.addMethod(MethodSpec.constructorBuilder().addModifiers(Modifier.PRIVATE).build());

        tb.addMethod(keyMethod(def, "partitionKey", entity.partitionKey().first(),
            CodeBlock.of("Partition key value: {@code $L}.\n", entity.partitionKey().first().source())));
        if (entity.sortKey() != null) {
            tb.addMethod(keyMethod(def, "sortKey", entity.sortKey().first(),
                CodeBlock.of("Sort key value: {@code $L}.\n", entity.sortKey().first().source())));
        }

        MethodSpec.Builder key = MethodSpec.methodBuilder("key")
            .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
            .addJavadoc("Primary key map for GetItem, DeleteItem and UpdateItem. The map is mutable.\n")
            .returns(JavaTypes.ITEM);
        for (String f : entity.primaryKeyFields()) {
            key.addParameter(typeOf(def, f), profile.fieldName(f));
        }
        key.addStatement("$T key = new $T<>()", JavaTypes.ITEM, JavaTypes.LINKED_HASH_MAP)
            .addStatement("key.put(PARTITION_KEY_ATTRIBUTE, $T.of(partitionKey($L)))", values,
                argList(entity.partitionKey().fieldNames()));
        if (entity.sortKey() != null) {
            key.addStatement("key.put(SORT_KEY_ATTRIBUTE, $T.of(sortKey($L)))", values,
                argList(entity.sortKey().fieldNames()));
        }
        key.addStatement("return key");
        tb.addMethod(key.build());

        for (ResolvedIndexKey index : entity.indexKeys()) {
            tb.addMethod(indexKeyBuilder(def, index, index.partitionKey(), "PartitionKey"));
            if (index.sortKey() != null) {
                tb.addMethod(indexKeyBuilder(def, index, index.sortKey(), "SortKey"));
            }
        }

        return JavaFile.builder(layout.packageOf("keys"), tb.build())
            .skipJavaLangImports(true)
            .build()
            .toString();
    }

    private MethodSpec keyMethod(EntityDefinition def, String name, KeyTemplate template, CodeBlock javadoc) {
        MethodSpec.Builder m = MethodSpec.methodBuilder(name)
            .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
            .addJavadoc(javadoc)
            .returns(JavaTypes.templateType(template, f -> kindOf(def, f)));
        for (String f : template.fieldNames()) {
            m.addParameter(typeOf(def, f), profile.fieldName(f));
        }
        for (String f : template.fieldNames()) {
            m.addStatement("$T.requireNonNull($L, $S)", JavaTypes.OBJECTS, profile.fieldName(f), profile.fieldName(f));
        }
        m.addStatement("return $L", JavaTypes.templateValue(template,
            f -> new JavaTypes.Operand(CodeBlock.of("$L", profile.fieldName(f)), kindOf(def, f))));
        return m.build();
    }

    private MethodSpec indexKeyBuilder(EntityDefinition def, ResolvedIndexKey index, CompiledKey key, String suffix) {
        String name = indexKeyMethod(index, suffix);
        if (!key.multiAttribute()) {
            return keyMethod(def, name, key.first(),
                CodeBlock.of("$L $L value: {@code $L}.\n", index.indexName(),
                    suffix.equals("SortKey") ? "sort key" : "partition key", key.first().source()));
        }
        MethodSpec.Builder m = MethodSpec.methodBuilder(name)
            .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
            .addJavadoc("$L multi-attribute key values, one per key attribute.\n", index.indexName())
            .returns(JavaTypes.OBJECT_LIST);
        for (String f : key.fieldNames()) {
            m.addParameter(typeOf(def, f), profile.fieldName(f));
        }
        List<CodeBlock> parts = new ArrayList<>();
        for (KeyTemplate t : key.parts()) {
            parts.add(JavaTypes.templateValue(t,
                f -> new JavaTypes.Operand(CodeBlock.of("$L", profile.fieldName(f)), kindOf(def, f))));
        }
        m.addStatement("return $T.of($L)", JavaTypes.LIST, CodeBlock.join(parts, ", "));
        return m.build();
    }

    // =========================================================================
    // Plain-Java boilerplate
    // =========================================================================

    private static void addConstructors(TypeSpec.Builder tb, List<BeanField> fields) {
        tb.addMethod(MethodSpec.constructorBuilder()
            .addModifiers(Modifier.PUBLIC)
            .addJavadoc("Empty entity, used by {@code fromItem}.\n")
            .build());

        if (!fields.isEmpty()) {
            MethodSpec.Builder allArgs = MethodSpec.constructorBuilder()
                .addModifiers(Modifier.PUBLIC)
                .addJavadoc("All-args constructor.\n");
            for (BeanField f : fields) {
                allArgs.addParameter(f.type(), f.codeName());
            }
            for (BeanField f : fields) {
                allArgs.addStatement("this.$L = $L", f.codeName(), f.codeName());
            }
            tb.addMethod(allArgs.build());
        }
    }

    private static void addSetters(TypeSpec.Builder tb, List<BeanField> fields) {
        for (BeanField f : fields) {
            tb.addMethod(MethodSpec.methodBuilder("set" + Names.cap(f.codeName()))
                .addModifiers(Modifier.PUBLIC)
                .addParameter(f.type(), f.codeName())
                .addStatement("this.$L = $L", f.codeName(), f.codeName())
                .build());
        }
    }

    private static void addBuilderClass(TypeSpec.Builder tb, ClassName entityRef, List<BeanField> fields) {
        ClassName builderRef = entityRef.nestedClass("Builder");

        tb.addMethod(MethodSpec.methodBuilder("builder")
            .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
            .returns(builderRef)
            .addStatement("return new Builder()")
            .build());

        TypeSpec.Builder builderTb = TypeSpec.classBuilder("Builder")
            .addModifiers(Modifier.PUBLIC, Modifier.STATIC);
        for (BeanField f : fields) {
            builderTb.addField(FieldSpec.builder(f.type(), f.codeName(), Modifier.PRIVATE).build());
        }
        for (BeanField f : fields) {
            builderTb.addMethod(MethodSpec.methodBuilder(f.codeName())
                .addModifiers(Modifier.PUBLIC)
                .addParameter(f.type(), f.codeName())
                .returns(builderRef)
                .addStatement("this.$L = $L", f.codeName(), f.codeName())
                .addStatement("return this")
                .build());
        }

        MethodSpec.Builder buildMethod = MethodSpec.methodBuilder("build")
            .addModifiers(Modifier.PUBLIC)
            .returns(entityRef);
        if (fields.isEmpty()) {
            buildMethod.addStatement("return new $T()", entityRef);
        } else {
            String argList = fields.stream().map(BeanField::codeName).collect(Collectors.joining(", "));
            buildMethod.addStatement("return new $T($L)", entityRef, argList);
        }
        builderTb.addMethod(buildMethod.build());

        tb.addType(builderTb.build());
    }

    private static void addEqualsHashCodeToString(TypeSpec.Builder tb, ClassName entityRef, List<BeanField> fields) {
        MethodSpec.Builder equalsMethod = MethodSpec.methodBuilder("equals")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC)
            .returns(boolean.class)
            .addParameter(ClassName.get(Object.class), "o");
        equalsMethod.addStatement("if (this == o) return true");
        equalsMethod.addStatement("if (!(o instanceof $T)) return false", entityRef);
        equalsMethod.addStatement("$T that = ($T) o", entityRef, entityRef);
        if (fields.isEmpty()) {
            equalsMethod.addStatement("return true");
        } else {
            StringBuilder condExpr = new StringBuilder("return ");
            List<Object> condArgs = new ArrayList<>();
            for (int i = 0; i < fields.size(); i++) {
                if (i > 0) condExpr.append("\n    && ");
                condExpr.append("$T.equals($L, that.$L)");
                condArgs.add(JavaTypes.OBJECTS);
                condArgs.add(fields.get(i).codeName());
                condArgs.add(fields.get(i).codeName());
            }
            equalsMethod.addStatement(condExpr.toString(), condArgs.toArray());
        }
        tb.addMethod(equalsMethod.build());

        MethodSpec.Builder hashCodeMethod = MethodSpec.methodBuilder("hashCode")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC)
            .returns(int.class);
        if (fields.isEmpty()) {
            hashCodeMethod.addStatement("return 0");
        } else {
            String hashArgs = fields.stream().map(BeanField::codeName).collect(Collectors.joining(", "));
            hashCodeMethod.addStatement("return $T.hash($L)", JavaTypes.OBJECTS, hashArgs);
        }
        tb.addMethod(hashCodeMethod.build());

        String className = entityRef.simpleName();
        MethodSpec.Builder toStringMethod = MethodSpec.methodBuilder("toString")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC)
            .returns(ClassName.get(String.class));
        if (fields.isEmpty()) {
            toStringMethod.addStatement("return $S", className + "{}");
        } else {
            StringBuilder tsExpr = new StringBuilder("return $S + $L");
            List<Object> tsArgs = new ArrayList<>();
            tsArgs.add(className + "{" + fields.get(0).codeName() + "=");
            tsArgs.add(fields.get(0).codeName());
            for (int i = 1; i < fields.size(); i++) {
                tsExpr.append(" + $S + $L");
                tsArgs.add(", " + fields.get(i).codeName() + "=");
                tsArgs.add(fields.get(i).codeName());
            }
            tsExpr.append(" + $S");
            tsArgs.add("}");
            toStringMethod.addStatement(tsExpr.toString(), tsArgs.toArray());
        }
        tb.addMethod(toStringMethod.build());
    }
}
