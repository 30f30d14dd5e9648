package co.repogen.generators.java;

import co.repogen.core.Names;
import co.repogen.core.model.EntityDefinition;
import co.repogen.core.model.FieldDefinition;
import co.repogen.core.model.FieldKind;
import co.repogen.core.model.Operation;
import co.repogen.core.model.ParameterKind;
import co.repogen.core.resolve.ResolvedEntity;
import co.repogen.core.resolve.ResolvedModel;
import co.repogen.core.resolve.ResolvedParameter;
import co.repogen.core.resolve.ResolvedParticipant;
import co.repogen.core.resolve.ResolvedPattern;
import co.repogen.core.resolve.ResolvedTransaction;
import co.repogen.core.resolve.ResponseShape;
import co.repogen.core.usage.EntityUsage;
import co.repogen.core.usage.UsageData;
import co.repogen.generators.SampleValueStrategy;
import com.squareup.javapoet.ArrayTypeName;
import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.CodeBlock;
import com.squareup.javapoet.MethodSpec;
import com.squareup.javapoet.ParameterizedTypeName;
import com.squareup.javapoet.TypeSpec;
import com.squareup.javapoet.WildcardTypeName;

import javax.lang.model.element.Modifier;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * A runnable {@code UsageExamples} class: creates one sample item per entity, calls every
 * access pattern and transaction, then deletes the samples.
 */
final class JavaUsageWriter {

    private static final ClassName SUPPLIER = ClassName.get("java.util.function", "Supplier");
    private static final ClassName DYNAMO_DB_EXCEPTION = JavaTypes.model("DynamoDbException");

    private final JavaLayout layout;
    private final JavaProfile profile;
    private final SampleValueStrategy samples;
    private final UsageData usage;
    private final Map<String, EntityDefinition> definitions = new LinkedHashMap<>();

    JavaUsageWriter(JavaLayout layout, JavaProfile profile, ResolvedModel model, UsageData usage) {
        this.layout = layout;
        this.profile = profile;
        this.samples = profile.sampleValues();
        this.usage = usage;
        for (ResolvedEntity e : model.entities()) definitions.put(e.name(), e.definition());
    }

    String usageExamples(ResolvedModel model) {
        ClassName examplesClass = layout.usageExamples();
        Map<String, String> entityVars = new LinkedHashMap<>();
        Map<String, String> repositoryVars = new LinkedHashMap<>();
        for (ResolvedEntity entity : model.entities()) {
            String var = profile.fieldName(entity.name());
            entityVars.put(entity.name(), var);
            repositoryVars.put(entity.name(), var + "Repository");
        }

        MethodSpec.Builder main = MethodSpec.methodBuilder("main")
            .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
            .addParameter(ArrayTypeName.of(String.class), "args");

        main.addCode("// Repositories share one client per table; set DYNAMODB_ENDPOINT for DynamoDB Local\n");
        for (ResolvedEntity entity : model.entities()) {
            main.addStatement("$T $L = $T.$L()", layout.repository(entity.name()), repositoryVars.get(entity.name()),
                layout.config(entity.table().name()), JavaSupportWriter.repositoryFactory(entity.name()));
        }
        if (model.hasTransactions()) {
            main.addStatement("$T transactionService = new $T($T.getClient())", layout.transactionService(),
                layout.transactionService(), layout.config(model.tables().get(0).name()));
        }

        for (ResolvedEntity entity : model.entities()) {
            String var = entityVars.get(entity.name());
            String repo = repositoryVars.get(entity.name());
            main.addCode("\n// $L\n", entity.name());
            main.addStatement("$T $L = $L", layout.entity(entity.name()), var, sampleEntity(entity));
            run(main, entity.crud().create(), CodeBlock.of("$L.$L($L)", repo,
                profile.methodName(entity.crud().create()), var), false);
            run(main, entity.crud().get(), CodeBlock.of("$L.$L($L)", repo,
                profile.methodName(entity.crud().get()), keyArguments(entity, var)), false);
            if (addUpdates(main, entity, var)) {
                run(main, entity.crud().update(), CodeBlock.of("$L.$L($L)", repo,
                    profile.methodName(entity.crud().update()), var), false);
            }
        }

        for (ResolvedEntity entity : model.entities()) {
            if (entity.ownMethods().isEmpty()) continue;
            main.addCode("\n// $L access patterns\n", entity.name());
            for (ResolvedPattern pattern : entity.ownMethods()) {
                List<CodeBlock> args = new ArrayList<>();
                for (ResolvedParameter p : pattern.parameters()) {
                    args.add(patternArgument(entity, pattern, p, entityVars));
                }
                run(main, pattern.methodName(), CodeBlock.of("$L.$L($L)", repositoryVars.get(entity.name()),
                    profile.methodName(pattern.methodName()), CodeBlock.join(args, ", ")),
                    pattern.responseShape() == ResponseShape.NONE);
            }
        }

        if (model.hasTransactions()) {
            main.addCode("\n// Cross-table transactions\n");
            for (ResolvedTransaction tx : model.transactions()) {
                List<CodeBlock> args = new ArrayList<>();
                for (ResolvedParameter p : tx.parameters()) {
                    args.add(transactionArgument(tx, p, entityVars));
                }
                run(main, tx.methodName(), CodeBlock.of("transactionService.$L($L)",
                    profile.methodName(tx.methodName()), CodeBlock.join(args, ", ")), false);
            }
        }

        main.addCode("\n// Cleanup\n");
        for (ResolvedEntity entity : model.entities()) {
            run(main, entity.crud().delete(), CodeBlock.of("$L.$L($L)", repositoryVars.get(entity.name()),
                profile.methodName(entity.crud().delete()), keyArguments(entity, entityVars.get(entity.name()))),
                false);
        }

        TypeSpec type = TypeSpec.classBuilder(examplesClass)
            .addModifiers(Modifier.PUBLIC, Modifier.FINAL)
            .addJavadoc("Walks through every generated repository method against a live table.\n")
            .addMethod(MethodSpec.constructorBuilder().addModifiers(Modifier.PRIVATE).build())
            .addMethod(main.build())
            .addMethod(MethodSpec.methodBuilder("run")
                .addModifiers(Modifier.PRIVATE, Modifier.STATIC)
                .addParameter(String.class, "label")
                .addParameter(ParameterizedTypeName.get(SUPPLIER, WildcardTypeName.subtypeOf(Object.class)), "call")
                .beginControlFlow("try")
                .addStatement("$T.out.println(label + $S + call.get())", System.class, ": ")
                .nextControlFlow("catch ($T e)", DYNAMO_DB_EXCEPTION)
                .addStatement("$T.err.println(label + $S + e.getMessage())", System.class, " failed: ")
                .endControlFlow()
                .build())
            .build();
        return JavaSupportWriter.write(layout.packageOf("examples"), type);
    }

    private void run(MethodSpec.Builder main, String label, CodeBlock call, boolean returnsVoid) {
        if (returnsVoid) {
            main.addStatement("run($S, () -> {\n$>$L;\nreturn null;$<\n})", profile.methodName(label), call);
        } else {
            main.addStatement("run($S, () -> $L)", profile.methodName(label), call);
        }
    }

    private CodeBlock sampleEntity(ResolvedEntity entity) {
        EntityDefinition def = entity.definition();
        CodeBlock.Builder b = CodeBlock.builder().add("$T.builder()", layout.entity(entity.name()));
        samples.entityValues(def, usage).forEach((name, value) -> {
            FieldDefinition field = def.field(name).orElseThrow();
            b.add("\n.$L($L)", profile.fieldName(name), fieldLiteral(field, value));
        });
        return b.add("\n.build()").build();
    }

    private static CodeBlock fieldLiteral(FieldDefinition field, Object value) {
        FieldKind kind = field.kind().orElse(FieldKind.STRING);
        FieldKind itemKind = field.itemKind().orElse(FieldKind.STRING);
        return JavaTypes.literal(value, kind, itemKind);
    }

    private CodeBlock keyArguments(ResolvedEntity entity, String var) {
        return CodeBlock.of("$L", entity.primaryKeyFields().stream()
            .map(f -> var + ".get" + Names.cap(profile.fieldName(f)) + "()")
            .collect(Collectors.joining(", ")));
    }

    /** Applies {@code update_data} to the sample; false when there is nothing to change. */
    private boolean addUpdates(MethodSpec.Builder main, ResolvedEntity entity, String var) {
        Map<String, Object> update = usage.entity(entity.name()).map(EntityUsage::update).orElse(Map.of());
        List<String> keyFields = entity.primaryKeyFields();
        boolean any = false;
        for (FieldDefinition field : entity.definition().fields()) {
            if (!update.containsKey(field.name()) || keyFields.contains(field.name())) continue;
            main.addStatement("$L.set$L($L)", var, Names.cap(profile.fieldName(field.name())),
                fieldLiteral(field, update.get(field.name())));
            any = true;
        }
        return any;
    }

    private CodeBlock patternArgument(ResolvedEntity entity, ResolvedPattern pattern, ResolvedParameter p,
            Map<String, String> entityVars) {
        if (p.isEntity()) return CodeBlock.of("$L", entityVars.get(p.entityType()));
        boolean batch = pattern.operation() == Operation.BATCH_GET_ITEM
            || pattern.operation() == Operation.BATCH_WRITE_ITEM;
        if (p.kind() == ParameterKind.ARRAY && batch) {
            return CodeBlock.of("$T.of($L)", JavaTypes.LIST, entityVars.get(entity.name()));
        }
        return scalarArgument(entity.name(), entity.definition(), p);
    }

    private CodeBlock transactionArgument(ResolvedTransaction tx, ResolvedParameter p, Map<String, String> entityVars) {
        if (p.isEntity()) return CodeBlock.of("$L", entityVars.get(p.entityType()));
        EntityDefinition owner = null;
        for (ResolvedParticipant participant : tx.participants()) {
            EntityDefinition def = definitions.get(participant.entity());
            if (def != null && def.field(p.name()).isPresent()) {
                owner = def;
                break;
            }
        }
        if (owner == null) owner = definitions.get(tx.participants().get(0).entity());
        return scalarArgument(owner == null ? tx.participants().get(0).entity() : owner.name(), owner, p);
    }

    private CodeBlock scalarArgument(String entityName, EntityDefinition def, ResolvedParameter p) {
        FieldKind kind = p.valueKind();
        Object value = samples.parameterValue(entityName, p.name(), kind, usage);
        if (kind == FieldKind.ARRAY && def != null) {
            FieldKind itemKind = def.field(p.name()).flatMap(FieldDefinition::itemKind).orElse(null);
            return JavaTypes.literal(value, kind, itemKind);
        }
        return JavaTypes.literal(value, kind);
    }
}
