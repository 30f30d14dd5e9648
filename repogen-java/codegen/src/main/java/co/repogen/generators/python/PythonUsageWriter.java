package co.repogen.generators.python;

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
import co.repogen.core.usage.EntityUsage;
import co.repogen.core.usage.UsageData;
import co.repogen.generators.SampleValueStrategy;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Context of {@code usage_examples.py}: creates one sample item per entity, calls every
 * access pattern and transaction, then deletes the samples.
 */
final class PythonUsageWriter {

    private static final String INDENT = "    ";

    private final PythonProfile profile;
    private final PythonMethodWriter methods;
    private final ResolvedModel model;
    private final SampleValueStrategy samples;
    private final UsageData usage;
    private final Map<String, EntityDefinition> definitions = new LinkedHashMap<>();
    private final Map<String, String> entityVars = new LinkedHashMap<>();
    private final Map<String, String> repositoryVars = new LinkedHashMap<>();

    PythonUsageWriter(PythonProfile profile, PythonMethodWriter methods, ResolvedModel model, UsageData usage) {
        this.profile = profile;
        this.methods = methods;
        this.model = model;
        this.samples = profile.sampleValues();
        this.usage = usage;
        for (ResolvedEntity e : model.entities()) {
            definitions.put(e.name(), e.definition());
            entityVars.put(e.name(), methods.variable(e.name()));
            repositoryVars.put(e.name(), profile.fieldName(e.name()) + "_repository");
        }
    }

    Map<String, Object> context() {
        List<String> body = new ArrayList<>();
        body.add("# Repositories read table names from the environment; set DYNAMODB_ENDPOINT for DynamoDB Local");
        for (ResolvedEntity entity : model.entities()) {
            body.add(repositoryVars.get(entity.name()) + " = " + profile.className(entity.name()) + "Repository()");
        }
        if (model.hasTransactions()) body.add("transaction_service = TransactionService()");

        for (ResolvedEntity entity : model.entities()) {
            String var = entityVars.get(entity.name());
            String repo = repositoryVars.get(entity.name());
            body.add("");
            body.add("# " + entity.name());
            addSample(body, entity, var);
            run(body, entity.crud().create(), repo + "." + profile.methodName(entity.crud().create()) + "(" + var + ")");
            run(body, entity.crud().get(), repo + "." + profile.methodName(entity.crud().get()) + "("
                + keyArguments(entity, var) + ")");
            if (addUpdates(body, entity, var)) {
                run(body, entity.crud().update(), repo + "." + profile.methodName(entity.crud().update())
                    + "(" + var + ")");
            }
        }

        for (ResolvedEntity entity : model.entities()) {
            if (entity.ownMethods().isEmpty()) continue;
            body.add("");
            body.add("# " + entity.name() + " access patterns");
            for (ResolvedPattern pattern : entity.ownMethods()) {
                String args = pattern.parameters().stream()
                    .map(p -> patternArgument(entity, pattern, p))
                    .collect(Collectors.joining(", "));
                run(body, pattern.methodName(), repositoryVars.get(entity.name()) + "."
                    + profile.methodName(pattern.methodName()) + "(" + args + ")");
            }
        }

        if (model.hasTransactions()) {
            body.add("");
            body.add("# Cross-table transactions");
            for (ResolvedTransaction tx : model.transactions()) {
                String args = tx.parameters().stream()
                    .map(p -> transactionArgument(tx, p))
                    .collect(Collectors.joining(", "));
                run(body, tx.methodName(), "transaction_service." + profile.methodName(tx.methodName()) + "(" + args + ")");
            }
        }

        body.add("");
        body.add("# Cleanup");
        for (ResolvedEntity entity : model.entities()) {
            run(body, entity.crud().delete(), repositoryVars.get(entity.name()) + "."
                + profile.methodName(entity.crud().delete()) + "(" + keyArguments(entity, entityVars.get(entity.name()))
                + ")");
        }

        Map<String, Object> context = new LinkedHashMap<>();
        context.put("entityClasses", model.entities().stream().map(e -> profile.className(e.name())).toList());
        context.put("repositoryClasses", model.entities().stream()
            .map(e -> profile.className(e.name()) + "Repository")
            .toList());
        context.put("hasTransactions", model.hasTransactions());
        context.put("body", body.stream()
            .map(line -> line.isEmpty() ? line : INDENT + line)
            .collect(Collectors.joining("\n")));
        return context;
    }

    private void run(List<String> body, String label, String call) {
        body.add("run(" + PythonSyntax.quote(profile.methodName(label)) + ", lambda: " + call + ")");
    }

    /** Sample entity; primary key fields are always set since the dataclass requires them. */
    private void addSample(List<String> body, ResolvedEntity entity, String var) {
        EntityDefinition def = entity.definition();
        Map<String, Object> values = samples.entityValues(def, usage);
        for (String key : entity.primaryKeyFields()) {
            if (!values.containsKey(key)) values.put(key, samples.guess(key, PythonMethodWriter.kindOf(def, key)));
        }
        body.add(var + " = " + profile.className(entity.name()) + "(");
        values.forEach((name, value) -> {
            FieldDefinition field = def.field(name).orElseThrow();
            body.add(INDENT + profile.fieldName(name) + "=" + fieldLiteral(field, value) + ",");
        });
        body.add(")");
    }

    private static String fieldLiteral(FieldDefinition field, Object value) {
        return PythonSyntax.literal(value, field.kind().orElse(FieldKind.STRING), field.itemKind().orElse(FieldKind.STRING));
    }

    private String keyArguments(ResolvedEntity entity, String var) {
        return entity.primaryKeyFields().stream()
            .map(f -> var + "." + profile.fieldName(f))
            .collect(Collectors.joining(", "));
    }

    /** Applies {@code update_data} to the sample; false when there is nothing to change. */
    private boolean addUpdates(List<String> body, ResolvedEntity entity, String var) {
        Map<String, Object> update = usage.entity(entity.name()).map(EntityUsage::update).orElse(Map.of());
        List<String> keyFields = entity.primaryKeyFields();
        boolean any = false;
        for (FieldDefinition field : entity.definition().fields()) {
            if (!update.containsKey(field.name()) || keyFields.contains(field.name())) continue;
            body.add(var + "." + profile.fieldName(field.name()) + " = " + fieldLiteral(field, update.get(field.name())));
            any = true;
        }
        return any;
    }

    private String patternArgument(ResolvedEntity entity, ResolvedPattern pattern, ResolvedParameter p) {
        if (p.isEntity()) return entityVars.get(p.entityType());
        boolean batch = pattern.operation() == Operation.BATCH_GET_ITEM
            || pattern.operation() == Operation.BATCH_WRITE_ITEM;
        if (p.kind() == ParameterKind.ARRAY && batch) return "[" + entityVars.get(entity.name()) + "]";
        return scalarArgument(entity.name(), entity.definition(), p);
    }

    private String transactionArgument(ResolvedTransaction tx, ResolvedParameter p) {
        if (p.isEntity()) return entityVars.get(p.entityType());
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

    private String scalarArgument(String entityName, EntityDefinition def, ResolvedParameter p) {
        FieldKind kind = p.valueKind();
        Object value = samples.parameterValue(entityName, p.name(), kind, usage);
        FieldKind itemKind = kind == FieldKind.ARRAY && def != null
            ? def.field(p.name()).flatMap(FieldDefinition::itemKind).orElse(null)
            : null;
        return PythonSyntax.literal(value, kind, itemKind);
    }
}
