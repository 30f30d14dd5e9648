package co.repogen.generators.python;

import co.repogen.core.Names;
import co.repogen.core.model.EntityDefinition;
import co.repogen.core.model.FieldDefinition;
import co.repogen.core.model.FieldKind;
import co.repogen.core.resolve.ResolvedEntity;
import co.repogen.core.resolve.ResolvedIndexKey;
import co.repogen.core.resolve.ResolvedModel;
import co.repogen.core.resolve.ResolvedTable;
import co.repogen.core.template.CompiledKey;
import co.repogen.core.template.KeyTemplate;
import co.repogen.core.usage.UsageData;
import co.repogen.generators.AccessPatternMapping;
import co.repogen.generators.CodeRenderer;
import co.repogen.generators.GeneratedArtifact;
import co.repogen.generators.GenerationManifest;
import co.repogen.generators.LanguageProfile;
import co.repogen.generators.OutputRole;
import co.repogen.generators.RenderOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Renders a resolved model as Python modules through Handlebars templates. Template contexts
 * are plain maps, lists and strings.
 */
public final class PythonRenderer implements CodeRenderer {

    private static final Logger log = LoggerFactory.getLogger(PythonRenderer.class);

    private final HandlebarsEngine engine = new HandlebarsEngine();

    @Override
    public GenerationManifest render(ResolvedModel model, LanguageProfile profile, RenderOptions options,
            UsageData usage) {
        if (!(profile instanceof PythonProfile python)) {
            throw new IllegalArgumentException("Python renderer cannot render profile '" + profile.id() + "'");
        }
        PythonMethodWriter methods = new PythonMethodWriter(python, model);

        List<Supplier<GeneratedArtifact>> tasks = new ArrayList<>();
        for (OutputRole role : profile.outputRoles()) {
            switch (role.category()) {
                case OutputRole.ENTITIES -> tasks.add(() ->
                    file(role, "entities", entitiesContext(model, python), model.entities().size()));
                case OutputRole.REPOSITORIES -> tasks.add(() ->
                    file(role, "repositories", repositoriesContext(model, python, methods), model.entities().size()));
                case OutputRole.BASE_REPOSITORY -> tasks.add(() ->
                    file(role, "base_repository", Map.of("tables", tables(model)), 1));
                case OutputRole.TRANSACTIONS -> {
                    if (model.hasTransactions()) {
                        tasks.add(() -> file(role, "transaction_service", transactionsContext(model, python, methods),
                            model.transactions().size()));
                    }
                }
                case OutputRole.MAPPING -> tasks.add(() -> AccessPatternMapping.artifact(model, python));
                case OutputRole.USAGE_EXAMPLES -> {
                    if (options.generateUsageExamples()) {
                        PythonUsageWriter usageWriter = new PythonUsageWriter(python, methods, model, usage);
                        tasks.add(() -> file(role, "usage_examples", usageWriter.context(), 1));
                    }
                }
                default -> throw new IllegalStateException("Python renderer has no output for role " + role.category());
            }
        }

        List<GeneratedArtifact> artifacts = options.parallel()
            ? tasks.parallelStream().map(Supplier::get).toList()
            : tasks.stream().map(Supplier::get).toList();
        log.info("Rendered {} Python module(s)", artifacts.size());
        if (log.isDebugEnabled()) {
            artifacts.forEach(a -> log.debug("  {} ({} chars)", a.pathHint(), a.content().length()));
        }
        return new GenerationManifest(profile.id(), artifacts);
    }

    private GeneratedArtifact file(OutputRole role, String template, Map<String, Object> context, int count) {
        return role.artifact(role.pathFor("", ""), engine.render(template, context), count);
    }

    /** Module-level constant holding a table's name. */
    static String tableConstant(String tableName) {
        return Names.toConstantCase(tableName) + "_TABLE_NAME";
    }

    private static List<Map<String, Object>> tables(ResolvedModel model) {
        List<Map<String, Object>> tables = new ArrayList<>();
        for (ResolvedTable t : model.tables()) {
            Map<String, Object> table = new LinkedHashMap<>();
            table.put("constant", tableConstant(t.name()));
            table.put("name", PythonSyntax.quote(t.name()));
            tables.add(table);
        }
        return tables;
    }

    // =========================================================================
    // entities.py
    // =========================================================================

    private Map<String, Object> entitiesContext(ResolvedModel model, PythonProfile profile) {
        List<Map<String, Object>> entities = new ArrayList<>();
        for (ResolvedEntity e : model.entities()) entities.add(entityView(e, profile));
        return Map.of("entities", entities);
    }

    private Map<String, Object> entityView(ResolvedEntity entity, PythonProfile profile) {
        EntityDefinition def = entity.definition();
        Function<String, String> param = profile::fieldName;
        Function<String, String> member = f -> "self." + profile.fieldName(f);

        Map<String, Object> view = new LinkedHashMap<>();
        view.put("className", profile.className(entity.name()));
        view.put("name", entity.name());
        view.put("table", entity.table().name());
        view.put("entityType", PythonSyntax.quote(def.entityType()));
        view.put("fields", fieldViews(entity, profile));

        List<String> keyFields = entity.primaryKeyFields();
        view.put("keySignature", signature(def, keyFields, profile));
        view.put("keyArgs", keyFields.stream().map(member).collect(Collectors.joining(", ")));
        view.put("keyValue", keyDict(entity, param));

        List<Map<String, Object>> builders = new ArrayList<>();
        builders.add(builder("partition_key", entity.partitionKey(), def, profile, "Partition key value."));
        if (entity.sortKey() != null) {
            builders.add(builder("sort_key", entity.sortKey(), def, profile, "Sort key value."));
        }
        List<Map<String, Object>> indexAttributes = new ArrayList<>();
        for (ResolvedIndexKey index : entity.indexKeys()) {
            String prefix = profile.fieldName(index.indexName());
            builders.add(builder(prefix + "_partition_key", index.partitionKey(), def, profile,
                index.indexName() + " partition key" + (index.partitionKey().multiAttribute() ? " values." : " value.")));
            indexAttributes.addAll(indexAttributes(index.index().partitionKey().values(), index.partitionKey(), member,
                profile));
            if (index.sortKey() != null) {
                builders.add(builder(prefix + "_sort_key", index.sortKey(), def, profile,
                    index.indexName() + " sort key" + (index.sortKey().multiAttribute() ? " values." : " value.")));
                if (index.index().hasSortKey()) {
                    indexAttributes.addAll(indexAttributes(index.index().sortKey().values(), index.sortKey(), member,
                        profile));
                }
            }
        }
        view.put("builders", builders);
        view.put("indexAttributes", indexAttributes);
        return view;
    }

    /** Required fields first: dataclass fields with defaults must follow those without. */
    private static List<Map<String, Object>> fieldViews(ResolvedEntity entity, PythonProfile profile) {
        List<String> keyFields = entity.primaryKeyFields();
        List<Map<String, Object>> required = new ArrayList<>();
        List<Map<String, Object>> optional = new ArrayList<>();
        for (FieldDefinition f : entity.definition().fields()) {
            boolean isRequired = f.required() || keyFields.contains(f.name());
            String type = profile.fieldType(f.kind().orElse(FieldKind.STRING), f.itemKind().orElse(null));
            Map<String, Object> view = new LinkedHashMap<>();
            view.put("name", profile.fieldName(f.name()));
            view.put("attribute", PythonSyntax.quote(f.name()));
            view.put("declaration", isRequired ? type : type + " | None = None");
            (isRequired ? required : optional).add(view);
        }
        required.addAll(optional);
        return required;
    }

    private static String signature(EntityDefinition def, List<String> fields, PythonProfile profile) {
        return signature(def, fields, profile, profile::fieldName);
    }

    private static String signature(EntityDefinition def, List<String> fields, PythonProfile profile,
            Function<String, String> names) {
        return fields.stream()
            .map(f -> names.apply(f) + ": "
                + profile.fieldType(PythonMethodWriter.kindOf(def, f), def.field(f).flatMap(FieldDefinition::itemKind)
                .orElse(null)))
            .collect(Collectors.joining(", "));
    }

    private static String keyDict(ResolvedEntity entity, Function<String, String> fields) {
        StringBuilder dict = new StringBuilder("{")
            .append(PythonSyntax.quote(entity.table().partitionKey())).append(": ")
            .append(PythonSyntax.templateValue(entity.partitionKey().first(), fields));
        if (entity.sortKey() != null && entity.table().hasSortKey()) {
            dict.append(", ").append(PythonSyntax.quote(entity.table().sortKey())).append(": ")
                .append(PythonSyntax.templateValue(entity.sortKey().first(), fields));
        }
        return dict.append('}').toString();
    }

    private static Map<String, Object> builder(String name, CompiledKey key, EntityDefinition def,
            PythonProfile profile, String doc) {
        Function<String, String> param = profile::fieldName;
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("name", name);
        view.put("signature", signature(def, key.fieldNames(), profile));
        view.put("doc", doc);
        if (key.multiAttribute()) {
            view.put("returns", "tuple");
            view.put("value", PythonSyntax.tuple(key.parts().stream()
                .map(t -> PythonSyntax.templateValue(t, param))
                .toList()));
        } else {
            KeyTemplate t = key.first();
            view.put("returns", t.numericPassthrough()
                ? profile.fieldType(PythonMethodWriter.kindOf(def, t.fieldNames().get(0)), null)
                : "str");
            view.put("value", PythonSyntax.templateValue(t, param));
        }
        return view;
    }

    /**
     * Index key attributes written by {@code to_item}, each guarded by its fields being set so
     * sparse indexes stay sparse.
     */
    private static List<Map<String, Object>> indexAttributes(List<String> attributes, CompiledKey key,
            Function<String, String> member, PythonProfile profile) {
        List<Map<String, Object>> views = new ArrayList<>();
        for (int i = 0; i < key.size(); i++) {
            KeyTemplate template = key.parts().get(i);
            Map<String, Object> view = new LinkedHashMap<>();
            view.put("attribute", PythonSyntax.quote(attributes.get(Math.min(i, attributes.size() - 1))));
            view.put("value", PythonSyntax.templateValue(template, member));
            String guard = template.fieldNames().stream()
                .map(f -> "self." + profile.fieldName(f) + " is not None")
                .collect(Collectors.joining(" and "));
            if (!guard.isEmpty()) view.put("guard", guard);
            views.add(view);
        }
        return views;
    }

    // =========================================================================
    // repositories.py
    // =========================================================================

    private Map<String, Object> repositoriesContext(ResolvedModel model, PythonProfile profile,
            PythonMethodWriter methods) {
        List<Map<String, Object>> repositories = new ArrayList<>();
        for (ResolvedEntity e : model.entities()) {
            String className = profile.className(e.name());
            List<String> keyFields = e.primaryKeyFields();

            Map<String, Object> view = new LinkedHashMap<>();
            view.put("name", e.name());
            view.put("table", e.table().name());
            view.put("className", className);
            view.put("repositoryClass", className + "Repository");
            view.put("tableConstant", tableConstant(e.table().name()));
            view.put("partitionKey", PythonSyntax.quote(e.table().partitionKey()));
            view.put("sortKey", e.table().hasSortKey() ? PythonSyntax.quote(e.table().sortKey()) : "None");
            view.put("var", methods.variable(e.name()));
            view.put("keySignature", signature(e.definition(), keyFields, profile, methods::variable));
            view.put("keyArgs", keyFields.stream().map(methods::variable).collect(Collectors.joining(", ")));
            view.put("consistentGet", e.consistentCrudGet());

            Map<String, Object> crud = new LinkedHashMap<>();
            crud.put("create", profile.methodName(e.crud().create()));
            crud.put("get", profile.methodName(e.crud().get()));
            crud.put("update", profile.methodName(e.crud().update()));
            crud.put("delete", profile.methodName(e.crud().delete()));
            view.put("crud", crud);

            view.put("methods", e.ownMethods().stream().map(p -> methods.pattern(e, p)).toList());
            repositories.add(view);
        }

        Map<String, Object> context = new LinkedHashMap<>();
        context.put("entityClasses", model.entities().stream().map(e -> profile.className(e.name())).toList());
        context.put("tableConstants", model.tables().stream().map(t -> tableConstant(t.name())).toList());
        context.put("repositories", repositories);
        return context;
    }

    // =========================================================================
    // transaction_service.py
    // =========================================================================

    private Map<String, Object> transactionsContext(ResolvedModel model, PythonProfile profile,
            PythonMethodWriter methods) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("entityClasses", model.transactions().stream()
            .flatMap(tx -> tx.participants().stream())
            .map(p -> profile.className(p.entity()))
            .distinct()
            .toList());
        context.put("tableConstants", model.transactions().stream()
            .flatMap(tx -> tx.participants().stream())
            .map(p -> tableConstant(p.table()))
            .distinct()
            .toList());
        context.put("methods", model.transactions().stream().map(methods::transaction).toList());
        return context;
    }
}
