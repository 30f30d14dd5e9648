package co.repogen.generators.java;

import co.repogen.core.resolve.ResolvedEntity;
import co.repogen.core.resolve.ResolvedModel;
import co.repogen.core.resolve.ResolvedTable;
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
import java.util.List;
import java.util.function.Supplier;

/**
 * Renders a resolved model as Java sources with JavaPoet.
 */
public final class JavaRenderer implements CodeRenderer {

    private static final Logger log = LoggerFactory.getLogger(JavaRenderer.class);

    @Override
    public GenerationManifest render(ResolvedModel model, LanguageProfile profile, RenderOptions options,
            UsageData usage) {
        if (!(profile instanceof JavaProfile java)) {
            throw new IllegalArgumentException("Java renderer cannot render profile '" + profile.id() + "'");
        }
        JavaLayout layout = new JavaLayout(options.basePackage());
        JavaEntityWriter entityWriter = new JavaEntityWriter(layout, java);
        JavaSupportWriter supportWriter = new JavaSupportWriter(layout);
        JavaRepositoryWriter repositoryWriter = new JavaRepositoryWriter(layout, java, entityWriter, model);

        List<Supplier<GeneratedArtifact>> tasks = new ArrayList<>();
        for (OutputRole role : profile.outputRoles()) {
            switch (role.category()) {
                case OutputRole.ENTITIES -> {
                    for (ResolvedEntity e : model.entities()) {
                        tasks.add(() -> file(role, layout, java.className(e.name()), entityWriter.entity(e), 1));
                    }
                }
                case OutputRole.KEYS -> {
                    for (ResolvedEntity e : model.entities()) {
                        tasks.add(() -> file(role, layout, java.className(e.name()), entityWriter.keys(e), 1));
                    }
                }
                case OutputRole.REPOSITORIES -> {
                    for (ResolvedEntity e : model.entities()) {
                        tasks.add(() -> file(role, layout, java.className(e.name()), repositoryWriter.repository(e), 1));
                    }
                }
                case OutputRole.CONFIG -> {
                    for (ResolvedTable t : model.tables()) {
                        tasks.add(() -> file(role, layout, java.className(t.name()), supportWriter.config(t), 1));
                    }
                }
                case OutputRole.CLIENT ->
                    tasks.add(() -> file(role, layout, JavaLayout.CLIENT_CLASS, supportWriter.client(), 1));
                case OutputRole.SUPPORT -> tasks.add(() ->
                    file(role, layout, JavaLayout.ATTRIBUTE_VALUES_CLASS, supportWriter.attributeValues(), 1));
                case OutputRole.TRANSACTIONS -> {
                    if (model.hasTransactions()) {
                        tasks.add(() -> file(role, layout, JavaLayout.TRANSACTION_SERVICE_CLASS,
                            repositoryWriter.transactionService(model.transactions()), model.transactions().size()));
                    }
                }
                case OutputRole.MAPPING -> tasks.add(() -> AccessPatternMapping.artifact(model, java));
                case OutputRole.USAGE_EXAMPLES -> {
                    if (options.generateUsageExamples()) {
                        JavaUsageWriter usageWriter = new JavaUsageWriter(layout, java, model, usage);
                        tasks.add(() -> file(role, layout, JavaLayout.USAGE_EXAMPLES_CLASS,
                            usageWriter.usageExamples(model), 1));
                    }
                }
                default -> throw new IllegalStateException("Java renderer has no output for role " + role.category());
            }
        }

        List<GeneratedArtifact> artifacts = options.parallel()
            ? tasks.parallelStream().map(Supplier::get).toList()
            : tasks.stream().map(Supplier::get).toList();
        log.info("Rendered {} Java file(s) into package {}", artifacts.size(), layout.basePackage());
        if (log.isDebugEnabled()) {
            artifacts.forEach(a -> log.debug("  {} ({} chars)", a.pathHint(), a.content().length()));
        }
        return new GenerationManifest(profile.id(), artifacts);
    }

    private static GeneratedArtifact file(OutputRole role, JavaLayout layout, String name, String content, int count) {
        return role.artifact(role.pathFor(layout.packageDir(), name), content, count);
    }
}
