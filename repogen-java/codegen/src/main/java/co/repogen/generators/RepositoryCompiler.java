package co.repogen.generators;

import co.repogen.core.LoadResult;
import co.repogen.core.SchemaLoader;
import co.repogen.core.diagnostics.Diagnostics;
import co.repogen.core.resolve.PatternResolver;
import co.repogen.core.resolve.ResolvedModel;
import co.repogen.core.usage.UsageData;
import co.repogen.core.validation.SchemaValidator;
import co.repogen.core.validation.UsageDataValidator;
import co.repogen.core.validation.ValidatorOptions;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Loads, validates, resolves and renders a schema. Performs no I/O: callers read the inputs
 * and write the manifest.
 */
public final class RepositoryCompiler {

    private static final Logger log = LoggerFactory.getLogger(RepositoryCompiler.class);

    private final SchemaValidator validator;
    private final UsageDataValidator usageValidator = new UsageDataValidator();
    private final PatternResolver resolver = new PatternResolver();
    private final RenderOptions options;

    public RepositoryCompiler() {
        this(ValidatorOptions.defaults(), RenderOptions.defaults());
    }

    public RepositoryCompiler(ValidatorOptions validatorOptions, RenderOptions options) {
        this.validator = new SchemaValidator(validatorOptions);
        this.options = options;
    }

    /**
     * Validate-only mode.
     *
     * @param usage usage data JSON, may be null
     */
    public Diagnostics validate(JsonNode schema, JsonNode usage) {
        return check(SchemaLoader.load(schema), usage);
    }

    /**
     * Generate mode. Generation is refused, with the diagnostics explaining why, when the
     * schema, the usage data or the language has an error.
     *
     * @param usage usage data JSON, may be null
     */
    public CompilationResult generate(JsonNode schema, JsonNode usage, String language) {
        LoadResult loaded = SchemaLoader.load(schema);
        Diagnostics diagnostics = check(loaded, usage);

        Optional<LanguageProfile> profile = LanguageProfiles.find(language);
        if (profile.isEmpty()) {
            diagnostics.enumViolation("language", "language", language, LanguageProfiles.ids());
        }
        if (diagnostics.hasErrors()) {
            log.warn("Generation refused: {} error(s)", diagnostics.errors().size());
            return CompilationResult.refused(diagnostics);
        }
        diagnostics.warnings().forEach(w -> log.warn("{}", w));

        ResolvedModel model = resolver.resolve(loaded.document());
        GenerationManifest manifest = profile.get().renderer()
            .render(model, profile.get(), options, usage == null ? UsageData.empty() : UsageData.from(usage));
        log.info("Generated {} artifact(s) for {}", manifest.size(), language);
        return new CompilationResult(diagnostics, manifest);
    }

    private Diagnostics check(LoadResult loaded, JsonNode usage) {
        Diagnostics diagnostics = loaded.diagnostics();
        if (!diagnostics.hasErrors()) {
            validator.validate(loaded.document(), diagnostics);
        }
        if (usage != null) {
            usageValidator.validate(usage, loaded.document(), diagnostics);
        }
        log.debug("Validation finished with {} diagnostic(s)", diagnostics.size());
        return diagnostics;
    }
}
