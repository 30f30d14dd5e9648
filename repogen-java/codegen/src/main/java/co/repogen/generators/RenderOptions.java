package co.repogen.generators;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Renderer settings, usually read from a JSON options file.
 *
 * @param basePackage            root package (or module prefix) of generated code
 * @param generateUsageExamples  also render a runnable usage example
 * @param parallel               render independent artifacts on a parallel stream
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RenderOptions(String basePackage, boolean generateUsageExamples, boolean parallel) {
    public static final String DEFAULT_PACKAGE = "com.example.data";

    private static final ObjectMapper JSON = new ObjectMapper();

    @JsonCreator
    public RenderOptions(
        @JsonProperty("basePackage") String basePackage,
        @JsonProperty("generateUsageExamples") Boolean generateUsageExamples,
        @JsonProperty("parallel") Boolean parallel
    ) {
        this(basePackage == null || basePackage.isBlank() ? DEFAULT_PACKAGE : basePackage,
            Boolean.TRUE.equals(generateUsageExamples),
            Boolean.TRUE.equals(parallel));
    }

    public static RenderOptions defaults() {
        return new RenderOptions(DEFAULT_PACKAGE, false, false);
    }

    public static RenderOptions load(Path path) throws IOException {
        return JSON.readValue(path.toFile(), RenderOptions.class);
    }

    public RenderOptions withBasePackage(String pkg) {
        return new RenderOptions(pkg, generateUsageExamples, parallel);
    }

    public RenderOptions withUsageExamples(boolean enabled) {
        return new RenderOptions(basePackage, enabled, parallel);
    }

    public RenderOptions withParallel(boolean enabled) {
        return new RenderOptions(basePackage, generateUsageExamples, enabled);
    }
}
