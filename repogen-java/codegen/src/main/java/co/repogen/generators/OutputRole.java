package co.repogen.generators;

/**
 * A kind of artifact a language profile produces.
 *
 * @param pathHint  relative path; {@code {package}} and {@code {name}} are replaced per artifact
 */
public record OutputRole(String category, String pathHint, String description) {
    public static final String ENTITIES = "entities";
    public static final String KEYS = "keys";
    public static final String REPOSITORIES = "repositories";
    public static final String BASE_REPOSITORY = "base_repository";
    public static final String CONFIG = "config";
    public static final String CLIENT = "client";
    public static final String SUPPORT = "support";
    public static final String TRANSACTIONS = "transactions";
    public static final String MAPPING = "mapping";
    public static final String USAGE_EXAMPLES = "usage_examples";

    public String pathFor(String packageDir, String name) {
        return pathHint.replace("{package}", packageDir).replace("{name}", name);
    }

    public GeneratedArtifact artifact(String pathHint, String content, int count) {
        return new GeneratedArtifact(pathHint, category, description, content, count);
    }
}
