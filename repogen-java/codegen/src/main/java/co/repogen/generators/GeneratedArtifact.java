package co.repogen.generators;

import java.util.Objects;

/**
 * One rendered output unit. Callers decide where {@code pathHint} lands on disk.
 *
 * @param pathHint     relative path suggested for the content
 * @param category     output role category, see {@link OutputRole}
 * @param description  short human readable summary
 * @param content      rendered text
 * @param count        number of generated items in the content (entities, repositories, patterns, ...)
 */
public record GeneratedArtifact(String pathHint, String category, String description, String content, int count) {

    public GeneratedArtifact {
        Objects.requireNonNull(pathHint, "pathHint");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(content, "content");
    }
}
