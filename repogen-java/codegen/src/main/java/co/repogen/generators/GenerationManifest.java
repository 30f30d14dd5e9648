package co.repogen.generators;

import java.util.List;
import java.util.Optional;

/**
 * Ordered output of one render: artifacts by role order, then entities in document order.
 */
public record GenerationManifest(String language, List<GeneratedArtifact> artifacts) {

    public GenerationManifest {
        artifacts = List.copyOf(artifacts);
    }

    public List<GeneratedArtifact> byCategory(String category) {
        return artifacts.stream().filter(a -> a.category().equals(category)).toList();
    }

    public Optional<GeneratedArtifact> find(String pathHint) {
        return artifacts.stream().filter(a -> a.pathHint().equals(pathHint)).findFirst();
    }

    /** Sum of the artifact counts of one category. */
    public int count(String category) {
        return byCategory(category).stream().mapToInt(GeneratedArtifact::count).sum();
    }

    public List<String> pathHints() {
        return artifacts.stream().map(GeneratedArtifact::pathHint).toList();
    }

    public int size() {
        return artifacts.size();
    }
}
