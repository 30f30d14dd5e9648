package co.repogen.generators;

import co.repogen.core.diagnostics.Diagnostics;

import java.util.Optional;

/**
 * Outcome of {@link RepositoryCompiler#generate}: the diagnostics, plus a manifest unless
 * generation was refused.
 */
public record CompilationResult(Diagnostics diagnostics, GenerationManifest manifest) {

    static CompilationResult refused(Diagnostics diagnostics) {
        return new CompilationResult(diagnostics, null);
    }

    public boolean isRefused() {
        return manifest == null;
    }

    public Optional<GenerationManifest> maybeManifest() {
        return Optional.ofNullable(manifest);
    }
}
