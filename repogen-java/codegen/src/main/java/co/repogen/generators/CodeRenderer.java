package co.repogen.generators;

import co.repogen.core.resolve.ResolvedModel;
import co.repogen.core.usage.UsageData;

/**
 * Turns a resolved model into the artifacts of one target language. Implementations are
 * pure: no file system or network access, and equal inputs give equal manifests.
 */
public interface CodeRenderer {

    GenerationManifest render(ResolvedModel model, LanguageProfile profile, RenderOptions options, UsageData usage);
}
