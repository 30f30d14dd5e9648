package co.repogen.generators;

import co.repogen.core.resolve.PatternRegistryEntry;
import co.repogen.core.resolve.ResolvedModel;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@code access_pattern_mapping.json}: the pattern registry keyed by pattern id, with method
 * names spelled for the target language.
 */
public final class AccessPatternMapping {
    public static final String FILE_NAME = "access_pattern_mapping.json";
    public static final String ROOT = "access_pattern_mapping";

    private static final ObjectMapper JSON = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private AccessPatternMapping() {
    }

    public static Map<String, PatternRegistryEntry> entries(ResolvedModel model, LanguageProfile profile) {
        Map<String, PatternRegistryEntry> entries = new LinkedHashMap<>();
        for (PatternRegistryEntry entry : model.registry()) {
            entries.put(String.valueOf(entry.patternId()), entry.withMethodName(profile.methodName(entry.methodName())));
        }
        return entries;
    }

    /**
     * @throws IllegalStateException if the registry cannot be serialized
     */
    public static String render(ResolvedModel model, LanguageProfile profile) {
        try {
            return JSON.writeValueAsString(Map.of(ROOT, entries(model, profile))) + "\n";
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot serialize access pattern mapping", e);
        }
    }

    public static GeneratedArtifact artifact(ResolvedModel model, LanguageProfile profile) {
        OutputRole role = profile.requireRole(OutputRole.MAPPING);
        return role.artifact(role.pathFor("", ""), render(model, profile), model.registry().size());
    }
}
