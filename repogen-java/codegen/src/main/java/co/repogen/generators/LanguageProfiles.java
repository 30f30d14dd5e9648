package co.repogen.generators;

import co.repogen.core.diagnostics.Suggestions;
import co.repogen.generators.java.JavaProfile;
import co.repogen.generators.python.PythonProfile;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Static registry of the supported target languages, keyed by profile id.
 */
public final class LanguageProfiles {

    private static final Map<String, LanguageProfile> PROFILES = new LinkedHashMap<>();

    static {
        register(new JavaProfile());
        register(new PythonProfile());
    }

    private LanguageProfiles() {
    }

    private static void register(LanguageProfile profile) {
        PROFILES.put(profile.id(), profile);
    }

    public static Optional<LanguageProfile> find(String id) {
        return Optional.ofNullable(id == null ? null : PROFILES.get(id));
    }

    /**
     * @throws IllegalArgumentException if no profile has this id
     */
    public static LanguageProfile get(String id) {
        return find(id).orElseThrow(() -> {
            String message = "Unknown language '" + id + "', supported: " + ids();
            return new IllegalArgumentException(Suggestions.closest(id, ids())
                .map(s -> message + ". Did you mean '" + s + "'?")
                .orElse(message));
        });
    }

    public static List<String> ids() {
        return List.copyOf(PROFILES.keySet());
    }
}
