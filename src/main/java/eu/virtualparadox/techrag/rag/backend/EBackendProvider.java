package eu.virtualparadox.techrag.rag.backend;

import eu.virtualparadox.techrag.application.config.ConfigurationException;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

public enum EBackendProvider {
    OLLAMA("ollama", false, true),
    OPENAI("openai", true, false),
    ANTHROPIC("anthropic", true, false),
    TEXTGEN("textgen", false, true),
    LOCALAI("localai", false, true);

    private final String configName;
    private final boolean requiresApiKey;
    private final boolean requiresEndpoint;

    EBackendProvider(final String configName, final boolean requiresApiKey, final boolean requiresEndpoint) {
        this.configName = configName;
        this.requiresApiKey = requiresApiKey;
        this.requiresEndpoint = requiresEndpoint;
    }

    public String configName() {
        return configName;
    }

    public boolean requiresApiKey() {
        return requiresApiKey;
    }

    public boolean requiresEndpoint() {
        return requiresEndpoint;
    }

    /**
     * Resolves a provider from its configuration name, case-insensitively.
     *
     * @throws ConfigurationException for an unknown name
     */
    public static EBackendProvider fromConfigName(final String name) {
        if (name != null) {
            final String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (final EBackendProvider provider : values()) {
                if (provider.configName.equals(normalized)) {
                    return provider;
                }
            }
        }
        throw new ConfigurationException("Unsupported backend '" + name + "', expected one of "
                + Arrays.stream(values()).map(EBackendProvider::configName).collect(Collectors.joining(", ")));
    }
}
