package eu.virtualparadox.techrag.rag.backend;

import java.time.Duration;

/**
 * Immutable configuration of one language-model backend.
 *
 * @param provider        backend variant
 * @param modelName       model to request; may be {@code null} where the server decides
 * @param endpoint        base URL; {@code null} for cloud providers using their public endpoint
 * @param apiKey          credential for cloud providers
 * @param temperature     sampling temperature in [0, 1]
 * @param maxOutputTokens upper bound on generated tokens
 * @param timeout         connect and read timeout of every request
 * @param maxAttempts     bounded number of attempts per request, at least 1
 */
public record BackendSettings(EBackendProvider provider,
                              String modelName,
                              String endpoint,
                              String apiKey,
                              double temperature,
                              int maxOutputTokens,
                              Duration timeout,
                              int maxAttempts) {

    @Override
    public String toString() {
        // keep the key out of logs
        return "BackendSettings[provider=" + provider + ", model=" + modelName + ", endpoint=" + endpoint + "]";
    }
}
