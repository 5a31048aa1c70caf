package eu.virtualparadox.techrag.rag.backend;

import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Routes generation to a primary backend and, when it fails, once to an optional fallback.
 * <p>
 * After the first successful fallback generation the router is <i>degraded</i>: every further call
 * goes straight to the fallback until {@link #reset()} is called. Nothing resets the flag
 * automatically.
 */
@Slf4j
public class FailoverRouter {

    private final LlmBackend primary;
    private final LlmBackend fallback;
    private final AtomicBoolean degraded = new AtomicBoolean(false);

    /**
     * @param primary  backend tried first
     * @param fallback backend used when the primary fails; may be {@code null}
     */
    public FailoverRouter(final LlmBackend primary, final LlmBackend fallback) {
        if (primary == null) {
            throw new IllegalArgumentException("primary backend must not be null");
        }
        this.primary = primary;
        this.fallback = fallback;
    }

    /**
     * @param prompt complete prompt
     * @return generated text
     * @throws BackendUnavailableException when the primary fails and there is no fallback, or the
     *                                     fallback fails as well
     */
    public String generate(final String prompt) {
        if (fallback != null && degraded.get()) {
            return fallback.generate(prompt);
        }

        try {
            return primary.generate(prompt);
        }
        catch (BackendUnavailableException e) {
            if (fallback == null) {
                throw e;
            }
            log.warn("Primary backend {} failed: {}", primary.provider().configName(), e.getMessage());

            final String answer = fallback.generate(prompt);
            if (degraded.compareAndSet(false, true)) {
                log.info("Switched to fallback backend {}", fallback.provider().configName());
            }
            return answer;
        }
    }

    public boolean isDegraded() {
        return degraded.get();
    }

    /**
     * Routes the next call to the primary backend again.
     */
    public void reset() {
        if (degraded.compareAndSet(true, false)) {
            log.info("Backend routing reset to primary {}", primary.provider().configName());
        }
    }

    /**
     * @return health of the backend that currently serves requests
     */
    public boolean isHealthy() {
        return fallback != null && degraded.get() ? fallback.isHealthy() : primary.isHealthy();
    }

    /**
     * @return fallback health, empty when no fallback is configured
     */
    public Optional<Boolean> isFallbackHealthy() {
        return fallback == null ? Optional.empty() : Optional.of(fallback.isHealthy());
    }

    public EBackendProvider primaryProvider() {
        return primary.provider();
    }

    public Optional<EBackendProvider> fallbackProvider() {
        return Optional.ofNullable(fallback).map(LlmBackend::provider);
    }
}
