package eu.virtualparadox.techrag.application.config;

import eu.virtualparadox.techrag.rag.backend.EBackendProvider;
import eu.virtualparadox.techrag.rag.backend.FailoverRouter;
import eu.virtualparadox.techrag.rag.backend.LlmBackend;
import eu.virtualparadox.techrag.rag.backend.LlmBackendFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the primary and fallback language-model backends into a {@link FailoverRouter}.
 * <p>An invalid primary stops the application; a fallback that cannot be built is logged and omitted.</p>
 */
@Configuration
@Slf4j
public class BackendConfig {

    @Bean
    public FailoverRouter failoverRouter(final LlmProperties props, final LlmBackendFactory factory) {
        final EBackendProvider primaryProvider = EBackendProvider.fromConfigName(props.getBackend());
        final LlmBackend primary = factory.create(props.settingsFor(primaryProvider));
        return new FailoverRouter(primary, fallback(props, factory, primaryProvider));
    }

    private LlmBackend fallback(final LlmProperties props,
                                final LlmBackendFactory factory,
                                final EBackendProvider primaryProvider) {
        if (props.getFallback() == null || props.getFallback().isBlank()) {
            log.info("No fallback backend configured");
            return null;
        }

        try {
            final EBackendProvider fallbackProvider = EBackendProvider.fromConfigName(props.getFallback());
            if (fallbackProvider == primaryProvider) {
                log.info("Fallback backend {} is the primary backend, running without a fallback",
                        fallbackProvider.configName());
                return null;
            }
            final LlmBackend fallback = factory.create(props.settingsFor(fallbackProvider));
            log.info("Fallback {} backend configured", fallbackProvider.configName());
            return fallback;
        }
        catch (ConfigurationException e) {
            log.warn("Could not create fallback backend: {}", e.getMessage());
            return null;
        }
    }
}
