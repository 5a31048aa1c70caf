package eu.virtualparadox.techrag.application.config;

import eu.virtualparadox.techrag.rag.backend.BackendSettings;
import eu.virtualparadox.techrag.rag.backend.EBackendProvider;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Language-model backend selection and per-provider settings ({@code techrag.llm.*}).
 */
@Configuration
@ConfigurationProperties(prefix = "techrag.llm")
@Getter @Setter
public class LlmProperties {

    /** Primary backend name. */
    private String backend = "ollama";

    /** Fallback backend name; blank or equal to the primary disables the fallback. */
    private String fallback = "ollama";

    private Duration timeout = Duration.ofSeconds(60);
    private int maxAttempts = 3;

    private Provider ollama = new Provider("mistral:7b", "http://localhost:11434");
    private Provider openai = new Provider("gpt-3.5-turbo", null);
    private Provider anthropic = new Provider("claude-3-haiku-20240307", null);
    private Provider textgen = new Provider(null, "http://localhost:5000");
    private Provider localai = new Provider("gpt-3.5-turbo", "http://localhost:8080");

    public BackendSettings settingsFor(final EBackendProvider provider) {
        final Provider p = switch (provider) {
            case OLLAMA -> ollama;
            case OPENAI -> openai;
            case ANTHROPIC -> anthropic;
            case TEXTGEN -> textgen;
            case LOCALAI -> localai;
        };
        return new BackendSettings(provider, p.getModel(), p.getBaseUrl(), p.getApiKey(),
                p.getTemperature(), p.getMaxTokens(), timeout, maxAttempts);
    }

    @Getter @Setter
    public static class Provider {
        private String model;
        private String baseUrl;
        private String apiKey;
        private double temperature = 0.1;
        private int maxTokens = 2000;

        public Provider() {
        }

        public Provider(final String model, final String baseUrl) {
            this.model = model;
            this.baseUrl = baseUrl;
        }
    }
}
