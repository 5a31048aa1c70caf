package eu.virtualparadox.techrag.rag.backend;

import eu.virtualparadox.techrag.application.config.ConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.anthropic.AnthropicChatModel;
import org.springframework.ai.anthropic.AnthropicChatOptions;
import org.springframework.ai.anthropic.api.AnthropicApi;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.ollama.OllamaChatModel;
import org.springframework.ai.ollama.api.OllamaApi;
import org.springframework.ai.ollama.api.OllamaOptions;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

/**
 * Builds a {@link LlmBackend} from validated {@link BackendSettings}.
 * <p>
 * Every backend gets its own HTTP client with the configured connect/read timeout and a bounded
 * retry policy. Invalid settings fail fast with {@link ConfigurationException}.
 */
@Component
@Slf4j
public class LlmBackendFactory {

    private static final long RETRY_BACKOFF_MS = 500;

    public LlmBackend create(final BackendSettings settings) {
        validate(settings);
        try {
            final LlmBackend backend = switch (settings.provider()) {
                case OLLAMA -> ollama(settings);
                case OPENAI -> new ChatModelBackend(EBackendProvider.OPENAI, openAi(settings));
                case ANTHROPIC -> new ChatModelBackend(EBackendProvider.ANTHROPIC, anthropic(settings));
                case TEXTGEN -> new TextGenWebUiBackend(settings, restClient(settings));
                case LOCALAI -> new LocalAiBackend(settings, restClient(settings));
            };
            log.info("Created {} backend with model {}", settings.provider().configName(), settings.modelName());
            return backend;
        }
        catch (LinkageError e) {
            throw new ConfigurationException("Client library for backend " + settings.provider().configName()
                    + " is not available on the classpath", e);
        }
    }

    void validate(final BackendSettings settings) {
        if (settings == null || settings.provider() == null) {
            throw new ConfigurationException("Backend provider is not configured");
        }
        final String name = settings.provider().configName();
        if (settings.provider().requiresApiKey() && isBlank(settings.apiKey())) {
            throw new ConfigurationException("Backend " + name + " requires an API key");
        }
        if (settings.provider().requiresEndpoint() && isBlank(settings.endpoint())) {
            throw new ConfigurationException("Backend " + name + " requires an endpoint URL");
        }
        if (settings.provider() != EBackendProvider.TEXTGEN && isBlank(settings.modelName())) {
            throw new ConfigurationException("Backend " + name + " requires a model name");
        }
        if (settings.temperature() < 0.0 || settings.temperature() > 1.0) {
            throw new ConfigurationException("Temperature of backend " + name + " must be in [0, 1], was "
                    + settings.temperature());
        }
        if (settings.maxOutputTokens() <= 0) {
            throw new ConfigurationException("Max output tokens of backend " + name + " must be positive");
        }
        if (settings.timeout() == null || settings.timeout().isZero() || settings.timeout().isNegative()) {
            throw new ConfigurationException("Timeout of backend " + name + " must be positive");
        }
        if (settings.maxAttempts() < 1) {
            throw new ConfigurationException("Max attempts of backend " + name + " must be at least 1");
        }
    }

    private LlmBackend ollama(final BackendSettings settings) {
        final OllamaApi api = OllamaApi.builder()
                .baseUrl(settings.endpoint())
                .restClientBuilder(restClientBuilder(settings))
                .build();
        final ChatModel chatModel = OllamaChatModel.builder()
                .ollamaApi(api)
                .defaultOptions(OllamaOptions.builder()
                        .model(settings.modelName())
                        .temperature(settings.temperature())
                        .numPredict(settings.maxOutputTokens())
                        .build())
                .build();
        return new OllamaBackend(chatModel, restClient(settings));
    }

    private ChatModel openAi(final BackendSettings settings) {
        final OpenAiApi.Builder api = OpenAiApi.builder()
                .apiKey(settings.apiKey())
                .restClientBuilder(restClientBuilder(settings));
        if (!isBlank(settings.endpoint())) {
            api.baseUrl(settings.endpoint());
        }
        return OpenAiChatModel.builder()
                .openAiApi(api.build())
                .defaultOptions(OpenAiChatOptions.builder()
                        .model(settings.modelName())
                        .temperature(settings.temperature())
                        .maxTokens(settings.maxOutputTokens())
                        .build())
                .retryTemplate(retryTemplate(settings))
                .build();
    }

    private ChatModel anthropic(final BackendSettings settings) {
        final AnthropicApi.Builder api = AnthropicApi.builder()
                .apiKey(settings.apiKey())
                .restClientBuilder(restClientBuilder(settings));
        if (!isBlank(settings.endpoint())) {
            api.baseUrl(settings.endpoint());
        }
        return AnthropicChatModel.builder()
                .anthropicApi(api.build())
                .defaultOptions(AnthropicChatOptions.builder()
                        .model(settings.modelName())
                        .temperature(settings.temperature())
                        .maxTokens(settings.maxOutputTokens())
                        .build())
                .retryTemplate(retryTemplate(settings))
                .build();
    }

    private static RetryTemplate retryTemplate(final BackendSettings settings) {
        return RetryTemplate.builder()
                .maxAttempts(settings.maxAttempts())
                .fixedBackoff(RETRY_BACKOFF_MS)
                .retryOn(TransientAiException.class)
                .retryOn(ResourceAccessException.class)
                .build();
    }

    private static RestClient restClient(final BackendSettings settings) {
        return restClientBuilder(settings)
                .baseUrl(settings.endpoint())
                .build();
    }

    private static RestClient.Builder restClientBuilder(final BackendSettings settings) {
        final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(settings.timeout());
        requestFactory.setReadTimeout(settings.timeout());
        return RestClient.builder().requestFactory(requestFactory);
    }

    private static boolean isBlank(final String value) {
        return value == null || value.isBlank();
    }
}
