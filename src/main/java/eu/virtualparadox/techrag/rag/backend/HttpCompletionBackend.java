package eu.virtualparadox.techrag.rag.backend;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.time.Duration;
import java.util.Map;

/**
 * Base class for self-hosted HTTP generation servers.
 * <p>
 * Requests are posted as JSON and read back as a {@link JsonNode}. I/O errors and 5xx responses are
 * retried up to {@code maxAttempts} times; after that, and on any other non-success status, the call
 * fails with {@link BackendUnavailableException}. A response that cannot be decoded or lacks the
 * text field fails with {@link BackendMalformedResponseException}.
 */
@Slf4j
public abstract class HttpCompletionBackend implements LlmBackend {

    private final EBackendProvider provider;
    protected final BackendSettings settings;
    private final RestClient restClient;
    private final Retry retry;

    protected HttpCompletionBackend(final BackendSettings settings, final RestClient restClient) {
        this.provider = settings.provider();
        this.settings = settings;
        this.restClient = restClient;
        this.retry = Retry.of(provider.configName() + "-generate", RetryConfig.custom()
                .maxAttempts(settings.maxAttempts())
                .waitDuration(Duration.ofMillis(500))
                .retryOnException(e -> e instanceof ResourceAccessException || e instanceof HttpServerErrorException)
                .build());
    }

    protected abstract String generatePath();

    protected abstract String healthPath();

    protected abstract Map<String, Object> payload(final String prompt);

    /**
     * @return the generated text, or {@code null} when the response does not carry it
     */
    protected abstract JsonNode generatedText(final JsonNode response);

    @Override
    public String generate(final String prompt) {
        final JsonNode response;
        try {
            response = retry.executeSupplier(() -> restClient.post()
                    .uri(generatePath())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(payload(prompt))
                    .retrieve()
                    .body(JsonNode.class));
        }
        catch (RestClientResponseException e) {
            throw new BackendUnavailableException(provider.configName() + " returned HTTP " + e.getStatusCode().value(), e);
        }
        catch (ResourceAccessException e) {
            throw new BackendUnavailableException(provider.configName() + " is unreachable: " + e.getMessage(), e);
        }
        catch (RestClientException e) {
            throw new BackendMalformedResponseException(provider.configName() + " response could not be decoded", e);
        }

        final JsonNode text = response == null ? null : generatedText(response);
        if (text == null || !text.isTextual() || text.asText().isBlank()) {
            throw new BackendMalformedResponseException(provider.configName() + " response carries no generated text");
        }
        return text.asText();
    }

    @Override
    public boolean isHealthy() {
        try {
            return restClient.get()
                    .uri(healthPath())
                    .retrieve()
                    .toBodilessEntity()
                    .getStatusCode()
                    .is2xxSuccessful();
        }
        catch (RestClientException e) {
            log.warn("Health check of {} failed: {}", provider.configName(), e.getMessage());
            return false;
        }
    }

    @Override
    public EBackendProvider provider() {
        return provider;
    }
}
