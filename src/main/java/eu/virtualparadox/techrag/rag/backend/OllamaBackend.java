package eu.virtualparadox.techrag.rag.backend;

import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Locally served Ollama model. Generation goes through Spring AI; health is the model listing.
 */
@Slf4j
public class OllamaBackend extends ChatModelBackend {

    static final String HEALTH_PATH = "/api/tags";

    private final RestClient restClient;

    public OllamaBackend(final ChatModel chatModel, final RestClient restClient) {
        super(EBackendProvider.OLLAMA, chatModel);
        this.restClient = restClient;
    }

    @Override
    public boolean isHealthy() {
        try {
            return restClient.get()
                    .uri(HEALTH_PATH)
                    .retrieve()
                    .toBodilessEntity()
                    .getStatusCode()
                    .is2xxSuccessful();
        }
        catch (RestClientException e) {
            log.warn("Health check of ollama failed: {}", e.getMessage());
            return false;
        }
    }
}
