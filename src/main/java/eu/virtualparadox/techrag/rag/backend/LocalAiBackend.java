package eu.virtualparadox.techrag.rag.backend;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.web.client.RestClient;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * LocalAI through its OpenAI-compatible chat completion endpoint.
 */
public class LocalAiBackend extends HttpCompletionBackend {

    public LocalAiBackend(final BackendSettings settings, final RestClient restClient) {
        super(settings, restClient);
    }

    @Override
    protected String generatePath() {
        return "/v1/chat/completions";
    }

    @Override
    protected String healthPath() {
        return "/v1/models";
    }

    @Override
    protected Map<String, Object> payload(final String prompt) {
        final Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", settings.modelName());
        payload.put("messages", List.of(Map.of("role", "user", "content", prompt)));
        payload.put("temperature", settings.temperature());
        payload.put("max_tokens", settings.maxOutputTokens());
        return payload;
    }

    @Override
    protected JsonNode generatedText(final JsonNode response) {
        return response.path("choices").path(0).path("message").get("content");
    }
}
