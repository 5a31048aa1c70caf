package eu.virtualparadox.techrag.rag.backend;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.web.client.RestClient;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * text-generation-webui legacy API: {@code POST /api/v1/generate}, answer in {@code results[0].text}.
 */
public class TextGenWebUiBackend extends HttpCompletionBackend {

    public TextGenWebUiBackend(final BackendSettings settings, final RestClient restClient) {
        super(settings, restClient);
    }

    @Override
    protected String generatePath() {
        return "/api/v1/generate";
    }

    @Override
    protected String healthPath() {
        return "/api/v1/model";
    }

    @Override
    protected Map<String, Object> payload(final String prompt) {
        final Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("prompt", prompt);
        payload.put("max_new_tokens", settings.maxOutputTokens());
        payload.put("temperature", settings.temperature());
        payload.put("do_sample", true);
        payload.put("top_p", 0.9);
        payload.put("top_k", 20);
        payload.put("repetition_penalty", 1.1);
        return payload;
    }

    @Override
    protected JsonNode generatedText(final JsonNode response) {
        return response.path("results").path(0).get("text");
    }
}
