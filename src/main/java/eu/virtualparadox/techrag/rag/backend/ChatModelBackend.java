package eu.virtualparadox.techrag.rag.backend;

import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;

/**
 * Backend served by a Spring AI {@link ChatModel} (OpenAI, Anthropic and, with its own health
 * check, Ollama). Timeouts and retries are owned by the chat model's HTTP client.
 * <p>
 * The health check of the cloud providers is a minimal real generation.
 */
@Slf4j
public class ChatModelBackend implements LlmBackend {

    static final String HEALTH_PROMPT = "Test";

    private final EBackendProvider provider;
    private final ChatModel chatModel;

    public ChatModelBackend(final EBackendProvider provider, final ChatModel chatModel) {
        this.provider = provider;
        this.chatModel = chatModel;
    }

    @Override
    public String generate(final String prompt) {
        final ChatResponse response;
        try {
            response = chatModel.call(new Prompt(new UserMessage(prompt)));
        }
        catch (RuntimeException e) {
            throw new BackendUnavailableException(provider.configName() + " generation failed: " + e.getMessage(), e);
        }

        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            throw new BackendMalformedResponseException(provider.configName() + " returned no generation");
        }
        final String text = response.getResult().getOutput().getText();
        if (text == null || text.isBlank()) {
            throw new BackendMalformedResponseException(provider.configName() + " returned an empty generation");
        }
        return text;
    }

    @Override
    public boolean isHealthy() {
        try {
            generate(HEALTH_PROMPT);
            return true;
        }
        catch (RuntimeException e) {
            log.warn("Health check of {} failed: {}", provider.configName(), e.getMessage());
            return false;
        }
    }

    @Override
    public EBackendProvider provider() {
        return provider;
    }
}
