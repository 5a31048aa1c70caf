package eu.virtualparadox.techrag.rag.backend;

import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class ChatModelBackendTest {

    private final ChatModel chatModel = mock(ChatModel.class);

    private static ChatResponse response(final String text) {
        return new ChatResponse(List.of(new Generation(new AssistantMessage(text))));
    }

    @Test
    void returnsGeneratedText() {
        when(chatModel.call(any(Prompt.class))).thenReturn(response("Use a 4:1 unun."));
        final ChatModelBackend backend = new ChatModelBackend(EBackendProvider.OPENAI, chatModel);

        assertThat(backend.generate("How do I feed an end fed wire?")).isEqualTo("Use a 4:1 unun.");

        final ArgumentCaptor<Prompt> prompt = ArgumentCaptor.forClass(Prompt.class);
        verify(chatModel).call(prompt.capture());
        assertThat(prompt.getValue().getContents()).isEqualTo("How do I feed an end fed wire?");
    }

    @Test
    void clientFailureIsUnavailable() {
        when(chatModel.call(any(Prompt.class))).thenThrow(new IllegalStateException("401 invalid api key"));
        final ChatModelBackend backend = new ChatModelBackend(EBackendProvider.ANTHROPIC, chatModel);

        assertThatThrownBy(() -> backend.generate("p"))
                .isExactlyInstanceOf(BackendUnavailableException.class)
                .hasMessageContaining("anthropic");
        assertThat(backend.isHealthy()).isFalse();
    }

    @Test
    void blankGenerationIsMalformed() {
        when(chatModel.call(any(Prompt.class))).thenReturn(response(""));
        final ChatModelBackend backend = new ChatModelBackend(EBackendProvider.OPENAI, chatModel);

        assertThatThrownBy(() -> backend.generate("p")).isInstanceOf(BackendMalformedResponseException.class);
    }

    @Test
    void emptyResponseIsMalformed() {
        when(chatModel.call(any(Prompt.class))).thenReturn(new ChatResponse(List.of()));
        final ChatModelBackend backend = new ChatModelBackend(EBackendProvider.OPENAI, chatModel);

        assertThatThrownBy(() -> backend.generate("p")).isInstanceOf(BackendMalformedResponseException.class);
    }

    @Test
    void cloudHealthIsAMinimalGeneration() {
        when(chatModel.call(any(Prompt.class))).thenReturn(response("OK"));
        final ChatModelBackend backend = new ChatModelBackend(EBackendProvider.OPENAI, chatModel);

        assertThat(backend.isHealthy()).isTrue();

        final ArgumentCaptor<Prompt> prompt = ArgumentCaptor.forClass(Prompt.class);
        verify(chatModel).call(prompt.capture());
        assertThat(prompt.getValue().getContents()).isEqualTo(ChatModelBackend.HEALTH_PROMPT);
    }

    @Test
    void ollamaHealthListsModelsInsteadOfGenerating() {
        final RestClient.Builder builder = RestClient.builder().baseUrl("http://ollama.local:11434");
        final MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
        final OllamaBackend backend = new OllamaBackend(chatModel, builder.build());

        server.expect(requestTo("http://ollama.local:11434/api/tags"))
                .andRespond(withSuccess("{\"models\":[]}", MediaType.APPLICATION_JSON));
        assertThat(backend.isHealthy()).isTrue();

        server.reset();
        server.expect(requestTo("http://ollama.local:11434/api/tags")).andRespond(withServerError());
        assertThat(backend.isHealthy()).isFalse();

        verify(chatModel, never()).call(any(Prompt.class));
        assertThat(backend.provider()).isEqualTo(EBackendProvider.OLLAMA);
    }
}
