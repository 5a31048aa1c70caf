package eu.virtualparadox.techrag.web;

import eu.virtualparadox.techrag.ingest.lifecycle.IngestionReport;
import eu.virtualparadox.techrag.ingest.lifecycle.IngestionService;
import eu.virtualparadox.techrag.ingest.model.Chunk;
import eu.virtualparadox.techrag.ingest.model.ESourceType;
import eu.virtualparadox.techrag.query.QueryManager;
import eu.virtualparadox.techrag.query.model.CollectionStats;
import eu.virtualparadox.techrag.query.model.HealthStatus;
import eu.virtualparadox.techrag.query.model.QueryResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class KnowledgeControllerTest {

    @TempDir
    Path tempDir;

    private QueryManager queryManager;
    private IngestionService ingestionService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        queryManager = mock(QueryManager.class);
        ingestionService = mock(IngestionService.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new KnowledgeController(queryManager, ingestionService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void query() throws Exception {
        when(queryManager.query("What is SWR?")).thenReturn(new QueryResult("Standing wave ratio.", "What is SWR?", List.of()));

        mockMvc.perform(post("/api/query")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question\":\"What is SWR?\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.answer").value("Standing wave ratio."))
                .andExpect(jsonPath("$.sources").isEmpty());
    }

    @Test
    void blankQuestionIsRejected() throws Exception {
        mockMvc.perform(post("/api/query")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question\":\" \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("question must not be blank"));
        verifyNoInteractions(queryManager);
    }

    @Test
    void urlMustBeHttp() throws Exception {
        mockMvc.perform(post("/api/documents/url")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"url\":\"ftp://example.org/file\"}"))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(ingestionService);
    }

    @Test
    void ingestUrl() throws Exception {
        when(ingestionService.ingestUrl("https://example.org/dipole")).thenReturn(IngestionReport.success(4));

        mockMvc.perform(post("/api/documents/url")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"url\":\"https://example.org/dipole\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.chunksIndexed").value(4))
                .andExpect(jsonPath("$.itemsSucceeded").value(1));
    }

    @Test
    void upload() throws Exception {
        when(ingestionService.ingestUpload(eq("manual.pdf"), any(InputStream.class))).thenReturn(IngestionReport.success(7));

        mockMvc.perform(multipart("/api/documents/upload")
                        .file(new MockMultipartFile("file", "manual.pdf", "application/pdf", new byte[]{1, 2, 3})))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.chunksIndexed").value(7));
    }

    @Test
    void emptyUploadIsRejected() throws Exception {
        mockMvc.perform(multipart("/api/documents/upload")
                        .file(new MockMultipartFile("file", "manual.pdf", "application/pdf", new byte[0])))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(ingestionService);
    }

    @Test
    void similar() throws Exception {
        when(queryManager.similar("yagi boom", 2)).thenReturn(List.of(
                new Chunk("Yagi boom length sets the gain.", "yagi.pdf", ESourceType.PDF, 1, "yagi.pdf", true)));

        mockMvc.perform(get("/api/similar").param("query", "yagi boom").param("limit", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.query").value("yagi boom"))
                .andExpect(jsonPath("$.documents[0].content").value("Yagi boom length sets the gain."))
                .andExpect(jsonPath("$.documents[0].source").value("yagi.pdf"))
                .andExpect(jsonPath("$.documents[0].chunkIndex").value(1));
    }

    @Test
    void similarDefaultsToFiveResults() throws Exception {
        when(queryManager.similar("balun", 5)).thenReturn(List.of());

        mockMvc.perform(get("/api/similar").param("query", "balun"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.documents").isEmpty());
        verify(queryManager).similar("balun", 5);
    }

    @Test
    void similarNeedsAQuery() throws Exception {
        mockMvc.perform(get("/api/similar")).andExpect(status().isBadRequest());
        mockMvc.perform(get("/api/similar").param("query", " ")).andExpect(status().isBadRequest());
        verifyNoInteractions(queryManager);
    }

    @Test
    @DisplayName("A directory path is ingested recursively, a file path as a single item")
    void ingestPath() throws Exception {
        final Path file = Files.writeString(tempDir.resolve("notes.pdf"), "x");
        when(ingestionService.ingestDirectory(tempDir)).thenReturn(IngestionReport.success(5));
        when(ingestionService.ingestFile(file)).thenReturn(IngestionReport.success(2));

        mockMvc.perform(post("/api/documents/path")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"path\":\"" + jsonEscape(tempDir) + "\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.chunksIndexed").value(5));
        mockMvc.perform(post("/api/documents/path")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"path\":\"" + jsonEscape(file) + "\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.chunksIndexed").value(2));
    }

    @Test
    void missingPathIsRejected() throws Exception {
        mockMvc.perform(post("/api/documents/path")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"path\":\"" + jsonEscape(tempDir.resolve("nope")) + "\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value(startsWith("Path does not exist")));
        verifyNoInteractions(ingestionService);
    }

    private static String jsonEscape(final Path path) {
        return path.toString().replace("\\", "\\\\");
    }

    @Test
    void health() throws Exception {
        when(queryManager.health()).thenReturn(
                new HealthStatus(true, true, false, true, "openai", "ollama", true, false));

        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.primaryBackend").value("openai"))
                .andExpect(jsonPath("$.fallbackBackend").value("ollama"))
                .andExpect(jsonPath("$.degraded").value(true))
                .andExpect(jsonPath("$.pipelineReady").value(false));
    }

    @Test
    void stats() throws Exception {
        when(queryManager.stats()).thenReturn(new CollectionStats(3, Map.of("pdf", 3L), 1, List.of("a.pdf")));

        mockMvc.perform(get("/api/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalChunks").value(3))
                .andExpect(jsonPath("$.documentTypes.pdf").value(3))
                .andExpect(jsonPath("$.sampleSources[0]").value("a.pdf"));
    }

    @Test
    void clearAndReset() throws Exception {
        mockMvc.perform(delete("/api/documents")).andExpect(status().isOk());
        mockMvc.perform(post("/api/backend/reset")).andExpect(status().isOk());

        verify(queryManager).clear();
        verify(queryManager).resetBackend();
    }

    @Test
    void unexpectedErrorsHideDetails() throws Exception {
        when(queryManager.stats()).thenThrow(new IllegalStateException("index directory is locked"));

        mockMvc.perform(get("/api/stats"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.message").value(GlobalExceptionHandler.GENERIC_MESSAGE));
    }
}
