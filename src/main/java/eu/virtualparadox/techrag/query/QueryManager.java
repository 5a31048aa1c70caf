package eu.virtualparadox.techrag.query;

import eu.virtualparadox.techrag.ingest.model.Chunk;
import eu.virtualparadox.techrag.query.model.CollectionStats;
import eu.virtualparadox.techrag.query.model.HealthStatus;
import eu.virtualparadox.techrag.query.model.QueryResult;
import eu.virtualparadox.techrag.query.model.SourceExcerpt;
import eu.virtualparadox.techrag.rag.answer.AnswerService;
import eu.virtualparadox.techrag.rag.backend.EBackendProvider;
import eu.virtualparadox.techrag.rag.backend.FailoverRouter;
import eu.virtualparadox.techrag.rag.embed.EmbeddingService;
import eu.virtualparadox.techrag.rag.index.VectorIndexService;
import eu.virtualparadox.techrag.rag.retriever.model.SearchResult;
import eu.virtualparadox.techrag.rag.retriever.service.KnnRetrieverService;
import eu.virtualparadox.techrag.rag.retriever.service.MmrRetrieverService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Entry point of the query side: answers questions from the indexed documentation and reports on
 * the state of the pipeline.
 * <p>
 * {@link #query(String)} never throws; every failure is turned into an answer starting with
 * {@value #ERROR_PREFIX} and an empty source list.
 */
@Service
@Slf4j
public final class QueryManager {

    static final String ERROR_PREFIX = "Error processing query: ";
    static final String BLANK_QUESTION_ANSWER = "Please ask a question about your technical documentation.";
    static final int SAMPLE_SOURCES = 10;

    private final MmrRetrieverService mmrRetrieverService;
    private final KnnRetrieverService knnRetrieverService;
    private final AnswerService answerService;
    private final VectorIndexService vectorIndexService;
    private final EmbeddingService embeddingService;
    private final FailoverRouter failoverRouter;
    private final int k;
    private final int previewChars;

    public QueryManager(final MmrRetrieverService mmrRetrieverService,
                        final KnnRetrieverService knnRetrieverService,
                        final AnswerService answerService,
                        final VectorIndexService vectorIndexService,
                        final EmbeddingService embeddingService,
                        final FailoverRouter failoverRouter,
                        @Value("${techrag.retrieval.k:5}") final int k,
                        @Value("${techrag.query.preview-chars:200}") final int previewChars) {
        this.mmrRetrieverService = mmrRetrieverService;
        this.knnRetrieverService = knnRetrieverService;
        this.answerService = answerService;
        this.vectorIndexService = vectorIndexService;
        this.embeddingService = embeddingService;
        this.failoverRouter = failoverRouter;
        this.k = k;
        this.previewChars = previewChars;
    }

    public QueryResult query(final String question) {
        if (question == null || question.isBlank()) {
            return new QueryResult(BLANK_QUESTION_ANSWER, question, List.of());
        }

        try {
            log.info("Processing query: {}", question);
            final List<SearchResult> retrieved = mmrRetrieverService.search(question, k);
            printDebugRetrieved(retrieved);

            final String answer = answerService.answer(question, retrieved);
            final List<SourceExcerpt> sources = retrieved.stream()
                    .map(r -> SourceExcerpt.of(r.chunk(), previewChars))
                    .toList();
            return new QueryResult(answer, question, sources);
        }
        catch (Exception e) {
            log.error("Query failed: {}", question, e);
            return new QueryResult(ERROR_PREFIX + describe(e), question, List.of());
        }
    }

    /**
     * Plain similarity search without generation.
     */
    public List<Chunk> similar(final String question, final int limit) {
        return knnRetrieverService.search(question, limit).stream()
                .map(SearchResult::chunk)
                .toList();
    }

    public HealthStatus health() {
        final boolean embeddings = check("embeddings", () -> embeddingService.embedQuery("test").length > 0);
        final boolean index = check("index", () -> vectorIndexService.count() >= 0);
        final boolean backend = check("backend", failoverRouter::isHealthy);
        final Boolean fallback = failoverRouter.isFallbackHealthy().orElse(null);
        final String fallbackName = failoverRouter.fallbackProvider().map(EBackendProvider::configName).orElse(null);

        return new HealthStatus(embeddings, index, backend, fallback,
                failoverRouter.primaryProvider().configName(), fallbackName,
                failoverRouter.isDegraded(), embeddings && index && backend);
    }

    /**
     * Computed from every stored chunk on each call.
     */
    public CollectionStats stats() {
        final List<Chunk> chunks = vectorIndexService.allChunks();

        final Map<String, Long> documentTypes = new TreeMap<>();
        final Set<String> sources = new LinkedHashSet<>();
        for (final Chunk chunk : chunks) {
            documentTypes.merge(chunk.sourceType().wireName(), 1L, Long::sum);
            sources.add(chunk.source());
        }

        return new CollectionStats(
                chunks.size(),
                documentTypes,
                sources.size(),
                sources.stream().limit(SAMPLE_SOURCES).toList());
    }

    public void clear() {
        vectorIndexService.deleteAll();
    }

    public void resetBackend() {
        failoverRouter.reset();
    }

    private boolean check(final String component, final HealthCheck healthCheck) {
        try {
            return healthCheck.check();
        }
        catch (Exception e) {
            log.warn("Health check of {} failed: {}", component, e.getMessage());
            return false;
        }
    }

    private static String describe(final Exception e) {
        return e.getMessage() == null || e.getMessage().isBlank() ? e.getClass().getSimpleName() : e.getMessage();
    }

    private void printDebugRetrieved(final List<SearchResult> retrieved) {
        if (!log.isDebugEnabled()) {
            return;
        }
        final StringBuilder sb = new StringBuilder();
        for (final SearchResult r : retrieved) {
            sb.append(" - ").append("[").append(r.score()).append("] ")
                    .append(r.chunk().source()).append("#").append(r.chunk().chunkIndex()).append("\n");
        }
        log.debug("Retrieved chunks:\n{}", sb);
    }

    @FunctionalInterface
    private interface HealthCheck {
        boolean check();
    }
}
