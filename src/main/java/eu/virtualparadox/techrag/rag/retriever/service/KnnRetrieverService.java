package eu.virtualparadox.techrag.rag.retriever.service;

import eu.virtualparadox.techrag.rag.embed.EmbeddingService;
import eu.virtualparadox.techrag.rag.index.VectorIndexService;
import eu.virtualparadox.techrag.rag.retriever.model.SearchResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Plain semantic search over the chunk index.
 * <p>
 * Steps:
 * <ol>
 *   <li>Embed the user query using {@link EmbeddingService}</li>
 *   <li>Return the {@code k} nearest chunks from {@link VectorIndexService}</li>
 * </ol>
 */
@Service
@RequiredArgsConstructor
public final class KnnRetrieverService implements RetrieverService {

    private final EmbeddingService embeddingService;
    private final VectorIndexService vectorIndexService;

    /**
     * @param query user input string
     * @param k     maximum number of results to return
     * @return nearest chunks, best first (never null)
     */
    @Override
    public List<SearchResult> search(final String query, final int k) {
        final float[] vector = embeddingService.embedQuery(query);
        return vectorIndexService.similaritySearch(vector, k);
    }
}
