package eu.virtualparadox.techrag.rag.index;

import eu.virtualparadox.techrag.ingest.model.Chunk;
import eu.virtualparadox.techrag.rag.retriever.model.SearchResult;

import java.util.List;

/**
 * Abstraction over the persistent vector index used for approximate nearest neighbor (ANN) search.
 * <p>
 * Implementations persist chunk-level vectors alongside the chunk text and citation metadata:
 * <ul>
 *   <li><b>Add</b>: store chunk+vector pairs; a source that is added again replaces its earlier chunks</li>
 *   <li><b>Search</b>: return the nearest chunks together with their stored vectors</li>
 *   <li><b>Inspect</b>: count and list all stored chunks</li>
 *   <li><b>Clear</b>: remove every chunk</li>
 * </ul>
 * All failures surface as {@link IndexUnavailableException}.
 */
public interface VectorIndexService {

    /**
     * Adds the chunk+vector pairs. All previously stored chunks of every {@code (source, sourceType)}
     * present in {@code chunks} are removed first, so chunk indices stay unique per source.
     *
     * @param chunks  chunk metadata (non-empty)
     * @param vectors dense vectors, one per chunk, same order and dimension
     * @throws IllegalArgumentException if parameters are empty or sizes/dimensions mismatch
     */
    void add(final List<Chunk> chunks, final List<float[]> vectors);

    /**
     * @param vector query vector
     * @param k      maximum number of results
     * @return up to {@code k} results, nearest first
     */
    List<SearchResult> similaritySearch(final float[] vector, final int k);

    long count();

    List<Chunk> allChunks();

    void deleteAll();
}
