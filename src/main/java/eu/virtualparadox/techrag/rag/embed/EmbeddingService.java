package eu.virtualparadox.techrag.rag.embed;

import java.util.List;

/**
 * Computes dense vector embeddings for chunk texts and queries.
 * <p>
 * The same model must be used at insert and at query time; {@link #modelId()} lets the index
 * detect a model change.
 */
public interface EmbeddingService {

    /**
     * Embeds the given texts in batch.
     *
     * @param texts texts to embed
     * @return list of float vectors, one per text, in input order
     * @throws IllegalStateException if the model fails
     */
    List<float[]> embed(final List<String> texts);

    /**
     * Embeds a single query string into dense vector space.
     * <p>
     * Used at query time for semantic search.
     *
     * @param text the query string (non-null, non-blank)
     * @return a dense vector representation of the query
     */
    float[] embedQuery(final String text);

    /**
     * @return identifier of the embedding model, recorded alongside the index
     */
    String modelId();
}
