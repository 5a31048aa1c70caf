package eu.virtualparadox.techrag.ingest.model;

/**
 * Immutable representation of a text chunk produced by extraction + chunking.
 * <p>Carries the chunk text together with the citation metadata that stays authoritative
 * after the chunk has been handed to the vector index.</p>
 *
 * @param content        chunk text to be embedded
 * @param source         file path or URL the chunk was extracted from
 * @param sourceType     kind of input the chunk came from
 * @param chunkIndex     zero-based position of the chunk within its source
 * @param title          file name or page title
 * @param domainRelevant relevance tag computed from {@code content} at creation time
 */
public record Chunk(String content,
                    String source,
                    ESourceType sourceType,
                    int chunkIndex,
                    String title,
                    boolean domainRelevant) {

    public Chunk {
        if (chunkIndex < 0) {
            throw new IllegalArgumentException("chunkIndex must be non-negative");
        }
        if (sourceType == null) {
            throw new IllegalArgumentException("sourceType must not be null");
        }
    }
}
