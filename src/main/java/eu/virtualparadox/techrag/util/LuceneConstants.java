package eu.virtualparadox.techrag.util;

public class LuceneConstants {
    public static final String FIELD_VECTOR = "vector";
    public static final String FIELD_VECTOR_BYTES = "vectorBytes";
    public static final String FIELD_SOURCE_KEY = "sourceKey";
    public static final String FIELD_CONTENT = "content";
    public static final String FIELD_SOURCE = "source";
    public static final String FIELD_SOURCE_TYPE = "sourceType";
    public static final String FIELD_CHUNK_INDEX = "chunkIndex";
    public static final String FIELD_TITLE = "title";
    public static final String FIELD_DOMAIN_RELEVANT = "domainRelevant";

    /** Commit user-data key holding the id of the embedding model the vectors were produced with. */
    public static final String COMMIT_EMBEDDING_MODEL = "embeddingModel";

    private LuceneConstants() {
        // prevent instantiation
    }
}
