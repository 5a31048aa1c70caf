package eu.virtualparadox.techrag.rag.retriever.model;

import eu.virtualparadox.techrag.ingest.model.Chunk;

/**
 * @param chunk  The stored chunk with its citation metadata.
 * @param vector The embedding the chunk was indexed with.
 * @param score  Similarity score as returned by Lucene (higher = better).
 */
public record SearchResult(Chunk chunk, float[] vector, float score) {

}
