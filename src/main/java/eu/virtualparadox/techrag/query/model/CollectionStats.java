package eu.virtualparadox.techrag.query.model;

import java.util.List;
import java.util.Map;

/**
 * Summary of the indexed collection, computed on demand.
 *
 * @param totalChunks   number of stored chunks
 * @param documentTypes chunk count per source type wire name
 * @param uniqueSources number of distinct sources
 * @param sampleSources up to ten source identifiers
 */
public record CollectionStats(long totalChunks,
                              Map<String, Long> documentTypes,
                              int uniqueSources,
                              List<String> sampleSources) {
}
