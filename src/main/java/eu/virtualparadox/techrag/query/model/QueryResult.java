package eu.virtualparadox.techrag.query.model;

import java.util.List;

/**
 * @param answer   generated answer, or an {@code Error processing query: ...} message
 * @param question the question as asked
 * @param sources  cited chunks; empty when the query failed
 */
public record QueryResult(String answer, String question, List<SourceExcerpt> sources) {

    public QueryResult {
        sources = sources == null ? List.of() : List.copyOf(sources);
    }
}
