package eu.virtualparadox.techrag.query.model;

import eu.virtualparadox.techrag.ingest.model.Chunk;
import eu.virtualparadox.techrag.ingest.model.ESourceType;

/**
 * A cited chunk: a preview of its content plus its unmodified metadata.
 */
public record SourceExcerpt(String content,
                            String source,
                            ESourceType sourceType,
                            int chunkIndex,
                            String title,
                            boolean domainRelevant) {

    /**
     * @param chunk        cited chunk
     * @param previewChars maximum preview length; {@code ...} is appended only when the content is cut
     */
    public static SourceExcerpt of(final Chunk chunk, final int previewChars) {
        final String content = chunk.content();
        final String preview = content.length() > previewChars
                ? content.substring(0, previewChars) + "..."
                : content;
        return new SourceExcerpt(preview, chunk.source(), chunk.sourceType(), chunk.chunkIndex(),
                chunk.title(), chunk.domainRelevant());
    }
}
