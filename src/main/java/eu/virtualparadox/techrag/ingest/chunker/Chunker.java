package eu.virtualparadox.techrag.ingest.chunker;

import eu.virtualparadox.techrag.ingest.model.Chunk;
import eu.virtualparadox.techrag.ingest.model.ExtractedDocument;
import eu.virtualparadox.techrag.ingest.relevance.RelevanceFilter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Separator-aware sliding-window {@code Chunker} that produces overlapping chunks for the RAG pipeline.
 *
 * <h2>Overview</h2>
 * <ul>
 *   <li><strong>Window:</strong> each span is at most {@code chunkSize} characters long.</li>
 *   <li><strong>Boundary preference:</strong> a window that does not reach the end of the text is
 *       closed right after the last paragraph break ({@code "\n\n"}) inside it; failing that, after
 *       the last line break, then after the last space. Only when none of these lies beyond the
 *       overlap region is the window hard-cut at {@code chunkSize}.</li>
 *   <li><strong>Overlap:</strong> the next window starts {@code overlapChars} characters before the
 *       previous end, moved forward to the first word start inside that region so that chunks do
 *       not begin mid-word. The realized overlap is therefore never larger than {@code overlapChars}.</li>
 * </ul>
 *
 * <h2>Coverage</h2>
 * Span ends are strictly increasing and every span starts no later than the previous one ends, so
 * the non-overlapping tails {@code [previousEnd, end)} concatenate back to the exact input.
 *
 * <h2>Determinism &amp; Thread-safety</h2>
 * This component is stateless after construction and thus thread-safe. For a given input the
 * output is deterministic.
 */
@Component
public class Chunker {

    /**
     * Boundaries tried from the largest granularity to the smallest.
     */
    private static final String[] SEPARATORS = {"\n\n", "\n", " "};

    /**
     * Maximum number of characters per span.
     */
    private final int chunkSize;

    /**
     * Maximum number of characters shared by two consecutive spans.
     */
    private final int overlapChars;

    private final RelevanceFilter relevanceFilter;

    /**
     * Constructs a {@code Chunker}.
     *
     * @param chunkSize       upper bound on the span length (must be {@code > 0})
     * @param overlapChars    upper bound on the overlap between consecutive spans
     *                        (must be {@code >= 0} and {@code < chunkSize})
     * @param relevanceFilter tagger applied to every produced chunk
     * @throws IllegalArgumentException if constraints are violated
     */
    public Chunker(@Value("${techrag.chunker.size:1000}") final int chunkSize,
                   @Value("${techrag.chunker.overlap:200}") final int overlapChars,
                   final RelevanceFilter relevanceFilter) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive");
        }
        if (overlapChars < 0 || overlapChars >= chunkSize) {
            throw new IllegalArgumentException("overlapChars must be non-negative and less than chunkSize");
        }
        this.chunkSize = chunkSize;
        this.overlapChars = overlapChars;
        this.relevanceFilter = relevanceFilter;
    }

    /**
     * Splits an extracted document into tagged chunks.
     * <p>Spans consisting only of whitespace are skipped; chunk text is trimmed and
     * {@code chunkIndex} runs 0, 1, 2, ... over the emitted chunks.</p>
     *
     * @param document extracted document (non-null)
     * @return ordered chunks, empty when the document text is blank
     */
    public List<Chunk> chunk(final ExtractedDocument document) {
        if (document == null) {
            throw new IllegalArgumentException("document cannot be null");
        }
        final List<Chunk> result = new ArrayList<>();
        if (document.isBlank()) {
            return result;
        }

        final String text = document.text();
        int index = 0;
        for (final TextSpan span : split(text)) {
            final String content = span.of(text).trim();
            if (content.isEmpty()) {
                continue;
            }
            result.add(new Chunk(
                    content,
                    document.source(),
                    document.sourceType(),
                    index++,
                    document.title(),
                    relevanceFilter.isDomainRelevant(content)));
        }
        return result;
    }

    /**
     * Computes the overlapping window spans for {@code text}.
     *
     * @param text input text (non-null, may be empty)
     * @return ordered spans covering the whole text; empty for empty input
     * @throws IllegalArgumentException if {@code text} is null
     */
    public List<TextSpan> split(final String text) {
        if (text == null) {
            throw new IllegalArgumentException("text cannot be null");
        }

        final List<TextSpan> spans = new ArrayList<>();
        final int length = text.length();
        int start = 0;
        while (start < length) {
            final int end = findEnd(text, start);
            spans.add(new TextSpan(start, end));
            if (end >= length) {
                break;
            }
            start = nextStart(text, start, end);
        }
        return spans;
    }

    /**
     * Picks the exclusive end of the window starting at {@code start}.
     * The end always lies beyond {@code start + overlapChars} so that the next window advances.
     */
    private int findEnd(final String text, final int start) {
        final int limit = Math.min(start + chunkSize, text.length());
        if (limit == text.length()) {
            return limit;
        }

        final int floor = start + overlapChars;
        for (final String separator : SEPARATORS) {
            final int idx = text.lastIndexOf(separator, limit - separator.length());
            if (idx < start) {
                continue;
            }
            final int cut = idx + separator.length();
            if (cut > floor) {
                return cut;
            }
        }
        return limit;
    }

    /**
     * Start of the window following {@code [previousStart, end)}: {@code overlapChars} back from
     * {@code end}, moved forward to the first word start inside the overlap region if there is one.
     */
    private int nextStart(final String text, final int previousStart, final int end) {
        final int candidate = Math.max(end - overlapChars, previousStart + 1);
        for (int i = candidate; i < end; i++) {
            if (isWordStart(text, i)) {
                return i;
            }
        }
        return candidate;
    }

    private static boolean isWordStart(final String text, final int i) {
        return !Character.isWhitespace(text.charAt(i))
                && (i == 0 || Character.isWhitespace(text.charAt(i - 1)));
    }
}
