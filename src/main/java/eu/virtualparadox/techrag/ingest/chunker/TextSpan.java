package eu.virtualparadox.techrag.ingest.chunker;

/**
 * Immutable half-open span {@code [start, end)} pointing into the source text.
 *
 * @param start inclusive start offset (0 ≤ start ≤ end)
 * @param end   exclusive end offset (start ≤ end ≤ text length)
 */
public record TextSpan(int start, int end) {

    public TextSpan {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
    }

    public int length() {
        return end - start;
    }

    public String of(final String source) {
        return source.substring(start, end);
    }
}
