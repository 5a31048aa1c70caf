package eu.virtualparadox.techrag.ingest.model;

/**
 * Plain text produced by an extractor for one input, before chunking.
 * <p>A blank {@code text} is a valid outcome and yields zero chunks.</p>
 *
 * @param source     file path or URL
 * @param sourceType kind of input
 * @param title      file name or page title
 * @param text       extracted text, possibly blank
 */
public record ExtractedDocument(String source, ESourceType sourceType, String title, String text) {

    public boolean isBlank() {
        return text == null || text.isBlank();
    }
}
