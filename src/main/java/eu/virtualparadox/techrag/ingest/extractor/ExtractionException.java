package eu.virtualparadox.techrag.ingest.extractor;

/**
 * Raised when a page, file or URL cannot be turned into text.
 * <p>Scoped to a single input item; the ingestion pipeline logs it and continues.</p>
 */
public class ExtractionException extends RuntimeException {

    public ExtractionException(final String message) {
        super(message);
    }

    public ExtractionException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
