package eu.virtualparadox.techrag.rag.index;

/**
 * The chunk index could not be read or written. Fatal for the current request and not retried.
 */
public class IndexUnavailableException extends IllegalStateException {

    public IndexUnavailableException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
