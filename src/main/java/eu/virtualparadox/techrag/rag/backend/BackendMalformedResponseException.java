package eu.virtualparadox.techrag.rag.backend;

/**
 * The backend answered, but the payload was not in the expected shape or carried no text.
 */
public class BackendMalformedResponseException extends BackendUnavailableException {

    public BackendMalformedResponseException(final String message) {
        super(message);
    }

    public BackendMalformedResponseException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
