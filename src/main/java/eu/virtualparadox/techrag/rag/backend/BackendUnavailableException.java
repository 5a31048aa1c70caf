package eu.virtualparadox.techrag.rag.backend;

/**
 * A backend could not produce output: network error, timeout or non-success status.
 * Triggers failover in {@link FailoverRouter}.
 */
public class BackendUnavailableException extends RuntimeException {

    public BackendUnavailableException(final String message) {
        super(message);
    }

    public BackendUnavailableException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
