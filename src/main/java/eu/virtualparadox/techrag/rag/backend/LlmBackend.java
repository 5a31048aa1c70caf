package eu.virtualparadox.techrag.rag.backend;

/**
 * A language model that turns a prompt into text.
 */
public interface LlmBackend {

    /**
     * @param prompt complete prompt
     * @return generated text, never blank
     * @throws BackendUnavailableException       on network error, timeout or non-success status
     * @throws BackendMalformedResponseException when the response carries no usable text
     */
    String generate(final String prompt);

    /**
     * Cheap reachability check. Never throws.
     */
    boolean isHealthy();

    EBackendProvider provider();
}
