package eu.virtualparadox.techrag.query.model;

/**
 * @param embeddings      the embedding model produces vectors
 * @param index           the chunk index is readable
 * @param backend         the backend currently serving generation is reachable
 * @param backendFallback fallback reachability, {@code null} without a fallback
 * @param primaryBackend  configured name of the primary backend
 * @param fallbackBackend configured name of the fallback backend, {@code null} without one
 * @param degraded        generation is currently routed to the fallback
 * @param pipelineReady   embeddings, index and backend are all healthy
 */
public record HealthStatus(boolean embeddings,
                           boolean index,
                           boolean backend,
                           Boolean backendFallback,
                           String primaryBackend,
                           String fallbackBackend,
                           boolean degraded,
                           boolean pipelineReady) {
}
