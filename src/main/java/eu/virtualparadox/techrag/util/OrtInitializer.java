package eu.virtualparadox.techrag.util;

import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import lombok.extern.slf4j.Slf4j;

/**
 * Builds ONNX Runtime session options for the embedding model from the {@code techrag.embedding.*}
 * thread settings.
 */
@Slf4j
public final class OrtInitializer {

    private OrtInitializer() {
    }

    /**
     * @param intraOpThreads threads used inside one operator; {@code 0} or less picks all cores but one
     * @param interOpThreads threads running independent operators in parallel, at least 1
     */
    public static OrtSession.SessionOptions sessionOptions(final int intraOpThreads, final int interOpThreads) {
        if (interOpThreads < 1) {
            throw new IllegalArgumentException("interOpThreads must be at least 1, was " + interOpThreads);
        }
        final int intra = intraOpThreads(intraOpThreads, Runtime.getRuntime().availableProcessors());

        final OrtSession.SessionOptions opts = new OrtSession.SessionOptions();
        try {
            opts.setIntraOpNumThreads(intra);
            opts.setInterOpNumThreads(interOpThreads);
        }
        catch (OrtException e) {
            opts.close();
            throw new IllegalStateException("Failed to configure ONNX Runtime threads", e);
        }
        log.info("ONNX Runtime threads: intra-op {}, inter-op {}", intra, interOpThreads);
        return opts;
    }

    static int intraOpThreads(final int configured, final int cores) {
        if (configured > 0) {
            return configured;
        }
        // one core stays free for ingestion and request handling
        return Math.max(1, cores - 1);
    }
}
