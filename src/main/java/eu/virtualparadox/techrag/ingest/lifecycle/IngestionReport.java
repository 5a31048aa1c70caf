package eu.virtualparadox.techrag.ingest.lifecycle;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of an ingestion call.
 *
 * @param itemsSucceeded files or pages processed without error (including those that yielded no text)
 * @param itemsFailed    files or pages that could not be processed
 * @param chunksIndexed  chunks written to the index
 * @param failures       one message per failed item
 */
public record IngestionReport(int itemsSucceeded, int itemsFailed, int chunksIndexed, List<String> failures) {

    public IngestionReport {
        failures = List.copyOf(failures);
    }

    public static IngestionReport empty() {
        return new IngestionReport(0, 0, 0, List.of());
    }

    public static IngestionReport success(final int chunksIndexed) {
        return new IngestionReport(1, 0, chunksIndexed, List.of());
    }

    public static IngestionReport failure(final String message) {
        return new IngestionReport(0, 1, 0, List.of(message));
    }

    public IngestionReport plus(final IngestionReport other) {
        final List<String> merged = new ArrayList<>(failures);
        merged.addAll(other.failures);
        return new IngestionReport(
                itemsSucceeded + other.itemsSucceeded,
                itemsFailed + other.itemsFailed,
                chunksIndexed + other.chunksIndexed,
                merged);
    }
}
