package org.argus;

import java.nio.file.Path;
import java.util.List;

/**
 * Progress and status events emitted by the lookup pipeline. The pipeline never writes to the
 * console itself; the caller decides what to do with these.
 */
public interface EnrichmentListener {
    EnrichmentListener NONE = new EnrichmentListener() {
    };

    default void onAttributionLoaded(int datasets, List<String> names) {
    }

    default void onDatasetSkipped(Path file, String reason) {
    }

    default void onBatchStarted(int total) {
    }

    default void onAddressEnriched(int processed, int total, EnrichedRecord record) {
    }

    default void onBatchFinished(int total) {
    }

    default void onFiltered(int before, int after) {
    }
}
