package org.argus;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;

/**
 * Prints pipeline events as console status lines.
 */
public final class ConsoleReporter implements EnrichmentListener {
    private final PrintStream out;
    private final PrintStream err;
    private long summaryEvery = 1;

    public ConsoleReporter(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    @Override
    public void onAttributionLoaded(int datasets, List<String> names) {
        out.printf("Loaded %d attribution dataset(s): %s%n", datasets, String.join(", ", names));
    }

    @Override
    public void onDatasetSkipped(Path file, String reason) {
        err.printf("Skipping attribution dataset %s: %s%n", file, reason);
    }

    @Override
    public void onBatchStarted(int total) {
        summaryEvery = Math.max(1, total / 100);
        if (total > 1) out.printf("Looking up %,d IPs...%n", total);
    }

    @Override
    public void onAddressEnriched(int processed, int total, EnrichedRecord record) {
        if (total <= 1) return;
        if (processed % summaryEvery == 0 || processed == total) {
            final var percent = (processed * 100.0) / total;
            out.printf("Progress: %.2f%% (%d/%d) | %s%n", percent, processed, total, record.address());
        }
    }

    @Override
    public void onFiltered(int before, int after) {
        out.printf("Filtered out %d IP(s)%n", before - after);
    }
}
