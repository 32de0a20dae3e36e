package org.argus.enrich;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.argus.EnrichedRecord;
import org.argus.EnrichmentListener;
import org.argus.attribution.AttributionStore;
import org.argus.filter.FilterCriteria;
import org.argus.filter.ResultFilter;
import org.argus.filter.ResultSorter;
import org.argus.filter.SortKey;
import org.argus.source.SourceReaders;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * One lookup batch: load attribution, open the source readers, merge, filter, sort. Reader handles
 * and attribution datasets are released before {@link #run} returns, whichever way it returns.
 */
public final class LookupPipeline {
    private final ObjectMapper mapper;
    private final Path attributionDir;
    private final ReaderSupplier readers;
    private final EnrichmentListener listener;

    public LookupPipeline(ObjectMapper mapper, Path attributionDir, ReaderSupplier readers,
                          EnrichmentListener listener) {
        this.mapper = mapper;
        this.attributionDir = attributionDir;
        this.readers = readers;
        this.listener = listener;
    }

    public LookupReport run(List<String> addresses, FilterCriteria criteria, SortKey sortKey) throws IOException {
        final var started = System.nanoTime();
        try (var attribution = new AttributionStore(mapper, listener);
             var sources = readers.open()) {
            final var attributionAvailable = attribution.load(attributionDir);
            final var records = new RecordMerger(sources, attribution).enrich(addresses, listener);
            final var filtered = new ResultFilter(criteria).filter(records);
            if (filtered.size() < records.size()) listener.onFiltered(records.size(), filtered.size());
            final var sorted = ResultSorter.sort(filtered, sortKey);
            final var failed = (int) records.stream().filter(EnrichedRecord::hasError).count();
            final var stats = new ProcessingStats(records.size(), records.size() - failed, failed,
                    records.size() - filtered.size(), Duration.ofNanos(System.nanoTime() - started));
            return new LookupReport(sorted, stats, attributionAvailable);
        }
    }

    @FunctionalInterface
    public interface ReaderSupplier {
        SourceReaders open() throws IOException;
    }
}
