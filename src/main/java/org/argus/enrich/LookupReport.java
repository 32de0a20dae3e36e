package org.argus.enrich;

import org.argus.EnrichedRecord;

import java.util.List;

public record LookupReport(List<EnrichedRecord> records, ProcessingStats stats, boolean attributionAvailable) {
}
