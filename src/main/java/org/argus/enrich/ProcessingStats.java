package org.argus.enrich;

import java.time.Duration;

public record ProcessingStats(int totalIps, int successfulLookups, int failedLookups, int filteredIps,
                              Duration processingTime) {

    public double successRate() {
        if (totalIps == 0) return 0.0;
        return successfulLookups * 100.0 / totalIps;
    }

    public double filterRate() {
        if (successfulLookups == 0) return 0.0;
        return Math.round(filteredIps * 10_000.0 / successfulLookups) / 100.0;
    }
}
