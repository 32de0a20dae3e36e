package org.argus.filter;

import org.argus.EnrichedRecord;

import java.util.ArrayList;
import java.util.List;

public final class ResultSorter {
    private ResultSorter() {
    }

    /**
     * Stable ascending sort into a new list; the input is left untouched.
     */
    public static List<EnrichedRecord> sort(List<EnrichedRecord> records, SortKey key) {
        final var sorted = new ArrayList<>(records);
        sorted.sort(key.comparator());
        return List.copyOf(sorted);
    }
}
