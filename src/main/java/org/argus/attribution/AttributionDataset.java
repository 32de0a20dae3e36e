package org.argus.attribution;

import java.util.Optional;

/**
 * A named, read-only attribution table answering exact-address lookups. Implementations differ
 * only in how the table is stored.
 */
public interface AttributionDataset extends AutoCloseable {

    String name();

    /**
     * @param address the literal address string; no prefix or range matching is applied
     */
    Optional<Attribution> lookup(String address);

    @Override
    default void close() {
    }
}
