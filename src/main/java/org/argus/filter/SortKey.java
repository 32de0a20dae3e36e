package org.argus.filter;

import org.argus.EnrichedRecord;

import java.util.Arrays;
import java.util.Comparator;
import java.util.Locale;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Record fields results can be ordered by. Missing values sort after present ones.
 */
public enum SortKey {
    IP("ip", nullsLast(EnrichedRecord::address)),
    DOMAIN("domain", nullsLast(EnrichedRecord::domain)),
    CITY("city", nullsLast(EnrichedRecord::city)),
    REGION("region", nullsLast(EnrichedRecord::region)),
    COUNTRY("country", nullsLast(EnrichedRecord::country)),
    ISO_CODE("iso_code", nullsLast(EnrichedRecord::isoCode)),
    ASN("asn", nullsLast(EnrichedRecord::asn)),
    ASN_ORG("asn_org", nullsLast(EnrichedRecord::asnOrg)),
    PLATFORM("platform", nullsLast(EnrichedRecord::platform)),
    ORG_ID("org_id", nullsLast(EnrichedRecord::orgId)),
    PROXY_TYPE("proxy_type", nullsLast(EnrichedRecord::proxyType));

    private final String fieldName;
    private final Comparator<EnrichedRecord> comparator;

    SortKey(String fieldName, Comparator<EnrichedRecord> comparator) {
        this.fieldName = fieldName;
        this.comparator = comparator;
    }

    public String fieldName() {
        return fieldName;
    }

    public Comparator<EnrichedRecord> comparator() {
        return comparator;
    }

    public static SortKey fromName(String name) {
        final var normalized = name == null ? "" : name.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (var key : values()) {
            if (key.fieldName.equals(normalized)) return key;
        }
        throw new IllegalArgumentException("Invalid sort field: " + name + ". Valid options: "
                + Arrays.stream(values()).map(SortKey::fieldName).collect(Collectors.joining(", ")));
    }

    private static <U extends Comparable<? super U>> Comparator<EnrichedRecord> nullsLast(
            Function<EnrichedRecord, U> field) {
        return Comparator.comparing(field, Comparator.nullsLast(Comparator.<U>naturalOrder()));
    }
}
