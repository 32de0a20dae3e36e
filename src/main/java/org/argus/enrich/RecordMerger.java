package org.argus.enrich;

import com.google.common.net.InetAddresses;
import org.argus.EnrichedRecord;
import org.argus.EnrichmentListener;
import org.argus.attribution.AttributionStore;
import org.argus.source.ProxyReader;
import org.argus.source.ProxyRecord;
import org.argus.source.SourceReaders;

import java.io.IOException;
import java.net.InetAddress;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds one {@link EnrichedRecord} per address from the source readers and the attribution store.
 * A failure for one address ends up in that record's {@code error}; it never stops the batch.
 */
public final class RecordMerger {
    public static final String NOT_FOUND = "address not found in database";
    public static final String INVALID_ADDRESS = "invalid address format";

    private final SourceReaders readers;
    private final AttributionStore attribution;

    public RecordMerger(SourceReaders readers, AttributionStore attribution) {
        this.readers = readers;
        this.attribution = attribution;
    }

    public List<EnrichedRecord> enrich(List<String> addresses, EnrichmentListener listener) {
        final var total = addresses.size();
        final var records = new ArrayList<EnrichedRecord>(total);
        listener.onBatchStarted(total);
        for (var address : addresses) {
            final var record = enrich(address);
            records.add(record);
            listener.onAddressEnriched(records.size(), total, record);
        }
        listener.onBatchFinished(total);
        return List.copyOf(records);
    }

    public EnrichedRecord enrich(String address) {
        if (address == null || !InetAddresses.isInetAddress(address)) {
            return EnrichedRecord.failure(String.valueOf(address), INVALID_ADDRESS);
        }
        final var inet = InetAddresses.forString(address);
        try {
            final var location = readers.geo().location(inet);
            final var asn = readers.geo().asn(inet);
            if (location.isEmpty() || asn.isEmpty()) return EnrichedRecord.failure(address, NOT_FOUND);

            final var builder = EnrichedRecord.builder(address)
                    .city(location.get().city())
                    .region(location.get().region())
                    .country(location.get().country())
                    .isoCode(location.get().isoCode())
                    .postal(location.get().postal())
                    .asn(asn.get().number())
                    .asnOrg(asn.get().organization());
            mergeProxy(builder, inet);
            if (builder.domain() == null) readers.hostnames().resolve(address).ifPresent(builder::domain);
            attribution.lookup(address).ifPresent(hit -> builder.attribution(hit.orgId(), hit.platform()));
            return builder.build();
        } catch (Exception ex) {
            return EnrichedRecord.failure(address, describe(ex));
        }
    }

    private void mergeProxy(EnrichedRecord.Builder builder, InetAddress address) throws IOException {
        final var found = readers.proxy().lookup(address);
        if (found.isEmpty() || !isKnown(found.get().countryCode())) return;
        final ProxyRecord proxy = found.get();
        builder.proxy(known(proxy.proxyType()), known(proxy.isp()), known(proxy.usageType()));
        builder.domain(known(proxy.domain()));
    }

    private static boolean isKnown(String value) {
        return value != null && !ProxyReader.UNKNOWN.equals(value);
    }

    private static String known(String value) {
        return isKnown(value) ? value : null;
    }

    private static String describe(Exception ex) {
        if (ex instanceof IllegalArgumentException) return INVALID_ADDRESS;
        final var message = ex.getMessage();
        return message == null || message.isBlank() ? ex.getClass().getSimpleName() : message;
    }
}
