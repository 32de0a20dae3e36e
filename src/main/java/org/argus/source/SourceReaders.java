package org.argus.source;

import com.google.common.io.Closer;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * The reader handles one batch holds open. Closing releases every handle even when one of them fails
 * to close.
 */
public final class SourceReaders implements Closeable {
    private final GeoReader geo;
    private final ProxyReader proxy;
    private final HostnameResolver hostnames;

    public SourceReaders(GeoReader geo, ProxyReader proxy, HostnameResolver hostnames) {
        this.geo = geo;
        this.proxy = proxy;
        this.hostnames = hostnames;
    }

    /**
     * Opens the GeoLite2 City and ASN databases, plus the proxy database when {@code proxyCsv} exists.
     *
     * @throws IllegalStateException if a required database is missing
     */
    public static SourceReaders open(Path cityDatabase, Path asnDatabase, Path proxyCsv,
                                     HostnameResolver hostnames) throws IOException {
        requireFile(cityDatabase, "GeoLite2 City");
        requireFile(asnDatabase, "GeoLite2 ASN");
        final var geo = MaxMindGeoReader.open(cityDatabase, asnDatabase);
        try {
            final ProxyReader proxy = proxyCsv != null && Files.isRegularFile(proxyCsv)
                    ? CsvProxyReader.open(proxyCsv)
                    : ProxyReader.absent();
            return new SourceReaders(geo, proxy, hostnames);
        } catch (IOException | RuntimeException ex) {
            geo.close();
            throw ex;
        }
    }

    public GeoReader geo() {
        return geo;
    }

    public ProxyReader proxy() {
        return proxy;
    }

    public HostnameResolver hostnames() {
        return hostnames;
    }

    @Override
    public void close() throws IOException {
        final var closer = Closer.create();
        closer.register(hostnames);
        closer.register(proxy);
        closer.register(geo);
        closer.close();
    }

    private static void requireFile(Path file, String description) {
        if (file == null || !Files.isRegularFile(file)) {
            throw new IllegalStateException(description + " database missing at " + file);
        }
    }
}
