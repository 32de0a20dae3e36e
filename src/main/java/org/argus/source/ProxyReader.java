package org.argus.source;

import java.io.Closeable;
import java.io.IOException;
import java.net.InetAddress;
import java.util.Optional;

public interface ProxyReader extends Closeable {
    /** Placeholder the proxy database uses for a field it has no value for. */
    String UNKNOWN = "-";

    Optional<ProxyRecord> lookup(InetAddress address) throws IOException;

    static ProxyReader absent() {
        return new ProxyReader() {
            @Override
            public Optional<ProxyRecord> lookup(InetAddress address) {
                return Optional.empty();
            }

            @Override
            public void close() {
            }
        };
    }
}
