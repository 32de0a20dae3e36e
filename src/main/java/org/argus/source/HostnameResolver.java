package org.argus.source;

import java.io.Closeable;
import java.util.Optional;

public interface HostnameResolver extends Closeable {

    Optional<String> resolve(String address);

    static HostnameResolver disabled() {
        return new HostnameResolver() {
            @Override
            public Optional<String> resolve(String address) {
                return Optional.empty();
            }

            @Override
            public void close() {
            }
        };
    }
}
