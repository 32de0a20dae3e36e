package org.argus.source;

import java.io.Closeable;
import java.io.IOException;
import java.net.InetAddress;
import java.util.Optional;

/**
 * Geolocation and network-ownership lookups against local databases. Empty means the database has
 * no entry for the address.
 */
public interface GeoReader extends Closeable {

    Optional<GeoLocation> location(InetAddress address) throws IOException;

    Optional<AsnInfo> asn(InetAddress address) throws IOException;
}
