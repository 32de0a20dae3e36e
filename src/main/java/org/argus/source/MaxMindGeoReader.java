package org.argus.source;

import com.maxmind.db.CHMCache;
import com.maxmind.geoip2.DatabaseReader;
import com.maxmind.geoip2.exception.GeoIp2Exception;

import java.io.IOException;
import java.net.InetAddress;
import java.nio.file.Path;
import java.util.Optional;

/**
 * GeoLite2 City and ASN databases.
 */
public final class MaxMindGeoReader implements GeoReader {
    private final DatabaseReader cityReader;
    private final DatabaseReader asnReader;

    public MaxMindGeoReader(DatabaseReader cityReader, DatabaseReader asnReader) {
        this.cityReader = cityReader;
        this.asnReader = asnReader;
    }

    public static MaxMindGeoReader open(Path cityDatabase, Path asnDatabase) throws IOException {
        final var city = new DatabaseReader.Builder(cityDatabase.toFile()).withCache(new CHMCache()).build();
        try {
            final var asn = new DatabaseReader.Builder(asnDatabase.toFile()).withCache(new CHMCache()).build();
            return new MaxMindGeoReader(city, asn);
        } catch (IOException ex) {
            city.close();
            throw ex;
        }
    }

    @Override
    public Optional<GeoLocation> location(InetAddress address) throws IOException {
        try {
            return cityReader.tryCity(address).map(city -> new GeoLocation(
                    blankToNull(city.getCity().getName()),
                    blankToNull(city.getMostSpecificSubdivision().getName()),
                    blankToNull(city.getCountry().getName()),
                    blankToNull(city.getCountry().getIsoCode()),
                    blankToNull(city.getPostal().getCode())));
        } catch (GeoIp2Exception ex) {
            throw new IOException(ex.getMessage(), ex);
        }
    }

    @Override
    public Optional<AsnInfo> asn(InetAddress address) throws IOException {
        try {
            return asnReader.tryAsn(address).map(asn -> new AsnInfo(
                    asn.getAutonomousSystemNumber() == null || asn.getAutonomousSystemNumber() == 0
                            ? null : asn.getAutonomousSystemNumber(),
                    blankToNull(asn.getAutonomousSystemOrganization())));
        } catch (GeoIp2Exception ex) {
            throw new IOException(ex.getMessage(), ex);
        }
    }

    @Override
    public void close() throws IOException {
        try {
            cityReader.close();
        } finally {
            asnReader.close();
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
