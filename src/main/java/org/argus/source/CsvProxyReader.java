package org.argus.source;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.google.common.net.InetAddresses;

import java.io.IOException;
import java.net.Inet4Address;
import java.net.InetAddress;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Optional;

/**
 * IP2Proxy LITE CSV database held in memory as sorted address ranges. Rows look like
 * {@code "ip_from","ip_to","proxy_type","country_code","country_name","region","city","isp","domain",
 * "usage_type",...}; the PX1 tier omits {@code proxy_type} and everything after the country.
 */
public final class CsvProxyReader implements ProxyReader {
    private final long[] starts;
    private final long[] ends;
    private final ProxyRecord[] records;

    private CsvProxyReader(long[] starts, long[] ends, ProxyRecord[] records) {
        this.starts = starts;
        this.ends = ends;
        this.records = records;
    }

    public static CsvProxyReader open(Path file) throws IOException {
        final var mapper = new CsvMapper();
        mapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
        final var ranges = new ArrayList<Range>();
        try (MappingIterator<String[]> rows = mapper.readerFor(String[].class).readValues(file.toFile())) {
            while (rows.hasNextValue()) {
                final var row = rows.nextValue();
                if (row.length < 4 || !isNumber(row[0]) || !isNumber(row[1])) continue;
                ranges.add(new Range(Long.parseLong(row[0]), Long.parseLong(row[1]), toRecord(row)));
            }
        }
        ranges.sort(Comparator.comparingLong(Range::start));
        final var starts = new long[ranges.size()];
        final var ends = new long[ranges.size()];
        final var records = new ProxyRecord[ranges.size()];
        for (var i = 0; i < ranges.size(); i++) {
            starts[i] = ranges.get(i).start();
            ends[i] = ranges.get(i).end();
            records[i] = ranges.get(i).record();
        }
        return new CsvProxyReader(starts, ends, records);
    }

    public int size() {
        return records.length;
    }

    @Override
    public Optional<ProxyRecord> lookup(InetAddress address) {
        if (!(address instanceof Inet4Address)) return Optional.empty();
        final var value = Integer.toUnsignedLong(InetAddresses.coerceToInteger(address));
        var position = Arrays.binarySearch(starts, value);
        if (position < 0) position = -position - 2;
        if (position < 0 || value > ends[position]) return Optional.empty();
        return Optional.of(records[position]);
    }

    @Override
    public void close() {
    }

    private static ProxyRecord toRecord(String[] row) {
        if (row.length == 4) {
            return new ProxyRecord(column(row, 2), UNKNOWN, UNKNOWN, UNKNOWN, UNKNOWN);
        }
        return new ProxyRecord(column(row, 3), column(row, 2), column(row, 7), column(row, 8), column(row, 9));
    }

    private static String column(String[] row, int index) {
        if (index >= row.length || row[index] == null || row[index].isBlank()) return UNKNOWN;
        return row[index].trim();
    }

    private static boolean isNumber(String value) {
        return value != null && !value.isEmpty() && value.chars().allMatch(Character::isDigit);
    }

    private record Range(long start, long end, ProxyRecord record) {
    }
}
