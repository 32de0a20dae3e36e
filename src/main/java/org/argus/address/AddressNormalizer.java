package org.argus.address;

import com.google.common.net.InetAddresses;

import java.net.Inet4Address;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Turns raw input into the ordered, deduplicated list of IPv4 addresses to enrich.
 */
public final class AddressNormalizer {
    public static final int MAX_CIDR_HOSTS = 1024;

    private static final Pattern ADDRESS_PATTERN = Pattern.compile("\\b(?:[0-9]{1,3}\\.){3}[0-9]{1,3}\\b");

    private AddressNormalizer() {
    }

    public static boolean isCidr(String input) {
        return input != null && input.contains("/");
    }

    /**
     * Validates a single dotted-quad address and returns it unchanged.
     */
    public static String validate(String address) {
        if (address == null || address.isBlank()) {
            throw new AddressValidationException("IP address cannot be empty", address);
        }
        if (parse(address) == null) {
            throw new AddressValidationException("Invalid IP address: " + address, address);
        }
        return address;
    }

    /**
     * Expands a CIDR block to its globally routable host addresses in ascending order.
     *
     * @throws AddressValidationException if the block is malformed or holds more than
     *                                    {@value #MAX_CIDR_HOSTS} hosts
     */
    public static List<String> expand(String cidr) {
        final var slash = cidr == null ? -1 : cidr.indexOf('/');
        if (slash < 0) throw new AddressValidationException("Not a CIDR block: " + cidr, cidr);
        final var addressPart = cidr.substring(0, slash).trim();
        final var prefixPart = cidr.substring(slash + 1).trim();
        final var base = parse(addressPart);
        if (base == null) {
            throw new AddressValidationException("Invalid IP address in CIDR: " + addressPart, cidr);
        }
        if (!prefixPart.matches("\\d{1,2}") || Integer.parseInt(prefixPart) > 32) {
            throw new AddressValidationException("Invalid CIDR prefix: " + prefixPart, cidr);
        }
        final var prefix = Integer.parseInt(prefixPart);
        final var hostCount = hostCount(prefix);
        if (hostCount > MAX_CIDR_HOSTS) {
            throw new AddressValidationException(String.format(
                    "CIDR block %s contains %,d hosts, exceeding the limit of %d", cidr, hostCount, MAX_CIDR_HOSTS),
                    cidr, MAX_CIDR_HOSTS);
        }
        final var network = InetAddresses.coerceToInteger(base) & Ipv4Ranges.mask(prefix);
        final var first = prefix >= 31 ? network : network + 1;
        final var result = new ArrayList<String>((int) hostCount);
        for (var i = 0; i < hostCount; i++) {
            final var candidate = first + i;
            if (Ipv4Ranges.isGlobal(candidate)) result.add(toString(candidate));
        }
        return List.copyOf(result);
    }

    /**
     * Finds every globally routable address in free text, deduplicated and in ascending numeric order.
     */
    public static List<String> extract(String text) {
        if (text == null || text.isEmpty()) return List.of();
        final var found = new TreeSet<Integer>(Comparator.comparingLong(Integer::toUnsignedLong));
        final var matcher = ADDRESS_PATTERN.matcher(text);
        while (matcher.find()) {
            final var address = parse(matcher.group());
            if (address == null) continue;
            final var value = InetAddresses.coerceToInteger(address);
            if (Ipv4Ranges.isGlobal(value)) found.add(value);
        }
        return found.stream().map(AddressNormalizer::toString).toList();
    }

    /**
     * Candidates named by one command-line argument: the address itself, or the hosts of a CIDR block.
     */
    public static List<String> fromArgument(String argument) {
        final var trimmed = argument == null ? null : argument.trim();
        return isCidr(trimmed) ? expand(trimmed) : List.of(validate(trimmed));
    }

    /**
     * Concatenates candidate lists, keeping only the first occurrence of each address.
     */
    @SafeVarargs
    public static List<String> merge(List<String>... groups) {
        final var addresses = new LinkedHashSet<String>();
        for (var group : groups) addresses.addAll(group);
        return List.copyOf(addresses);
    }

    public static boolean isGlobal(String address) {
        final var parsed = parse(address);
        return parsed != null && Ipv4Ranges.isGlobal(InetAddresses.coerceToInteger(parsed));
    }

    static long hostCount(int prefix) {
        final var size = 1L << (32 - prefix);
        return size <= 2 ? size : size - 2;
    }

    private static Inet4Address parse(String candidate) {
        if (candidate == null || candidate.indexOf(':') >= 0 || !InetAddresses.isInetAddress(candidate)) return null;
        final var address = InetAddresses.forString(candidate);
        return address instanceof Inet4Address ? (Inet4Address) address : null;
    }

    private static String toString(int address) {
        return InetAddresses.toAddrString(InetAddresses.fromInteger(address));
    }
}
