package org.argus;

import org.argus.filter.FilterCriteria;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Command-line options. Options take the form {@code --name=value} (lists comma separated) or
 * {@code --flag}; the first bare argument is the address or CIDR block to look up.
 */
public record CliOptions(String address, Path file, Path output, boolean timestampedOutput, String format,
                         String sortBy, FilterCriteria filter, Path dataDir, Boolean reverseDns, boolean help) {
    private static final long MAX_ASN = 4_294_967_295L;

    public static CliOptions parse(String[] args) {
        final var parsed = new HashMap<String, String>();
        final var positional = new ArrayList<String>();
        parseArgs(args, parsed, positional);

        final var outputValue = parsed.get("output");
        final var timestamped = "-".equals(outputValue) || "".equals(outputValue) || "true".equals(outputValue);
        final var output = outputValue == null || timestamped ? null : Path.of(outputValue);
        final var filter = FilterCriteria.builder()
                .excludeCountries(list(parsed.get("exclude-country")))
                .excludeCities(list(parsed.get("exclude-city")))
                .excludeAsns(parseAsnList(parsed.get("exclude-asn")))
                .excludeOrgs(list(parsed.get("exclude-org")))
                .excludeOrgManaged(flag(parsed, "exclude-org-managed"))
                .excludeNotOrgManaged(flag(parsed, "exclude-not-org-managed"))
                .excludePlatforms(list(parsed.get("exclude-platform")))
                .excludeOrgIds(list(parsed.get("exclude-org-id")))
                .build();
        final var dataDir = Path.of(parsed.getOrDefault("data-dir",
                System.getenv().getOrDefault("ARGUS_DATA_DIR",
                        System.getProperty("user.home") + "/.argus")));
        final var reverseDns = parsed.containsKey("reverse-dns") ? flag(parsed, "reverse-dns") : null;
        final var file = parsed.containsKey("file") ? Path.of(parsed.get("file")) : null;
        return new CliOptions(positional.isEmpty() ? null : positional.get(0), file, output, timestamped,
                parsed.get("format"), parsed.get("sort-by"), filter, dataDir, reverseDns,
                parsed.containsKey("help"));
    }

    public boolean writesFile() {
        return output != null || timestampedOutput;
    }

    private static void parseArgs(String[] args, Map<String, String> values, List<String> positional) {
        for (var arg : args) {
            if (!arg.startsWith("--")) {
                positional.add(arg);
                continue;
            }
            final var parts = arg.substring(2).split("=", 2);
            final var key = parts[0];
            final var value = parts.length == 2 ? parts[1] : "true";
            values.merge(key, value, (previous, next) -> previous + "," + next);
        }
    }

    private static boolean flag(Map<String, String> values, String key) {
        final var value = values.get(key);
        return value != null && !"false".equalsIgnoreCase(value.trim());
    }

    private static List<String> list(String value) {
        if (value == null || value.isBlank()) return List.of();
        final var result = new ArrayList<String>();
        for (final var token : value.split(",")) {
            final var trimmed = token.trim();
            if (!trimmed.isEmpty()) result.add(trimmed);
        }
        return List.copyOf(result);
    }

    private static List<Long> parseAsnList(String value) {
        final var result = new ArrayList<Long>();
        for (final var token : list(value)) {
            final var digits = token.toUpperCase().startsWith("AS") ? token.substring(2) : token;
            try {
                final var asn = Long.parseLong(digits);
                if (asn < 0 || asn > MAX_ASN) {
                    System.err.println("Warning: ASN out of range in exclude list: " + token);
                    continue;
                }
                result.add(asn);
            } catch (NumberFormatException ex) {
                System.err.println("Warning: Invalid ASN in exclude list: " + token);
            }
        }
        return List.copyOf(result);
    }
}
