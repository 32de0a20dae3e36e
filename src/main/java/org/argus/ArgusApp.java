package org.argus;

import org.argus.address.AddressNormalizer;
import org.argus.enrich.LookupPipeline;
import org.argus.enrich.LookupReport;
import org.argus.enrich.ProcessingStats;
import org.argus.filter.SortKey;
import org.argus.input.DocumentTextReader;
import org.argus.output.OutputFormat;
import org.argus.output.ResultFormatter;
import org.argus.source.HostnameResolver;
import org.argus.source.ReverseDnsResolver;
import org.argus.source.SourceReaders;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.NoSuchFileException;
import java.util.List;

public final class ArgusApp {
    private static final String USAGE = """
            Usage: argus <ip|cidr> [--file=<path>] [options]
              --file=<path>                  extract public IPs from a text, PDF or Excel file
              --output=<path>|-              write results to a file (- for a timestamped name)
              --format=json|csv              output file format
              --sort-by=<field>              ip, domain, city, region, country, iso_code, asn, asn_org,
                                             platform, org_id, proxy_type
              --exclude-country=US,CN        --exclude-city=<names>
              --exclude-asn=15169,13335      --exclude-org=<text>
              --exclude-org-managed          --exclude-not-org-managed
              --exclude-platform=<names>     --exclude-org-id=<ids>
              --reverse-dns[=false]          resolve domains for IPs the proxy database does not name
              --data-dir=<path>              databases and config (default ~/.argus or ARGUS_DATA_DIR)""";

    private ArgusApp() {
    }

    public static void main(String[] args) {
        final var options = CliOptions.parse(args);
        if (options.help()) {
            System.out.println(USAGE);
            return;
        }
        if (options.address() == null && options.file() == null) {
            System.out.println("No IP or file provided. Use --help for usage information.");
            return;
        }
        try {
            final var state = new StatePaths(options.dataDir());
            state.ensureDirectories();
            final var config = new ConfigManager(state.configFile()).loadOrCreate();
            System.exit(run(options, state, config, System.out, System.err));
        } catch (IllegalStateException ex) {
            System.err.println("Error: " + ex.getMessage());
            System.exit(1);
        }
    }

    static int run(CliOptions options, StatePaths state, Config config, PrintStream out, PrintStream err) {
        final SortKey sortKey;
        final OutputFormat format;
        final List<String> addresses;
        try {
            sortKey = SortKey.fromName(options.sortBy() != null ? options.sortBy() : config.defaultSort());
            format = OutputFormat.fromName(options.format() != null ? options.format() : config.defaultFormat());
            addresses = collectAddresses(options, out, err);
        } catch (IllegalArgumentException ex) {
            err.println("Error: " + ex.getMessage());
            return 1;
        } catch (NoSuchFileException ex) {
            err.printf("Error: File '%s' not found%n", options.file());
            return 1;
        } catch (IOException ex) {
            err.printf("Error reading file %s: %s%n", options.file(), ex.getMessage());
            return 1;
        }
        if (addresses.isEmpty()) return 0;

        final var mapper = ObjectMapperFactory.create();
        final var reporter = new ConsoleReporter(out, err);
        final var reverseDns = options.reverseDns() != null ? options.reverseDns() : config.reverseDns();
        final var pipeline = new LookupPipeline(mapper, state.attributionDir(),
                () -> openReaders(state, config, reverseDns), reporter);
        final LookupReport report;
        try {
            report = pipeline.run(addresses, options.filter(), sortKey);
        } catch (IOException | IllegalStateException ex) {
            err.println("Error: " + ex.getMessage());
            return 1;
        }

        final var formatter = new ResultFormatter(mapper);
        if (!report.attributionAvailable()) {
            out.printf("No attribution datasets in %s; no IP is marked as organization managed%n",
                    state.attributionDir());
        }
        out.println(formatter.formatTable(report.records()));
        if (options.writesFile()) {
            try {
                final var written = formatter.writeToFile(report.records(), options.output(), format);
                out.println("Results written to " + written);
            } catch (IOException ex) {
                err.println("Error writing to file: " + ex.getMessage());
                return 1;
            }
        }
        printSummary(report.stats(), out);
        return 0;
    }

    static void printSummary(ProcessingStats stats, PrintStream out) {
        out.printf("%nProcessed %d IP(s) in %.2fs%n", stats.totalIps(), stats.processingTime().toNanos() / 1e9);
        out.printf("Lookups: %d succeeded, %d failed (%.2f%% success)%n",
                stats.successfulLookups(), stats.failedLookups(), stats.successRate());
        if (stats.filteredIps() > 0) {
            out.printf("Filtered: %d IP(s) (%.2f%% of successful lookups)%n", stats.filteredIps(), stats.filterRate());
        }
    }

    static List<String> collectAddresses(CliOptions options, PrintStream out, PrintStream err) throws IOException {
        List<String> direct = List.of();
        if (options.address() != null) {
            direct = AddressNormalizer.fromArgument(options.address());
            if (AddressNormalizer.isCidr(options.address())) {
                out.printf("Expanded CIDR block %s into %d IP(s)%n", options.address(), direct.size());
            }
        }
        List<String> extracted = List.of();
        if (options.file() != null) {
            extracted = AddressNormalizer.extract(DocumentTextReader.read(options.file()));
            if (extracted.isEmpty()) {
                err.println("Warning: No public IPs found in file");
            } else {
                out.printf("Extracted %d unique public IP(s) from file%n", extracted.size());
            }
        }
        return AddressNormalizer.merge(direct, extracted);
    }

    private static SourceReaders openReaders(StatePaths state, Config config, boolean reverseDns) throws IOException {
        final HostnameResolver hostnames = reverseDns
                ? new ReverseDnsResolver(config.reverseDnsTimeout(), config.apexDomains())
                : HostnameResolver.disabled();
        try {
            return SourceReaders.open(state.cityDatabase(), state.asnDatabase(), state.proxyDatabase(), hostnames);
        } catch (IOException | RuntimeException ex) {
            hostnames.close();
            throw ex;
        }
    }
}
