package org.argus.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.argus.EnrichedRecord;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders records for the console and for export. Absent values are rendered as {@code -} on the
 * console, as empty cells in CSV and as {@code null} in JSON.
 */
public final class ResultFormatter {
    static final List<String> CSV_COLUMNS = List.of("ip", "org_managed", "org_id", "platform", "proxy_type",
            "domain", "city", "region", "country", "iso_code", "postal", "isp", "usage_type", "asn", "asn_org",
            "error");
    private static final List<String> TABLE_HEADERS = List.of("IP", "Org Info", "Proxy", "Network", "Location");
    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final ObjectMapper mapper;
    private final CsvMapper csvMapper = new CsvMapper();

    public ResultFormatter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String formatTable(List<EnrichedRecord> records) {
        if (records.isEmpty()) return "No results.";
        return records.size() == 1 ? formatPanel(records.get(0)) : formatGroupedTable(records);
    }

    public String formatJson(List<EnrichedRecord> records) throws JsonProcessingException {
        return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(records);
    }

    public String formatCsv(List<EnrichedRecord> records) throws JsonProcessingException {
        if (records.isEmpty()) return "";
        final var schema = CsvSchema.builder();
        CSV_COLUMNS.forEach(schema::addColumn);
        return csvMapper.writer(schema.build().withHeader()).writeValueAsString(records);
    }

    public Path writeToFile(List<EnrichedRecord> records, Path outputFile, OutputFormat format) throws IOException {
        final var file = outputFile != null ? outputFile : defaultOutputFile(format, LocalDateTime.now());
        final var content = format == OutputFormat.CSV ? formatCsv(records) : formatJson(records);
        if (file.getParent() != null) Files.createDirectories(file.getParent());
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    static Path defaultOutputFile(OutputFormat format, LocalDateTime now) {
        return Path.of("argus_results_" + FILE_TIMESTAMP.format(now) + "." + format.extension());
    }

    private String formatPanel(EnrichedRecord record) {
        final var lines = new ArrayList<String>();
        lines.add("== " + record.address() + " ==");
        if (record.hasError()) {
            lines.add("ERROR: " + record.error());
            return String.join(System.lineSeparator(), lines);
        }
        if (record.orgManaged()) lines.add("Org Managed: " + orgCell(record));
        record.locationDisplay().ifPresent(location -> lines.add("Location: " + location));
        record.asnDisplay().ifPresent(asn -> lines.add("ASN: " + asn));
        if (record.domain() != null) lines.add("Domain: " + record.domain());
        if (record.hasProxyInfo() || record.usageType() != null) lines.add("Proxy: " + proxyCell(record));
        if (lines.size() == 1) lines.add("No additional information available");
        return String.join(System.lineSeparator(), lines);
    }

    private String formatGroupedTable(List<EnrichedRecord> records) {
        final var rows = new ArrayList<List<String>>();
        rows.add(TABLE_HEADERS);
        for (var record : records) {
            if (record.hasError()) {
                rows.add(List.of(record.address(), "", "", "ERROR: " + record.error(), ""));
            } else {
                rows.add(List.of(record.address(), record.orgManaged() ? orgCell(record) : "-", proxyCell(record),
                        networkCell(record), record.locationDisplay().orElse("-")));
            }
        }
        final var widths = new int[TABLE_HEADERS.size()];
        for (var row : rows) {
            for (var i = 0; i < widths.length; i++) widths[i] = Math.max(widths[i], row.get(i).length());
        }
        final var out = new StringBuilder();
        for (var r = 0; r < rows.size(); r++) {
            out.append(line(rows.get(r), widths));
            if (r == 0) {
                final var rule = new ArrayList<String>();
                for (var width : widths) rule.add("-".repeat(width));
                out.append(System.lineSeparator()).append(line(rule, widths));
            }
            if (r < rows.size() - 1) out.append(System.lineSeparator());
        }
        return out.toString();
    }

    private static String line(List<String> cells, int[] widths) {
        final var out = new StringBuilder();
        for (var i = 0; i < cells.size(); i++) {
            if (i > 0) out.append("  ");
            out.append(i == cells.size() - 1 ? cells.get(i) : pad(cells.get(i), widths[i]));
        }
        return out.toString().stripTrailing();
    }

    private static String pad(String value, int width) {
        return value + " ".repeat(width - value.length());
    }

    private static String orgCell(EnrichedRecord record) {
        final var parts = new StringBuilder("✓");
        if (record.orgId() != null) parts.append(' ').append(record.orgId());
        if (record.platform() != null) parts.append(" (").append(record.platform()).append(')');
        return parts.toString();
    }

    private static String proxyCell(EnrichedRecord record) {
        final var parts = new ArrayList<String>();
        if (record.proxyType() != null) parts.add(record.proxyType());
        if (record.usageType() != null) parts.add("(" + record.usageType() + ")");
        return parts.isEmpty() ? "-" : String.join(" ", parts);
    }

    private static String networkCell(EnrichedRecord record) {
        final var parts = new ArrayList<String>();
        if (record.domain() != null) parts.add(record.domain());
        record.asnDisplay().ifPresent(parts::add);
        return parts.isEmpty() ? "-" : String.join(" ", parts);
    }
}
