package org.argus.output;

import com.fasterxml.jackson.databind.JsonNode;
import org.argus.EnrichedRecord;
import org.argus.ObjectMapperFactory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResultFormatterTest {
    private static final EnrichedRecord MANAGED = EnrichedRecord.builder("8.8.8.8")
            .domain("google.com").city("Mountain View").region("California").country("United States")
            .isoCode("US").postal("94043").asn(15169L).asnOrg("GOOGLE")
            .proxy("DCH", "Google LLC", "DCH")
            .attribution("acme", "gcp")
            .build();
    private static final EnrichedRecord PLAIN = EnrichedRecord.builder("1.1.1.1")
            .country("Australia").asn(13335L)
            .build();
    private static final EnrichedRecord FAILED = EnrichedRecord.failure("203.0.113.5", "address not found in database");

    @TempDir
    Path tempDir;

    private final ResultFormatter formatter = new ResultFormatter(ObjectMapperFactory.create());

    @Test
    void jsonUsesExportFieldNamesAndNulls() throws Exception {
        final var json = ObjectMapperFactory.create().readTree(formatter.formatJson(List.of(MANAGED, FAILED)));

        final JsonNode first = json.get(0);
        assertThat(first.get("ip").asText()).isEqualTo("8.8.8.8");
        assertThat(first.get("iso_code").asText()).isEqualTo("US");
        assertThat(first.get("asn").asLong()).isEqualTo(15169L);
        assertThat(first.get("asn_org").asText()).isEqualTo("GOOGLE");
        assertThat(first.get("org_managed").asBoolean()).isTrue();
        assertThat(first.get("org_id").asText()).isEqualTo("acme");
        assertThat(first.get("proxy_type").asText()).isEqualTo("DCH");
        assertThat(first.get("usage_type").asText()).isEqualTo("DCH");
        assertThat(first.get("error").isNull()).isTrue();
        assertThat(first.has("hasError")).isFalse();

        final JsonNode second = json.get(1);
        assertThat(second.get("error").asText()).isEqualTo("address not found in database");
        assertThat(second.get("org_managed").asBoolean()).isFalse();
        assertThat(second.get("city").isNull()).isTrue();
    }

    @Test
    void csvLeavesAbsentValuesEmpty() throws Exception {
        final var lines = formatter.formatCsv(List.of(PLAIN, FAILED)).split("\\R");

        assertThat(lines[0]).isEqualTo(String.join(",", ResultFormatter.CSV_COLUMNS));
        assertThat(lines[1]).isEqualTo("1.1.1.1,false,,,,,,,Australia,,,,,13335,,");
        assertThat(lines[2]).startsWith("203.0.113.5,false,").endsWith(",address not found in database");
        assertThat(String.join("\n", lines)).doesNotContain("null").doesNotContain("None");
    }

    @Test
    void csvOfNothingIsEmpty() throws Exception {
        assertThat(formatter.formatCsv(List.of())).isEmpty();
    }

    @Test
    void singleRecordRendersAsPanel() {
        final var panel = formatter.formatTable(List.of(MANAGED));

        assertThat(panel).startsWith("== 8.8.8.8 ==");
        assertThat(panel).contains("Org Managed: ✓ acme (gcp)")
                .contains("Location: Mountain View, United States")
                .contains("ASN: AS15169 (GOOGLE)")
                .contains("Domain: google.com")
                .contains("Proxy: DCH (DCH)");
    }

    @Test
    void singleErrorRecordShowsTheError() {
        assertThat(formatter.formatTable(List.of(FAILED)))
                .contains("== 203.0.113.5 ==")
                .contains("ERROR: address not found in database");
        assertThat(formatter.formatTable(List.of(EnrichedRecord.builder("9.9.9.9").build())))
                .contains("No additional information available");
    }

    @Test
    void severalRecordsRenderAsGroupedTable() {
        final var lines = formatter.formatTable(List.of(MANAGED, PLAIN, FAILED)).split("\\R");

        assertThat(lines).hasSize(5);
        assertThat(lines[0]).startsWith("IP").contains("Org Info", "Proxy", "Network", "Location");
        assertThat(lines[1]).matches("[- ]+");
        assertThat(lines[2]).contains("✓ acme (gcp)", "google.com AS15169 (GOOGLE)", "Mountain View, United States");
        assertThat(lines[3]).startsWith("1.1.1.1").contains("AS13335").endsWith("Australia");
        assertThat(lines[4]).contains("ERROR: address not found in database");
        assertThat(formatter.formatTable(List.of())).isEqualTo("No results.");
    }

    @Test
    void writesTheChosenFormatToFile() throws Exception {
        final var target = tempDir.resolve("out/results.csv");

        final var written = formatter.writeToFile(List.of(PLAIN), target, OutputFormat.CSV);

        assertThat(written).isEqualTo(target);
        assertThat(Files.readString(target)).startsWith("ip,org_managed,");
    }

    @Test
    void defaultFileNameCarriesTimestampAndExtension() {
        final var file = ResultFormatter.defaultOutputFile(OutputFormat.JSON, LocalDateTime.of(2024, 3, 9, 14, 5, 7));

        assertThat(file).hasFileName("argus_results_20240309_140507.json");
    }

    @Test
    void formatNamesAreValidated() {
        assertThat(OutputFormat.fromName(null)).isEqualTo(OutputFormat.JSON);
        assertThat(OutputFormat.fromName("CSV")).isEqualTo(OutputFormat.CSV);
        assertThatThrownBy(() -> OutputFormat.fromName("xml")).isInstanceOf(IllegalArgumentException.class);
    }
}
