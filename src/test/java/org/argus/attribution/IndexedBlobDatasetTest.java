package org.argus.attribution;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.argus.ObjectMapperFactory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IndexedBlobDatasetTest {
    private static final ObjectMapper MAPPER = ObjectMapperFactory.create();

    @TempDir
    Path tempDir;

    @Test
    void answersExactAddressLookups() throws Exception {
        final var dataset = IndexedBlobDataset.read(
                DatasetFixtures.writePlain(tempDir.resolve("cloud.bin"), DatasetFixtures.CLOUD_BLOB), MAPPER);

        assertThat(dataset.name()).isEqualTo("cloud");
        assertThat(dataset.size()).isEqualTo(3);
        assertThat(dataset.lookup("203.0.113.10")).contains(new Attribution("acme", "aws", "cloud"));
        assertThat(dataset.lookup("192.0.2.44")).contains(new Attribution("initech", null, "cloud"));
        assertThat(dataset.lookup("203.0.113.0")).isEmpty();
        assertThat(dataset.lookup("203.0.113.10/32")).isEmpty();
    }

    @Test
    void compressedAndPlainFilesAnswerIdentically() throws Exception {
        final var plain = IndexedBlobDataset.read(
                DatasetFixtures.writePlain(tempDir.resolve("plain.bin"), DatasetFixtures.CLOUD_BLOB), MAPPER);
        final var gzipped = IndexedBlobDataset.read(
                DatasetFixtures.writeGzipped(tempDir.resolve("gzipped.bin"), DatasetFixtures.CLOUD_BLOB), MAPPER);

        for (var address : List.of("203.0.113.10", "198.51.100.7", "192.0.2.44", "8.8.8.8")) {
            assertThat(gzipped.lookup(address).map(hit -> hit.orgId() + "/" + hit.platform()))
                    .as(address)
                    .isEqualTo(plain.lookup(address).map(hit -> hit.orgId() + "/" + hit.platform()));
        }
    }

    @Test
    void duplicateIndexEntriesResolveToLowestRow() throws Exception {
        final var json = """
                {"rows": [
                   {"ip": "203.0.113.10", "org_id": "first", "platform": "aws"},
                   {"ip": "203.0.113.10", "org_id": "second", "platform": "azure"},
                   {"ip": "203.0.113.10", "org_id": "third", "platform": "gcp"}],
                 "indexes": {"ip": {"203.0.113.10": [2, 0, 1]}}}
                """;
        final var dataset = IndexedBlobDataset.read(DatasetFixtures.writePlain(tempDir.resolve("dup.bin"), json), MAPPER);

        assertThat(dataset.lookup("203.0.113.10")).map(Attribution::orgId).contains("first");
    }

    @Test
    void acceptsLegacyFieldNames() throws Exception {
        final var json = """
                {"rows": [{"address": "198.51.100.7", "cfa_id": "legacy-org", "platform": "oci"}],
                 "indexes": {"address": {"198.51.100.7": 0}}}
                """;
        final var dataset = IndexedBlobDataset.read(DatasetFixtures.writePlain(tempDir.resolve("old.bin"), json), MAPPER);

        assertThat(dataset.lookup("198.51.100.7")).contains(new Attribution("legacy-org", "oci", "old"));
    }

    @Test
    void datasetWithoutAddressIndexNeverMatches() throws Exception {
        final var json = """
                {"rows": [{"ip": "198.51.100.7", "org_id": "x"}], "indexes": {"org_id": {"x": 0}}}
                """;
        final var dataset = IndexedBlobDataset.read(DatasetFixtures.writePlain(tempDir.resolve("x.bin"), json), MAPPER);

        assertThat(dataset.lookup("198.51.100.7")).isEmpty();
    }

    @Test
    void rejectsStructurallyBrokenFiles() throws IOException {
        final var noIndexes = DatasetFixtures.writePlain(tempDir.resolve("a.bin"), "{\"rows\": []}");
        final var danglingIndex = DatasetFixtures.writePlain(tempDir.resolve("b.bin"),
                "{\"rows\": [], \"indexes\": {\"ip\": {\"8.8.8.8\": 3}}}");
        final var notJson = DatasetFixtures.writePlain(tempDir.resolve("c.bin"), "\u0080\u0004binary-pickle");

        assertThatThrownBy(() -> IndexedBlobDataset.read(noIndexes, MAPPER)).isInstanceOf(IOException.class);
        assertThatThrownBy(() -> IndexedBlobDataset.read(danglingIndex, MAPPER))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("missing row 3");
        assertThatThrownBy(() -> IndexedBlobDataset.read(notJson, MAPPER)).isInstanceOf(IOException.class);
    }

    @Test
    void decompressionFallsBackToRawBytes() throws IOException {
        final var raw = "{}".getBytes(StandardCharsets.UTF_8);

        assertThat(IndexedBlobDataset.decompressIfGzipped(raw)).isEqualTo(raw);
        assertThat(IndexedBlobDataset.decompressIfGzipped(new byte[0])).isEmpty();
    }
}
