package org.argus.attribution;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.ByteArrayInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.zip.GZIPInputStream;
import java.util.zip.ZipException;

/**
 * Row list plus per-field value indexes, serialized as one JSON document and optionally gzipped:
 * <pre>
 * {"rows": [{"ip": "203.0.113.7", "org_id": "acme", "platform": "aws"}],
 *  "indexes": {"ip": {"203.0.113.7": 0}}}
 * </pre>
 * An index value is either a single row position or an array of positions. When an address maps to
 * several rows the lowest position wins.
 */
public final class IndexedBlobDataset implements AttributionDataset {
    private static final List<String> ADDRESS_FIELDS = List.of("ip", "address");
    private static final List<String> ORG_ID_FIELDS = List.of("org_id", "cfa_id");

    private final String name;
    private final List<Map<String, String>> rows;
    private final Map<String, Map<String, int[]>> indexes;

    IndexedBlobDataset(String name, List<Map<String, String>> rows, Map<String, Map<String, int[]>> indexes) {
        this.name = name;
        this.rows = rows;
        this.indexes = indexes;
    }

    public static IndexedBlobDataset read(Path file, ObjectMapper mapper) throws IOException {
        final var root = mapper.readTree(decompressIfGzipped(Files.readAllBytes(file)));
        if (root == null || !root.path("rows").isArray() || !root.path("indexes").isObject()) {
            throw new IOException("Dataset " + file + " is missing its rows or indexes");
        }
        final var rows = readRows(root.path("rows"));
        final var indexes = readIndexes(root.path("indexes"), rows.size(), file);
        return new IndexedBlobDataset(datasetName(file), List.copyOf(rows), indexes);
    }

    static byte[] decompressIfGzipped(byte[] raw) throws IOException {
        try (var in = new GZIPInputStream(new ByteArrayInputStream(raw))) {
            return in.readAllBytes();
        } catch (ZipException | EOFException notGzip) {
            return raw;
        }
    }

    @Override
    public String name() {
        return name;
    }

    public int size() {
        return rows.size();
    }

    @Override
    public Optional<Attribution> lookup(String address) {
        for (var field : ADDRESS_FIELDS) {
            final var index = indexes.get(field);
            if (index == null) continue;
            return firstRow(index.get(address)).map(row ->
                    new Attribution(firstPresent(row, ORG_ID_FIELDS), row.get("platform"), name));
        }
        return Optional.empty();
    }

    private Optional<Map<String, String>> firstRow(int[] positions) {
        if (positions == null || positions.length == 0) return Optional.empty();
        return Optional.of(rows.get(positions[0]));
    }

    private static List<Map<String, String>> readRows(JsonNode rowsNode) {
        final var rows = new ArrayList<Map<String, String>>(rowsNode.size());
        for (var rowNode : rowsNode) {
            final var row = new LinkedHashMap<String, String>();
            rowNode.fields().forEachRemaining(field -> {
                if (!field.getValue().isNull()) row.put(field.getKey(), field.getValue().asText());
            });
            rows.add(Map.copyOf(row));
        }
        return rows;
    }

    private static Map<String, Map<String, int[]>> readIndexes(JsonNode indexesNode, int rowCount, Path file)
            throws IOException {
        final var indexes = new HashMap<String, Map<String, int[]>>();
        final var fields = indexesNode.fields();
        while (fields.hasNext()) {
            final var field = fields.next();
            final var byValue = new HashMap<String, int[]>();
            final var entries = field.getValue().fields();
            while (entries.hasNext()) {
                final var entry = entries.next();
                final var positions = positions(entry.getValue());
                for (var position : positions) {
                    if (position < 0 || position >= rowCount) {
                        throw new IOException("Dataset " + file + " index '" + field.getKey()
                                + "' points at missing row " + position);
                    }
                }
                byValue.put(entry.getKey(), positions);
            }
            indexes.put(field.getKey(), Map.copyOf(byValue));
        }
        return Map.copyOf(indexes);
    }

    private static int[] positions(JsonNode node) {
        if (node.isIntegralNumber()) return new int[]{node.asInt()};
        final var values = new int[node.size()];
        var i = 0;
        for (var element : node) values[i++] = element.asInt(-1);
        Arrays.sort(values);
        return values;
    }

    private static String firstPresent(Map<String, String> row, List<String> candidates) {
        for (var key : candidates) {
            final var value = row.get(key);
            if (value != null) return value;
        }
        return null;
    }

    static String datasetName(Path file) {
        final var fileName = file.getFileName().toString();
        final var dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
