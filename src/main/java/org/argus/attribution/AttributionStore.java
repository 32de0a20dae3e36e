package org.argus.attribution;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.argus.EnrichmentListener;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Every attribution dataset found in a directory, consulted in file-name order. The first dataset
 * that knows an address answers; later ones are not asked.
 */
public final class AttributionStore implements AutoCloseable {
    private final ObjectMapper mapper;
    private final EnrichmentListener listener;
    private final List<AttributionDataset> datasets = new ArrayList<>();

    public AttributionStore(ObjectMapper mapper, EnrichmentListener listener) {
        this.mapper = mapper;
        this.listener = listener;
    }

    public static AttributionStore of(AttributionDataset... datasets) {
        final var store = new AttributionStore(null, EnrichmentListener.NONE);
        store.datasets.addAll(List.of(datasets));
        return store;
    }

    /**
     * Loads every {@code .bin}, {@code .db} and {@code .sqlite} file in {@code directory}. A file that
     * fails to load is reported to the listener and skipped.
     *
     * @return whether at least one dataset is available
     */
    public boolean load(Path directory) {
        close();
        if (directory == null || !Files.isDirectory(directory)) return false;
        final List<Path> files;
        try (var stream = Files.list(directory)) {
            files = stream.filter(Files::isRegularFile)
                    .filter(file -> kind(file) != Kind.UNSUPPORTED)
                    .sorted(Comparator.comparing(file -> file.getFileName().toString()))
                    .toList();
        } catch (IOException ex) {
            listener.onDatasetSkipped(directory, "directory unreadable: " + ex.getMessage());
            return false;
        }
        for (var file : files) {
            try {
                datasets.add(open(file));
            } catch (IOException | RuntimeException ex) {
                listener.onDatasetSkipped(file, ex.getMessage());
            }
        }
        if (hasData()) listener.onAttributionLoaded(datasets.size(), datasetNames());
        return hasData();
    }

    public boolean hasData() {
        return !datasets.isEmpty();
    }

    public List<String> datasetNames() {
        return datasets.stream().map(AttributionDataset::name).toList();
    }

    public Optional<Attribution> lookup(String address) {
        for (var dataset : datasets) {
            final var hit = dataset.lookup(address);
            if (hit.isPresent()) return hit;
        }
        return Optional.empty();
    }

    @Override
    public void close() {
        datasets.forEach(AttributionDataset::close);
        datasets.clear();
    }

    private AttributionDataset open(Path file) throws IOException {
        return switch (kind(file)) {
            case BLOB -> IndexedBlobDataset.read(file, mapper);
            case SQLITE -> SqliteDataset.open(file);
            case UNSUPPORTED -> throw new IOException("Unsupported dataset file " + file);
        };
    }

    private static Kind kind(Path file) {
        final var fileName = file.getFileName().toString().toLowerCase(Locale.ROOT);
        if (fileName.endsWith(".bin")) return Kind.BLOB;
        if (fileName.endsWith(".db") || fileName.endsWith(".sqlite")) return Kind.SQLITE;
        return Kind.UNSUPPORTED;
    }

    private enum Kind {
        BLOB, SQLITE, UNSUPPORTED
    }
}
