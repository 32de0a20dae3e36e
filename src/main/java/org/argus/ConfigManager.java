package org.argus;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

public final class ConfigManager {
    private final Path configFile;

    public ConfigManager(Path configFile) {
        this.configFile = configFile;
    }

    public Config loadOrCreate() {
        final var defaults = Config.defaultConfig();
        if (!Files.exists(configFile)) {
            write(defaults);
            return defaults;
        }
        try {
            final var values = parse(Files.readAllLines(configFile, StandardCharsets.UTF_8));
            final var reverseDns = parseBoolean(values.get("reverseDns"), defaults.reverseDns());
            final var timeoutMillis = parseLong(values.get("reverseDnsTimeoutMillis"),
                    defaults.reverseDnsTimeout().toMillis());
            final var apexDomains = parseBoolean(values.get("apexDomains"), defaults.apexDomains());
            final var sort = values.getOrDefault("defaultSort", defaults.defaultSort());
            final var format = values.getOrDefault("defaultFormat", defaults.defaultFormat());
            return new Config(reverseDns, Duration.ofMillis(Math.max(1, timeoutMillis)), apexDomains, sort, format);
        } catch (IOException ex) {
            System.err.println("Failed to read " + configFile + "; using defaults. " + ex.getMessage());
            return defaults;
        }
    }

    private Map<String, String> parse(Iterable<String> lines) {
        final var map = new HashMap<String, String>();
        for (final var line : lines) {
            if (line == null) continue;
            final var trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) continue;
            final var parts = trimmed.split("=", 2);
            if (parts.length == 2) map.put(parts[0].trim(), parts[1].trim());
        }
        return map;
    }

    private long parseLong(String value, long fallback) {
        if (value == null || value.isBlank()) return fallback;
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }

    private boolean parseBoolean(String value, boolean fallback) {
        if (value == null || value.isBlank()) return fallback;
        return switch (value.trim().toLowerCase()) {
            case "true", "yes", "on", "1" -> true;
            case "false", "no", "off", "0" -> false;
            default -> fallback;
        };
    }

    private void write(Config config) {
        var content = """
                # argus.conf
                reverseDns=%s
                reverseDnsTimeoutMillis=%d
                apexDomains=%s
                defaultSort=%s
                defaultFormat=%s
                """.formatted(config.reverseDns(), config.reverseDnsTimeout().toMillis(), config.apexDomains(),
                config.defaultSort(), config.defaultFormat());
        try {
            Files.writeString(configFile, content, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to write config to " + configFile, ex);
        }
    }
}
