package org.argus.output;

import java.util.Locale;

public enum OutputFormat {
    JSON("json"),
    CSV("csv");

    private final String extension;

    OutputFormat(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }

    public static OutputFormat fromName(String name) {
        if (name == null || name.isBlank()) return JSON;
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "json" -> JSON;
            case "csv" -> CSV;
            default -> throw new IllegalArgumentException("Output format must be one of: json, csv");
        };
    }
}
