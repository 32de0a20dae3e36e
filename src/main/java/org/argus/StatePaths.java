package org.argus;

import java.nio.file.Files;
import java.nio.file.Path;

public final class StatePaths {
    private final Path baseDir;

    public StatePaths(Path baseDir) {
        this.baseDir = baseDir;
    }

    public Path baseDir() {
        return baseDir;
    }

    public Path configFile() {
        return baseDir.resolve("argus.conf");
    }

    public Path cityDatabase() {
        return baseDir.resolve("GeoLite2-City.mmdb");
    }

    public Path asnDatabase() {
        return baseDir.resolve("GeoLite2-ASN.mmdb");
    }

    public Path proxyDatabase() {
        return baseDir.resolve("IP2PROXY-LITE-PX11.CSV");
    }

    public Path attributionDir() {
        return baseDir.resolve("org");
    }

    public void ensureDirectories() {
        try {
            Files.createDirectories(baseDir);
            Files.createDirectories(attributionDir());
        } catch (Exception ex) {
            throw new IllegalStateException("Unable to initialize data directories under " + baseDir, ex);
        }
    }
}
