package org.argus;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class ConfigManagerTest {
    @TempDir
    Path tempDir;

    @Test
    void writesDefaultsWhenMissing() throws Exception {
        final var file = tempDir.resolve("argus.conf");

        final var config = new ConfigManager(file).loadOrCreate();

        assertThat(config).isEqualTo(Config.defaultConfig());
        assertThat(Files.readString(file)).contains("reverseDns=false").contains("defaultSort=ip");
        assertThat(new ConfigManager(file).loadOrCreate()).isEqualTo(config);
    }

    @Test
    void readsOverridesAndKeepsDefaultsForGarbage() throws Exception {
        final var file = Files.writeString(tempDir.resolve("argus.conf"), """
                # local overrides
                reverseDns=yes
                reverseDnsTimeoutMillis=250
                apexDomains=maybe
                defaultSort=asn
                unknownKey=whatever
                """);

        final var config = new ConfigManager(file).loadOrCreate();

        assertThat(config.reverseDns()).isTrue();
        assertThat(config.reverseDnsTimeout()).isEqualTo(Duration.ofMillis(250));
        assertThat(config.apexDomains()).isTrue();
        assertThat(config.defaultSort()).isEqualTo("asn");
        assertThat(config.defaultFormat()).isEqualTo("json");
    }

    @Test
    void nonPositiveTimeoutIsClamped() throws Exception {
        final var file = Files.writeString(tempDir.resolve("argus.conf"), "reverseDnsTimeoutMillis=-5\n");

        assertThat(new ConfigManager(file).loadOrCreate().reverseDnsTimeout()).isEqualTo(Duration.ofMillis(1));
    }
}
