package org.argus;

import java.time.Duration;

public record Config(boolean reverseDns, Duration reverseDnsTimeout, boolean apexDomains, String defaultSort,
                     String defaultFormat) {
    private static final Duration DEFAULT_DNS_TIMEOUT = Duration.ofSeconds(1);

    public static Config defaultConfig() {
        return new Config(false, DEFAULT_DNS_TIMEOUT, true, "ip", "json");
    }
}
