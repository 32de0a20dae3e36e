package org.argus.source;

import com.google.common.util.concurrent.Uninterruptibles;
import org.junit.jupiter.api.Test;

import java.net.UnknownHostException;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ReverseDnsResolverTest {
    private static final int THREADS = ReverseDnsResolver.MAX_LOOKUP_THREADS;

    @Test
    void reducesHostnamesToTheirRegistrableDomain() {
        try (var resolver = new ReverseDnsResolver(Duration.ofSeconds(1), true, THREADS, address -> "mail-01.example.co.uk.")) {
            assertThat(resolver.resolve("203.0.113.10")).contains("example.co.uk");
        }
    }

    @Test
    void keepsFullHostnameWhenApexReductionIsOff() {
        try (var resolver = new ReverseDnsResolver(Duration.ofSeconds(1), false, THREADS, address -> "dns.google.")) {
            assertThat(resolver.resolve("8.8.8.8")).contains("dns.google");
        }
    }

    @Test
    void unresolvedAddressesYieldNothing() {
        try (var echo = new ReverseDnsResolver(Duration.ofSeconds(1), true, THREADS, address -> address);
             var failing = new ReverseDnsResolver(Duration.ofSeconds(1), true, THREADS, address -> {
                 throw new UnknownHostException(address);
             })) {
            assertThat(echo.resolve("203.0.113.10")).isEmpty();
            assertThat(failing.resolve("203.0.113.10")).isEmpty();
        }
    }

    @Test
    void slowLookupsAreAbandonedAfterTheTimeout() {
        final var release = new CountDownLatch(1);
        try (var resolver = new ReverseDnsResolver(Duration.ofMillis(50), true, THREADS, address -> {
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
            return "late.example.com";
        })) {
            final var started = System.nanoTime();

            assertThat(resolver.resolve("203.0.113.10")).isEmpty();
            assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(5));
        } finally {
            release.countDown();
        }
    }

    @Test
    void stuckLookupsNeverHoldMoreThanTheThreadLimit() {
        final var release = new CountDownLatch(1);
        try (var resolver = new ReverseDnsResolver(Duration.ofMillis(5), true, 4, address -> {
            Uninterruptibles.awaitUninterruptibly(release, 10, TimeUnit.SECONDS);
            return "late.example.com";
        })) {
            for (var i = 0; i < 40; i++) {
                assertThat(resolver.resolve("203.0.113." + i)).isEmpty();
                assertThat(resolver.lookupThreads()).isLessThanOrEqualTo(4);
            }
            assertThat(resolver.lookupThreads()).isEqualTo(4);
        } finally {
            release.countDown();
        }
    }

    @Test
    void apexLeavesNamesOutsideThePublicSuffixListAlone() {
        assertThat(ReverseDnsResolver.apex("www.example.com")).isEqualTo("example.com");
        assertThat(ReverseDnsResolver.apex("example.com.")).isEqualTo("example.com");
        assertThat(ReverseDnsResolver.apex("localhost")).isEqualTo("localhost");
        assertThat(ReverseDnsResolver.apex("host.internal-lan")).isEqualTo("host.internal-lan");
    }
}
