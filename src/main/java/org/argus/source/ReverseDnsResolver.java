package org.argus.source;

import com.google.common.net.InternetDomainName;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Best-effort PTR lookup. Each lookup runs as its own task and is abandoned once the timeout passes,
 * so a slow resolver costs one address its domain instead of stalling the batch. An abandoned native
 * lookup keeps its thread until the resolver gives up, so at most {@link #MAX_LOOKUP_THREADS} run at
 * once; while all of them are busy further addresses get no domain.
 */
public final class ReverseDnsResolver implements HostnameResolver {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(1);
    static final int MAX_LOOKUP_THREADS = 8;

    private final Duration timeout;
    private final boolean apexOnly;
    private final PtrLookup lookup;
    private final ThreadPoolExecutor executor;

    public ReverseDnsResolver(Duration timeout, boolean apexOnly) {
        this(timeout, apexOnly, MAX_LOOKUP_THREADS, address -> InetAddress.getByName(address).getCanonicalHostName());
    }

    ReverseDnsResolver(Duration timeout, boolean apexOnly, int maxThreads, PtrLookup lookup) {
        this.timeout = timeout;
        this.apexOnly = apexOnly;
        this.lookup = lookup;
        this.executor = new ThreadPoolExecutor(0, maxThreads, 30, TimeUnit.SECONDS, new SynchronousQueue<>(),
                new ThreadFactoryBuilder()
                        .setNameFormat("reverse-dns-%d")
                        .setDaemon(true)
                        .build(),
                new ThreadPoolExecutor.AbortPolicy());
    }

    @Override
    public Optional<String> resolve(String address) {
        final Future<String> task;
        try {
            task = executor.submit(() -> lookup.hostname(address));
        } catch (RejectedExecutionException saturated) {
            return Optional.empty();
        }
        try {
            final var hostname = task.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (hostname == null || hostname.isBlank() || hostname.equals(address)) return Optional.empty();
            return Optional.of(apexOnly ? apex(hostname) : stripDot(hostname));
        } catch (TimeoutException ex) {
            task.cancel(true);
            return Optional.empty();
        } catch (InterruptedException ex) {
            task.cancel(true);
            Thread.currentThread().interrupt();
            return Optional.empty();
        } catch (ExecutionException ex) {
            return Optional.empty();
        }
    }

    /**
     * Registrable root of a hostname ({@code www.example.co.uk -> example.co.uk}); hostnames outside
     * the public suffix list come back unchanged.
     */
    static String apex(String hostname) {
        final var host = stripDot(hostname);
        if (!InternetDomainName.isValid(host)) return host;
        final var domain = InternetDomainName.from(host);
        if (!domain.isUnderPublicSuffix()) return host;
        return domain.topPrivateDomain().toString();
    }

    private static String stripDot(String hostname) {
        return hostname.endsWith(".") ? hostname.substring(0, hostname.length() - 1) : hostname;
    }

    int lookupThreads() {
        return executor.getPoolSize();
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    @FunctionalInterface
    interface PtrLookup {
        String hostname(String address) throws UnknownHostException;
    }
}
