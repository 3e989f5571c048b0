package com.cgraph.e2ee.client.directory;

import com.cgraph.e2ee.client.error.DirectoryException;
import com.cgraph.e2ee.client.wire.ServerPrekeyBundle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Short-lived cache of recipients' prekey bundles.
 *
 * <p>Cached copies never carry a one-time prekey. Those are single-use, so
 * {@link #acquireForEncryption} always asks the directory for a fresh one and
 * only settles for a cached copy, without DH4, when the directory is unreachable.
 */
public class PrekeyBundleCache {

    private static final Logger LOGGER = LoggerFactory.getLogger(PrekeyBundleCache.class);

    public static final Duration DEFAULT_TTL = Duration.ofMinutes(5);

    private final KeyDirectoryClient directory;
    private final Clock clock;
    private final Duration ttl;
    private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();

    public PrekeyBundleCache(KeyDirectoryClient directory, Clock clock, Duration ttl) {
        this.directory = directory;
        this.clock = clock;
        this.ttl = ttl;
    }

    /**
     * Serves the cached bundle while it is younger than the TTL, otherwise
     * fetches and caches it. The result has no one-time prekey.
     */
    public Mono<ServerPrekeyBundle> getRecipientBundle(String userId) {
        return Mono.defer(() -> {
            ServerPrekeyBundle cached = fresh(userId);
            if (cached != null) {
                return Mono.just(cached);
            }
            return fetch(userId).map(ServerPrekeyBundle::withoutOneTimePreKey);
        });
    }

    /** A bundle for a new exchange, normally straight from the directory. */
    public Mono<ServerPrekeyBundle> acquireForEncryption(String userId) {
        return fetch(userId).onErrorResume(DirectoryException.class, e -> {
            ServerPrekeyBundle cached = e.isRetryable() ? fresh(userId) : null;
            if (cached == null) {
                return Mono.error(e);
            }
            LOGGER.warn("Directory unreachable, encrypting to {} without a one-time prekey", userId);
            return Mono.just(cached);
        });
    }

    public void evict(String userId) {
        entries.remove(userId);
    }

    public void clear() {
        entries.clear();
    }

    private Mono<ServerPrekeyBundle> fetch(String userId) {
        return directory.fetchBundle(userId)
                .doOnNext(bundle -> entries.put(userId,
                        new Entry(bundle.withoutOneTimePreKey(), clock.instant())));
    }

    private ServerPrekeyBundle fresh(String userId) {
        Entry entry = entries.get(userId);
        if (entry == null) {
            return null;
        }
        if (Duration.between(entry.fetchedAt(), clock.instant()).compareTo(ttl) >= 0) {
            entries.remove(userId, entry);
            return null;
        }
        return entry.bundle();
    }

    private record Entry(ServerPrekeyBundle bundle, Instant fetchedAt) {
    }
}
