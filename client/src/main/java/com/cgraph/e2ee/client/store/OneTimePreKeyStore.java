package com.cgraph.e2ee.client.store;

import com.cgraph.e2ee.client.crypto.Curve25519;
import com.cgraph.e2ee.client.error.SetupException;
import com.cgraph.e2ee.client.keys.OneTimePreKey;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.bouncycastle.crypto.params.X25519PrivateKeyParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Private halves of this device's published one-time prekeys, by key id.
 *
 * <p>The directory alone decides which key is handed to which sender. The device
 * only keeps the private half long enough to answer the one exchange that uses
 * it: {@link #consume} removes it, so a replayed message cannot reuse it.
 *
 * <p>Keys the directory handed out but no message ever used would otherwise stay
 * forever. Every write drops halves older than the retention period, then the
 * oldest ones beyond the capacity.
 */
public class OneTimePreKeyStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(OneTimePreKeyStore.class);

    static final String STORAGE_KEY = "cgraph_e2ee_one_time_prekeys";

    public static final Duration DEFAULT_RETENTION = Duration.ofDays(30);
    public static final int DEFAULT_CAPACITY = 1000;

    private static final TypeReference<LinkedHashMap<String, StoredPreKey>> MAP_TYPE = new TypeReference<>() {
    };

    /** One stored private half and when it was stored, in epoch millis. */
    record StoredPreKey(@JsonProperty("private_key") String privateKey,
                        @JsonProperty("created_at") long createdAt) {
    }

    private final SecureStorage storage;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final Duration retention;
    private final int capacity;
    private final Object lock = new Object();

    public OneTimePreKeyStore(SecureStorage storage, ObjectMapper mapper) {
        this(storage, mapper, Clock.systemUTC(), DEFAULT_RETENTION, DEFAULT_CAPACITY);
    }

    public OneTimePreKeyStore(SecureStorage storage, ObjectMapper mapper,
                              Clock clock, Duration retention, int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.storage = storage;
        this.mapper = mapper;
        this.clock = clock;
        this.retention = retention;
        this.capacity = capacity;
    }

    public Mono<Void> addAll(List<OneTimePreKey> prekeys) {
        return Mono.<Void>fromRunnable(() -> addAllBlocking(prekeys))
                .subscribeOn(Schedulers.boundedElastic());
    }

    /** Takes back halves whose public keys never reached the directory. */
    public Mono<Void> removeAll(List<OneTimePreKey> prekeys) {
        return Mono.<Void>fromRunnable(() -> removeBlocking(prekeys))
                .subscribeOn(Schedulers.boundedElastic());
    }

    /** Looks a private half up without using it up. */
    public Mono<X25519PrivateKeyParameters> find(String keyId) {
        return Mono.fromCallable(() -> {
            synchronized (lock) {
                StoredPreKey stored = read().get(keyId);
                return stored == null ? null : Curve25519.decodePrivateKey(stored.privateKey());
            }
        }).subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * Removes a private half. Emits it if this call removed it, completes empty if
     * it was already gone.
     */
    public Mono<X25519PrivateKeyParameters> consume(String keyId) {
        return Mono.fromCallable(() -> {
            synchronized (lock) {
                Map<String, StoredPreKey> keys = read();
                StoredPreKey stored = keys.remove(keyId);
                if (stored == null) {
                    return null;
                }
                write(keys);
                return Curve25519.decodePrivateKey(stored.privateKey());
            }
        }).subscribeOn(Schedulers.boundedElastic());
    }

    public Mono<Integer> size() {
        return Mono.fromCallable(() -> {
            synchronized (lock) {
                return read().size();
            }
        }).subscribeOn(Schedulers.boundedElastic());
    }

    void addAllBlocking(List<OneTimePreKey> prekeys) {
        synchronized (lock) {
            Map<String, StoredPreKey> keys = read();
            long now = clock.millis();
            for (OneTimePreKey prekey : prekeys) {
                keys.put(prekey.keyId(), new StoredPreKey(Curve25519.encodePrivateKey(prekey.privateKey()), now));
            }
            prune(keys, now);
            write(keys);
        }
    }

    void clearBlocking() {
        synchronized (lock) {
            storage.delete(STORAGE_KEY);
        }
    }

    void removeBlocking(List<OneTimePreKey> prekeys) {
        synchronized (lock) {
            Map<String, StoredPreKey> keys = read();
            boolean removed = false;
            for (OneTimePreKey prekey : prekeys) {
                removed |= keys.remove(prekey.keyId()) != null;
            }
            if (removed) {
                write(keys);
            }
        }
    }

    // Insertion order is storage order, so the map iterates oldest first.
    private void prune(Map<String, StoredPreKey> keys, long now) {
        long cutoff = now - retention.toMillis();
        int before = keys.size();
        keys.values().removeIf(stored -> stored.createdAt() < cutoff);
        Iterator<StoredPreKey> oldest = keys.values().iterator();
        while (keys.size() > capacity && oldest.hasNext()) {
            oldest.next();
            oldest.remove();
        }
        if (keys.size() < before) {
            LOGGER.info("Dropped {} stale one-time prekey private halves", before - keys.size());
        }
    }

    private Map<String, StoredPreKey> read() {
        return storage.get(STORAGE_KEY).map(json -> {
            try {
                Map<String, StoredPreKey> keys = mapper.readValue(json, MAP_TYPE);
                return keys;
            } catch (JsonProcessingException e) {
                throw new SetupException("Stored one-time prekeys are unreadable", e);
            }
        }).orElseGet(LinkedHashMap::new);
    }

    private void write(Map<String, StoredPreKey> keys) {
        if (keys.isEmpty()) {
            storage.delete(STORAGE_KEY);
            return;
        }
        try {
            storage.put(STORAGE_KEY, mapper.writeValueAsString(keys));
        } catch (JsonProcessingException e) {
            throw new SetupException("Could not serialize one-time prekeys", e);
        }
    }
}
