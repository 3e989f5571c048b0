package com.cgraph.e2ee.client.store;

import com.cgraph.e2ee.client.error.SetupException;
import com.cgraph.e2ee.client.keys.DeviceKeys;
import com.cgraph.e2ee.client.keys.KeyBundle;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Persists this device's key material in {@link SecureStorage}.
 *
 * <p>Identity pair, signing pair, signed prekey, signature and device id are one
 * JSON record written by a single {@code putIfAbsent}; a second setup racing the
 * first finds the record present and fails instead of overwriting it. One-time
 * prekey private halves live in the companion {@link OneTimePreKeyStore}.
 */
public class LocalKeyStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(LocalKeyStore.class);

    static final String BUNDLE_KEY = "cgraph_e2ee_bundle";

    private final SecureStorage storage;
    private final ObjectMapper mapper;
    private final OneTimePreKeyStore oneTimePreKeys;
    private final Object lock = new Object();

    public LocalKeyStore(SecureStorage storage, ObjectMapper mapper) {
        this(storage, mapper, new OneTimePreKeyStore(storage, mapper));
    }

    public LocalKeyStore(SecureStorage storage, ObjectMapper mapper, OneTimePreKeyStore oneTimePreKeys) {
        this.storage = storage;
        this.mapper = mapper;
        this.oneTimePreKeys = oneTimePreKeys;
    }

    public OneTimePreKeyStore oneTimePreKeys() {
        return oneTimePreKeys;
    }

    /**
     * Saves a freshly generated bundle. Fails with {@link SetupException} when
     * material already exists or storage fails; in both cases nothing from this
     * bundle is left behind.
     */
    public Mono<Void> save(KeyBundle bundle) {
        return Mono.<Void>fromRunnable(() -> {
            synchronized (lock) {
                String record = serialize(StoredKeyMaterial.from(DeviceKeys.of(bundle)));
                boolean written;
                try {
                    written = storage.putIfAbsent(BUNDLE_KEY, record);
                } catch (RuntimeException e) {
                    throw new SetupException("Could not persist key bundle", e);
                }
                if (!written) {
                    throw new SetupException("Key material already exists on this device");
                }
                try {
                    oneTimePreKeys.addAllBlocking(bundle.oneTimePreKeys());
                } catch (RuntimeException e) {
                    rollback(bundle);
                    throw new SetupException("Could not persist one-time prekeys", e);
                }
                LOGGER.info("Stored key material for device {}", bundle.deviceId());
            }
        }).subscribeOn(Schedulers.boundedElastic());
    }

    /** Completes empty when this device has never been set up. */
    public Mono<DeviceKeys> load() {
        return Mono.fromCallable(() -> storage.get(BUNDLE_KEY)
                        .map(this::deserialize)
                        .map(StoredKeyMaterial::toDeviceKeys)
                        .orElse(null))
                .subscribeOn(Schedulers.boundedElastic());
    }

    public Mono<Boolean> exists() {
        return Mono.fromCallable(() -> storage.get(BUNDLE_KEY).isPresent())
                .subscribeOn(Schedulers.boundedElastic());
    }

    /** Erases the key record and every one-time private half. */
    public Mono<Void> clear() {
        return Mono.<Void>fromRunnable(() -> {
            synchronized (lock) {
                storage.delete(BUNDLE_KEY);
                oneTimePreKeys.clearBlocking();
                LOGGER.info("Cleared local key material");
            }
        }).subscribeOn(Schedulers.boundedElastic());
    }

    private void rollback(KeyBundle bundle) {
        try {
            oneTimePreKeys.removeBlocking(bundle.oneTimePreKeys());
        } catch (RuntimeException e) {
            LOGGER.warn("Could not remove one-time prekeys of failed setup for device {}", bundle.deviceId(), e);
        }
        storage.delete(BUNDLE_KEY);
    }

    private String serialize(StoredKeyMaterial material) {
        try {
            return mapper.writeValueAsString(material);
        } catch (JsonProcessingException e) {
            throw new SetupException("Could not serialize key material", e);
        }
    }

    private StoredKeyMaterial deserialize(String json) {
        try {
            return mapper.readValue(json, StoredKeyMaterial.class);
        } catch (JsonProcessingException e) {
            throw new SetupException("Stored key material is unreadable", e);
        }
    }
}
