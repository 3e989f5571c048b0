package com.cgraph.e2ee.client.device;

import com.cgraph.e2ee.client.directory.KeyDirectoryClient;
import com.cgraph.e2ee.client.directory.PrekeyBundleCache;
import com.cgraph.e2ee.client.error.RevocationException;
import com.cgraph.e2ee.client.store.LocalKeyStore;
import com.cgraph.e2ee.client.wire.DeviceInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Lists and revokes the user's devices.
 *
 * Revoking the device this session runs on also stops replenishment and wipes
 * the local keys, in that order, so no upload can race the wipe.
 */
public class DeviceLifecycleManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(DeviceLifecycleManager.class);

    private final KeyDirectoryClient directory;
    private final LocalKeyStore keyStore;
    private final PrekeyReplenisher replenisher;
    private final PrekeyBundleCache bundleCache;
    private final ActiveDevice activeDevice;

    public DeviceLifecycleManager(KeyDirectoryClient directory,
                                  LocalKeyStore keyStore,
                                  PrekeyReplenisher replenisher,
                                  PrekeyBundleCache bundleCache,
                                  ActiveDevice activeDevice) {
        this.directory = directory;
        this.keyStore = keyStore;
        this.replenisher = replenisher;
        this.bundleCache = bundleCache;
        this.activeDevice = activeDevice;
    }

    public Flux<DeviceInfo> listDevices() {
        return directory.listDevices()
                .onErrorMap(e -> new RevocationException("Could not list devices", e));
    }

    public Mono<Void> revokeDevice(String deviceId) {
        return directory.revokeDevice(deviceId)
                .onErrorMap(e -> new RevocationException("Could not revoke device " + deviceId, e))
                .then(Mono.defer(() -> {
                    LOGGER.info("Revoked device {}", deviceId);
                    return activeDevice.isActive(deviceId) ? wipeLocalDevice() : Mono.empty();
                }));
    }

    /** Stops replenishment, forgets the active keys and clears local storage. */
    public Mono<Void> wipeLocalDevice() {
        return Mono.defer(() -> {
            replenisher.stop();
            activeDevice.deactivate();
            bundleCache.clear();
            return keyStore.clear();
        }).onErrorMap(e -> new RevocationException("Could not wipe local key material", e));
    }
}
