package com.cgraph.e2ee.client.device;

import com.cgraph.e2ee.client.error.NotInitializedException;
import com.cgraph.e2ee.client.keys.DeviceKeys;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/** The key material the session is currently operating with, if any. */
public class ActiveDevice {

    private final AtomicReference<DeviceKeys> keys = new AtomicReference<>();

    public Optional<DeviceKeys> current() {
        return Optional.ofNullable(keys.get());
    }

    public DeviceKeys require() {
        DeviceKeys current = keys.get();
        if (current == null) {
            throw new NotInitializedException();
        }
        return current;
    }

    public void activate(DeviceKeys deviceKeys) {
        keys.set(deviceKeys);
    }

    public void deactivate() {
        keys.set(null);
    }

    public boolean isInitialized() {
        return keys.get() != null;
    }

    public boolean isActive(String deviceId) {
        DeviceKeys current = keys.get();
        return current != null && current.deviceId().equals(deviceId);
    }
}
