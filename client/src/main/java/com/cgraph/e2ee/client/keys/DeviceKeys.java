package com.cgraph.e2ee.client.keys;

/**
 * The persistent part of a {@link KeyBundle}: what the device keeps after its
 * one-time prekeys have been published.
 */
public record DeviceKeys(String deviceId, IdentityKeyPair identityKey, SignedPreKey signedPreKey) {

    public static DeviceKeys of(KeyBundle bundle) {
        return new DeviceKeys(bundle.deviceId(), bundle.identityKey(), bundle.signedPreKey());
    }
}
