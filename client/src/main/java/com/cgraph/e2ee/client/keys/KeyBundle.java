package com.cgraph.e2ee.client.keys;

import java.util.List;

/**
 * Everything {@link KeyBundleGenerator#generateKeyBundle} produces for one device.
 *
 * <p>Each generated bundle is new material. Replacing the bundle of a device that
 * already has conversations makes every message sealed against the old keys
 * undecryptable, so callers discard the old one explicitly before generating again.
 */
public record KeyBundle(
        String deviceId,
        IdentityKeyPair identityKey,
        SignedPreKey signedPreKey,
        List<OneTimePreKey> oneTimePreKeys
) {

    public KeyBundle {
        oneTimePreKeys = List.copyOf(oneTimePreKeys);
    }
}
