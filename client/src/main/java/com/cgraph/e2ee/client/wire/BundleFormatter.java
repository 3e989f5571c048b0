package com.cgraph.e2ee.client.wire;

import com.cgraph.e2ee.client.crypto.Curve25519;
import com.cgraph.e2ee.client.crypto.PreKeySigner;
import com.cgraph.e2ee.client.keys.IdentityKeyPair;
import com.cgraph.e2ee.client.keys.KeyBundle;
import com.cgraph.e2ee.client.keys.OneTimePreKey;
import com.cgraph.e2ee.client.keys.SignedPreKey;

import java.util.Base64;
import java.util.List;

/**
 * Builds the directory payloads from local key material.
 *
 * Only public halves are read here; the payload types have no field that could
 * hold a private key.
 */
public final class BundleFormatter {

    private BundleFormatter() {
    }

    public static RegistrationPayload formatForRegistration(KeyBundle bundle) {
        IdentityKeyPair identity = bundle.identityKey();
        SignedPreKey signedPreKey = bundle.signedPreKey();
        return new RegistrationPayload(
                Curve25519.encodePublicKey(identity.publicKey()),
                identity.keyId(),
                bundle.deviceId(),
                PreKeySigner.encodePublicKey(identity.signingPublicKey()),
                new SignedPreKeyPayload(
                        Curve25519.encodePublicKey(signedPreKey.publicKey()),
                        Base64.getEncoder().encodeToString(signedPreKey.signature()),
                        signedPreKey.keyId()),
                toPayloads(bundle.oneTimePreKeys()));
    }

    public static PreKeyUpload formatForUpload(List<OneTimePreKey> prekeys) {
        return new PreKeyUpload(toPayloads(prekeys));
    }

    private static List<PreKeyPayload> toPayloads(List<OneTimePreKey> prekeys) {
        return prekeys.stream()
                .map(prekey -> new PreKeyPayload(prekey.keyId(), Curve25519.encodePublicKey(prekey.publicKey())))
                .toList();
    }
}
