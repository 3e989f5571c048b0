package com.cgraph.e2ee.client.store;

import com.cgraph.e2ee.client.crypto.Curve25519;
import com.cgraph.e2ee.client.crypto.PreKeySigner;
import com.cgraph.e2ee.client.keys.DeviceKeys;
import com.cgraph.e2ee.client.keys.IdentityKeyPair;
import com.cgraph.e2ee.client.keys.SignedPreKey;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Base64;

/**
 * The single persisted record behind {@link LocalKeyStore}. Written in one
 * storage call so the identity, signed prekey and device id can never be
 * observed half-saved.
 */
record StoredKeyMaterial(
        @JsonProperty("device_id") String deviceId,
        @JsonProperty("identity_key_id") String identityKeyId,
        @JsonProperty("identity_public") String identityPublic,
        @JsonProperty("identity_private") String identityPrivate,
        @JsonProperty("signing_public") String signingPublic,
        @JsonProperty("signing_private") String signingPrivate,
        @JsonProperty("signed_prekey_id") String signedPreKeyId,
        @JsonProperty("signed_prekey_public") String signedPreKeyPublic,
        @JsonProperty("signed_prekey_private") String signedPreKeyPrivate,
        @JsonProperty("signed_prekey_signature") String signedPreKeySignature
) {

    static StoredKeyMaterial from(DeviceKeys keys) {
        IdentityKeyPair identity = keys.identityKey();
        SignedPreKey signedPreKey = keys.signedPreKey();
        return new StoredKeyMaterial(
                keys.deviceId(),
                identity.keyId(),
                Curve25519.encodePublicKey(identity.publicKey()),
                Curve25519.encodePrivateKey(identity.privateKey()),
                PreKeySigner.encodePublicKey(identity.signingPublicKey()),
                PreKeySigner.encodePrivateKey(identity.signingPrivateKey()),
                signedPreKey.keyId(),
                Curve25519.encodePublicKey(signedPreKey.publicKey()),
                Curve25519.encodePrivateKey(signedPreKey.privateKey()),
                Base64.getEncoder().encodeToString(signedPreKey.signature()));
    }

    DeviceKeys toDeviceKeys() {
        IdentityKeyPair identity = new IdentityKeyPair(
                identityKeyId,
                Curve25519.decodePrivateKey(identityPrivate),
                Curve25519.decodePublicKey(identityPublic),
                PreKeySigner.decodePrivateKey(signingPrivate),
                PreKeySigner.decodePublicKey(signingPublic));
        SignedPreKey signedPreKey = new SignedPreKey(
                signedPreKeyId,
                Curve25519.decodePrivateKey(signedPreKeyPrivate),
                Curve25519.decodePublicKey(signedPreKeyPublic),
                Base64.getDecoder().decode(signedPreKeySignature));
        return new DeviceKeys(deviceId, identity, signedPreKey);
    }
}
