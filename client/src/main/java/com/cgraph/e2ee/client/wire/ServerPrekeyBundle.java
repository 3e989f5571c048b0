package com.cgraph.e2ee.client.wire;

import com.cgraph.e2ee.client.crypto.Curve25519;
import com.cgraph.e2ee.client.crypto.PreKeySigner;
import com.cgraph.e2ee.client.error.KeyAgreementException;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A recipient's public keys as served by the key directory.
 * The one-time prekey pair is absent once the recipient's supply is exhausted.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ServerPrekeyBundle(
    @JsonProperty("identity_key") String identityKey,
    @JsonProperty("identity_key_id") String identityKeyId,
    @JsonProperty("signing_key") String signingKey,          // Ed25519, verifies signed_prekey_signature
    @JsonProperty("device_id") String deviceId,
    @JsonProperty("signed_prekey") String signedPrekey,
    @JsonProperty("signed_prekey_id") String signedPrekeyId,
    @JsonProperty("signed_prekey_signature") String signedPrekeySignature,
    @JsonProperty("one_time_prekey") String oneTimePrekey,   // nullable
    @JsonProperty("one_time_prekey_id") String oneTimePrekeyId
) {

    /**
     * Checks shape only: every key decodes to 32 bytes and the signature to 64.
     * Whether the signature verifies is left to the agreement.
     */
    public ServerPrekeyBundle validate() {
        Curve25519.decodeKeyBytes(identityKey, "identity key");
        Curve25519.decodeKeyBytes(signingKey, "signing key");
        Curve25519.decodeKeyBytes(signedPrekey, "signed prekey");
        if (PreKeySigner.decodeSignature(signedPrekeySignature).length != PreKeySigner.SIGNATURE_LENGTH) {
            throw new KeyAgreementException("Malformed signed prekey signature: expected "
                    + PreKeySigner.SIGNATURE_LENGTH + " bytes");
        }
        if (identityKeyId == null || signedPrekeyId == null) {
            throw new KeyAgreementException("Bundle is missing a key id");
        }
        if (oneTimePrekey != null) {
            Curve25519.decodeKeyBytes(oneTimePrekey, "one-time prekey");
            if (oneTimePrekeyId == null) {
                throw new KeyAgreementException("One-time prekey has no key id");
            }
        }
        return this;
    }

    @JsonIgnore
    public boolean hasOneTimePreKey() {
        return oneTimePrekey != null;
    }

    public ServerPrekeyBundle withoutOneTimePreKey() {
        return new ServerPrekeyBundle(identityKey, identityKeyId, signingKey, deviceId,
                signedPrekey, signedPrekeyId, signedPrekeySignature, null, null);
    }
}
