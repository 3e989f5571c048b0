package com.cgraph.e2ee.directory.device;

import com.cgraph.e2ee.directory.prekey.PrekeyRequest;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Public half of a device's key bundle. */
public record RegistrationRequest(
    @JsonProperty("identity_key") String identityKey,        // X25519, Base64
    @JsonProperty("key_id") String keyId,
    @JsonProperty("device_id") String deviceId,
    @JsonProperty("signing_key") String signingKey,          // Ed25519, Base64
    @JsonProperty("signed_prekey") SignedPrekeyRequest signedPrekey,
    @JsonProperty("one_time_prekeys") List<PrekeyRequest> oneTimePrekeys
) {

    public record SignedPrekeyRequest(
        @JsonProperty("public_key") String publicKey,
        @JsonProperty("signature") String signature,
        @JsonProperty("key_id") String keyId
    ) {}
}
