package com.cgraph.e2ee.client.wire;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Public half of a freshly generated bundle, as posted to {@code /api/v1/e2ee/keys}. */
public record RegistrationPayload(
    @JsonProperty("identity_key") String identityKey,
    @JsonProperty("key_id") String keyId,
    @JsonProperty("device_id") String deviceId,
    @JsonProperty("signing_key") String signingKey,
    @JsonProperty("signed_prekey") SignedPreKeyPayload signedPrekey,
    @JsonProperty("one_time_prekeys") List<PreKeyPayload> oneTimePrekeys
) {}
