package com.cgraph.e2ee.directory.device;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/** What a sender needs to run X3DH against a user's newest device. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BundleResponse(
    @JsonProperty("identity_key") String identityKey,
    @JsonProperty("identity_key_id") String identityKeyId,
    @JsonProperty("signing_key") String signingKey,
    @JsonProperty("device_id") String deviceId,
    @JsonProperty("signed_prekey") String signedPrekey,
    @JsonProperty("signed_prekey_id") String signedPrekeyId,
    @JsonProperty("signed_prekey_signature") String signedPrekeySignature,
    @JsonProperty("one_time_prekey") String oneTimePrekey,       // omitted once the supply is exhausted
    @JsonProperty("one_time_prekey_id") String oneTimePrekeyId
) {}
