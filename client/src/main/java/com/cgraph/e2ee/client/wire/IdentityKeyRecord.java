package com.cgraph.e2ee.client.wire;

import com.fasterxml.jackson.annotation.JsonProperty;

/** A user's current identity key, looked up without touching their prekeys. */
public record IdentityKeyRecord(
    @JsonProperty("user_id") String userId,
    @JsonProperty("device_id") String deviceId,
    @JsonProperty("identity_key") String identityKey,
    @JsonProperty("identity_key_id") String identityKeyId
) {}
