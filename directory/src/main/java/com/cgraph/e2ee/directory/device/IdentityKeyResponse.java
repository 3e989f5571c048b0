package com.cgraph.e2ee.directory.device;

import com.fasterxml.jackson.annotation.JsonProperty;

public record IdentityKeyResponse(
    @JsonProperty("user_id") String userId,
    @JsonProperty("device_id") String deviceId,
    @JsonProperty("identity_key") String identityKey,
    @JsonProperty("identity_key_id") String identityKeyId
) {}
