package com.cgraph.e2ee.client.wire;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SignedPreKeyPayload(
    @JsonProperty("public_key") String publicKey,
    @JsonProperty("signature") String signature,
    @JsonProperty("key_id") String keyId
) {}
