package com.cgraph.e2ee.client.wire;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PreKeyPayload(
    @JsonProperty("key_id") String keyId,
    @JsonProperty("public_key") String publicKey
) {}
