package com.cgraph.e2ee.directory.prekey;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PrekeyRequest(
    @JsonProperty("key_id") String keyId,
    @JsonProperty("public_key") String publicKey     // X25519, Base64
) {}
