package com.cgraph.e2ee.client.wire;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RegistrationResult(
    @JsonProperty("identity_key_id") String identityKeyId,
    @JsonProperty("signed_prekey_id") String signedPrekeyId,
    @JsonProperty("one_time_prekey_count") int oneTimePrekeyCount
) {}
