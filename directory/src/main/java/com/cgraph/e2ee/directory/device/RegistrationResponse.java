package com.cgraph.e2ee.directory.device;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RegistrationResponse(
    @JsonProperty("identity_key_id") String identityKeyId,
    @JsonProperty("signed_prekey_id") String signedPrekeyId,
    @JsonProperty("one_time_prekey_count") int oneTimePrekeyCount
) {}
