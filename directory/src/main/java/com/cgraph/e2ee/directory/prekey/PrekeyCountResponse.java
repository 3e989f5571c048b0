package com.cgraph.e2ee.directory.prekey;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PrekeyCountResponse(
    @JsonProperty("count") long count,
    @JsonProperty("should_upload") boolean shouldUpload
) {}
