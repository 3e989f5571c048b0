package com.cgraph.e2ee.client.wire;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PrekeyCount(
    @JsonProperty("count") long count,
    @JsonProperty("should_upload") boolean shouldUpload
) {}
