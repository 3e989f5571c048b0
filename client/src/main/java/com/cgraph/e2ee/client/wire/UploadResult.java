package com.cgraph.e2ee.client.wire;

import com.fasterxml.jackson.annotation.JsonProperty;

public record UploadResult(
    @JsonProperty("uploaded") int uploaded,
    @JsonProperty("total") long total
) {}
