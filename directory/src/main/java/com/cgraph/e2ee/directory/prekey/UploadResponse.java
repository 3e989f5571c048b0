package com.cgraph.e2ee.directory.prekey;

import com.fasterxml.jackson.annotation.JsonProperty;

public record UploadResponse(
    @JsonProperty("uploaded") int uploaded,
    @JsonProperty("total") long total
) {}
