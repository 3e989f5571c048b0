package com.cgraph.e2ee.directory.device;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record DeviceResponse(
    @JsonProperty("device_id") String deviceId,
    @JsonProperty("created_at") Instant createdAt
) {}
