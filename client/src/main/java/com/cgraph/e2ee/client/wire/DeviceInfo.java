package com.cgraph.e2ee.client.wire;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record DeviceInfo(
    @JsonProperty("device_id") String deviceId,
    @JsonProperty("created_at") Instant createdAt
) {}
