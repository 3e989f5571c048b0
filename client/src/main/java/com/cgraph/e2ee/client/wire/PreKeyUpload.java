package com.cgraph.e2ee.client.wire;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record PreKeyUpload(@JsonProperty("prekeys") List<PreKeyPayload> prekeys) {}
