package com.cgraph.e2ee.directory.prekey;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record PrekeyUploadRequest(@JsonProperty("prekeys") List<PrekeyRequest> prekeys) {}
