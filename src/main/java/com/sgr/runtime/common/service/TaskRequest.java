package com.sgr.runtime.common.service;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound task. {@code timeoutSeconds} overrides the configured default deadline.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TaskRequest(
        String message,
        @JsonProperty("timeout_seconds") Integer timeoutSeconds) {
}
