package com.adautopilot.optimization.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request body for POST /api/v1/autonomous/toggle-mode. {@code mode} is
 * {@code suggest} or {@code auto}.
 */
public record ToggleModeRequest(
    @JsonProperty("mode") String mode
) {}
