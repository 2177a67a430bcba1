package com.adautopilot.optimization.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request body for POST /api/v1/optimization/execute/{actionId}.
 */
public record ExecuteRequest(
    @JsonProperty("runBy")  String runBy,
    @JsonProperty("dryRun") boolean dryRun
) {}
