package com.adautopilot.optimization.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request body for POST /api/v1/optimization/approve/{actionId}.
 */
public record ApproveRequest(
    @JsonProperty("approvedBy") String approvedBy
) {}
