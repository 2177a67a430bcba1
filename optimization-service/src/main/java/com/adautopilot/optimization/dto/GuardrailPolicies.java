package com.adautopilot.optimization.dto;

import com.adautopilot.common.config.AutopilotSettings.PolicySettings;
import com.adautopilot.common.config.AutopilotSettings.SafetySettings;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Active guardrail thresholds, as served by GET /api/v1/autonomous/policies.
 */
public record GuardrailPolicies(
    @JsonProperty("policy") PolicySettings policy,
    @JsonProperty("safety") SafetySettings safety
) {}
