package com.adautopilot.optimization.service;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ManualRunResult(
    @JsonProperty("processedCampaigns")   int processedCampaigns,
    @JsonProperty("actionsSuggested")     long actionsSuggested,
    @JsonProperty("executionTimeSeconds") double executionTimeSeconds
) {}
