package com.adautopilot.optimization.service;

import com.fasterxml.jackson.annotation.JsonProperty;

public record QueueStats(
    @JsonProperty("totalSuggested")     long totalSuggested,
    @JsonProperty("totalPending")       long totalPending,
    @JsonProperty("totalExecuting")     long totalExecuting,
    @JsonProperty("totalExecutedToday") long totalExecutedToday,
    @JsonProperty("totalFailedToday")   long totalFailedToday,
    @JsonProperty("avgConfidence")      double avgConfidence
) {}
