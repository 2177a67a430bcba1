package com.adautopilot.optimization.dto;

import com.adautopilot.common.model.WorkerMode;
import com.fasterxml.jackson.annotation.JsonProperty;

public record ModeChangeResponse(
    @JsonProperty("previousMode") WorkerMode previousMode,
    @JsonProperty("mode")         WorkerMode mode
) {}
