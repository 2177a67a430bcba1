package com.adautopilot.optimization.worker;

import com.adautopilot.common.model.WorkerMode;
import com.fasterxml.jackson.annotation.JsonProperty;

public record WorkerStatus(
    @JsonProperty("enabled")             boolean enabled,
    @JsonProperty("running")             boolean running,
    @JsonProperty("mode")                WorkerMode mode,
    @JsonProperty("intervalSeconds")     long intervalSeconds,
    @JsonProperty("maxCampaignsPerTick") int maxCampaignsPerTick,
    @JsonProperty("maxActionsPerTick")   int maxActionsPerTick,
    @JsonProperty("autoMinConfidence")   double autoMinConfidence,
    @JsonProperty("maxAutoChangePct")    double maxAutoChangePct,
    @JsonProperty("lastTick")            TickStats lastTick
) {}
