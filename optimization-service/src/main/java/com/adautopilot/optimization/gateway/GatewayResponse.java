package com.adautopilot.optimization.gateway;

import com.fasterxml.jackson.annotation.JsonProperty;

public record GatewayResponse(
    @JsonProperty("success")   boolean success,
    @JsonProperty("requestId") String requestId,
    @JsonProperty("message")   String message
) {}
