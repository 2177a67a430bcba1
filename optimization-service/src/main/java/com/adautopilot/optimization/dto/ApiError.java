package com.adautopilot.optimization.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiError(
    @JsonProperty("error")         String error,
    @JsonProperty("message")       String message,
    @JsonProperty("actionId")      String actionId,
    @JsonProperty("currentStatus") String currentStatus
) {
    public static ApiError of(String error, String message) {
        return new ApiError(error, message, null, null);
    }
}
