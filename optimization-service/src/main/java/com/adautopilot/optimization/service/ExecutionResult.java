package com.adautopilot.optimization.service;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Outcome of {@code executeAction}.
 *
 * @param status {@code executed}, {@code failed} or {@code dry_run}
 */
public record ExecutionResult(
    @JsonProperty("actionId") String actionId,
    @JsonProperty("status")   String status,
    @JsonProperty("details")  Map<String, Object> details,
    @JsonProperty("error")    String error
) {
    public static final String EXECUTED = "executed";
    public static final String FAILED   = "failed";
    public static final String DRY_RUN  = "dry_run";

    public static ExecutionResult executed(String actionId, Map<String, Object> details) {
        return new ExecutionResult(actionId, EXECUTED, details, null);
    }

    public static ExecutionResult failed(String actionId, String error) {
        return new ExecutionResult(actionId, FAILED, Map.of(), error == null ? "Unknown error" : error);
    }

    public static ExecutionResult dryRun(String actionId, Map<String, Object> details) {
        return new ExecutionResult(actionId, DRY_RUN, details, null);
    }

    @JsonIgnore
    public boolean succeeded() {
        return EXECUTED.equals(status);
    }
}
