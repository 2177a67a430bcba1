package com.adautopilot.optimization.worker;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Counters for one worker tick. Per-campaign and per-action partials are built
 * with the same record and folded together with {@link #merge}.
 */
public record TickStats(
    @JsonProperty("tickStartedAt")        LocalDateTime tickStartedAt,
    @JsonProperty("tickCompletedAt")      LocalDateTime tickCompletedAt,
    @JsonProperty("staleExpired")         int staleExpired,
    @JsonProperty("campaignsEvaluated")   int campaignsEvaluated,
    @JsonProperty("actionsGenerated")     int actionsGenerated,
    @JsonProperty("actionsPolicyBlocked") int actionsPolicyBlocked,
    @JsonProperty("actionsSafetyBlocked") int actionsSafetyBlocked,
    @JsonProperty("actionsDeferred")      int actionsDeferred,
    @JsonProperty("actionsQueued")        int actionsQueued,
    @JsonProperty("actionsExecuted")      int actionsExecuted,
    @JsonProperty("actionsFailed")        int actionsFailed,
    @JsonProperty("evaluatedCampaignIds") List<String> evaluatedCampaignIds,
    @JsonProperty("errors")               List<String> errors
) {

    public static TickStats started(LocalDateTime at, int staleExpired) {
        return new TickStats(at, null, staleExpired, 0, 0, 0, 0, 0, 0, 0, 0, List.of(), List.of());
    }

    static TickStats empty() {
        return new TickStats(null, null, 0, 0, 0, 0, 0, 0, 0, 0, 0, List.of(), List.of());
    }

    static TickStats campaign(String campaignId, int actionsGenerated) {
        return new TickStats(null, null, 0, 1, actionsGenerated, 0, 0, 0, 0, 0, 0,
                             List.of(campaignId), List.of());
    }

    static TickStats campaignError(String campaignId, String error) {
        return new TickStats(null, null, 0, 0, 0, 0, 0, 0, 0, 0, 0,
                             List.of(), List.of(campaignId + ": " + error));
    }

    static TickStats policyBlocked() {
        return new TickStats(null, null, 0, 0, 0, 1, 0, 0, 0, 0, 0, List.of(), List.of());
    }

    static TickStats safetyBlocked() {
        return new TickStats(null, null, 0, 0, 0, 0, 1, 0, 0, 0, 0, List.of(), List.of());
    }

    static TickStats deferred() {
        return new TickStats(null, null, 0, 0, 0, 0, 0, 1, 0, 0, 0, List.of(), List.of());
    }

    static TickStats queued() {
        return new TickStats(null, null, 0, 0, 0, 0, 0, 0, 1, 0, 0, List.of(), List.of());
    }

    static TickStats executed() {
        return new TickStats(null, null, 0, 0, 0, 0, 0, 0, 0, 1, 0, List.of(), List.of());
    }

    static TickStats failed(String error) {
        return new TickStats(null, null, 0, 0, 0, 0, 0, 0, 0, 0, 1, List.of(),
                             error == null ? List.of() : List.of(error));
    }

    public TickStats merge(TickStats other) {
        return new TickStats(
            tickStartedAt != null ? tickStartedAt : other.tickStartedAt,
            tickCompletedAt != null ? tickCompletedAt : other.tickCompletedAt,
            staleExpired         + other.staleExpired,
            campaignsEvaluated   + other.campaignsEvaluated,
            actionsGenerated     + other.actionsGenerated,
            actionsPolicyBlocked + other.actionsPolicyBlocked,
            actionsSafetyBlocked + other.actionsSafetyBlocked,
            actionsDeferred      + other.actionsDeferred,
            actionsQueued        + other.actionsQueued,
            actionsExecuted      + other.actionsExecuted,
            actionsFailed        + other.actionsFailed,
            concat(evaluatedCampaignIds, other.evaluatedCampaignIds),
            concat(errors, other.errors));
    }

    public TickStats completedAt(LocalDateTime at) {
        return new TickStats(tickStartedAt, at, staleExpired, campaignsEvaluated, actionsGenerated,
            actionsPolicyBlocked, actionsSafetyBlocked, actionsDeferred, actionsQueued,
            actionsExecuted, actionsFailed, evaluatedCampaignIds, errors);
    }

    public TickStats withError(String error) {
        return merge(new TickStats(null, null, 0, 0, 0, 0, 0, 0, 0, 0, 0, List.of(), List.of(error)));
    }

    private static List<String> concat(List<String> a, List<String> b) {
        if (b.isEmpty()) return a;
        if (a.isEmpty()) return b;
        List<String> joined = new ArrayList<>(a.size() + b.size());
        joined.addAll(a);
        joined.addAll(b);
        return List.copyOf(joined);
    }
}
