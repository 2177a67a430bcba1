package com.adautopilot.optimization.service;

import com.adautopilot.common.model.ActionType;
import com.adautopilot.common.model.BudgetAllocation;
import com.adautopilot.common.model.TargetLevel;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * An action proposed by {@code evaluateCampaign} (or submitted by hand), before it is
 * persisted. {@code amountPct} is a fraction: 0.20 means +20%, -1.0 means pause.
 */
public record CandidateAction(
    @JsonProperty("type")             ActionType type,
    @JsonProperty("targetLevel")      TargetLevel targetLevel,
    @JsonProperty("targetId")         String targetId,
    @JsonProperty("campaignId")       String campaignId,
    @JsonProperty("adsetId")          String adsetId,
    @JsonProperty("adId")             String adId,
    @JsonProperty("amountPct")        Double amountPct,
    @JsonProperty("amountUsd")        Double amountUsd,
    @JsonProperty("oldBudgetUsd")     Double oldBudgetUsd,
    @JsonProperty("newBudgetUsd")     Double newBudgetUsd,
    @JsonProperty("reason")           String reason,
    @JsonProperty("reasonDetails")    String reasonDetails,
    @JsonProperty("confidence")       double confidence,
    @JsonProperty("roasValue")        Double roasValue,
    @JsonProperty("spendUsd")         Double spendUsd,
    @JsonProperty("impressions")      Long impressions,
    @JsonProperty("reallocationPlan") List<BudgetAllocation> reallocationPlan
) {
    public double absAmountPct() {
        return amountPct == null ? 0.0 : Math.abs(amountPct);
    }
}
