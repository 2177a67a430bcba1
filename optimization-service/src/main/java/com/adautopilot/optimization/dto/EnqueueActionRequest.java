package com.adautopilot.optimization.dto;

import com.adautopilot.common.exception.ValidationException;
import com.adautopilot.common.model.ActionType;
import com.adautopilot.common.model.BudgetAllocation;
import com.adautopilot.common.model.TargetLevel;
import com.adautopilot.optimization.service.CandidateAction;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Request body for POST /api/v1/optimization/actions. {@code type} accepts the
 * wire name ({@code scale_up}) or the enum name.
 */
public record EnqueueActionRequest(
    @JsonProperty("type")             String type,
    @JsonProperty("targetLevel")      String targetLevel,
    @JsonProperty("targetId")         String targetId,
    @JsonProperty("campaignId")       String campaignId,
    @JsonProperty("adsetId")          String adsetId,
    @JsonProperty("adId")             String adId,
    @JsonProperty("amountPct")        Double amountPct,
    @JsonProperty("amountUsd")        Double amountUsd,
    @JsonProperty("oldBudgetUsd")     Double oldBudgetUsd,
    @JsonProperty("newBudgetUsd")     Double newBudgetUsd,
    @JsonProperty("reason")           String reason,
    @JsonProperty("confidence")       Double confidence,
    @JsonProperty("roasValue")        Double roasValue,
    @JsonProperty("reallocationPlan") List<BudgetAllocation> reallocationPlan,
    @JsonProperty("createdBy")        String createdBy
) {

    public CandidateAction toCandidate() {
        return new CandidateAction(ActionType.fromWireName(type), level(), targetId, campaignId, adsetId, adId,
            amountPct, amountUsd, oldBudgetUsd, newBudgetUsd, reason, null,
            confidence == null ? 0.0 : confidence, roasValue, null, null, reallocationPlan);
    }

    private TargetLevel level() {
        if (targetLevel == null || targetLevel.isBlank()) {
            return TargetLevel.AD;
        }
        try {
            return TargetLevel.valueOf(targetLevel.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown target level: " + targetLevel);
        }
    }
}
