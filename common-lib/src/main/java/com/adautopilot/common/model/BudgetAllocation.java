package com.adautopilot.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One line of a reallocation plan: an ad's current daily budget and the budget it
 * should move to.
 */
public record BudgetAllocation(
    @JsonProperty("adId")             String adId,
    @JsonProperty("roas")             double roas,
    @JsonProperty("confidence")       double confidence,
    @JsonProperty("weight")           double weight,
    @JsonProperty("currentBudgetUsd") double currentBudgetUsd,
    @JsonProperty("newBudgetUsd")     double newBudgetUsd
) {
    public double changeUsd() {
        return newBudgetUsd - currentBudgetUsd;
    }
}
