package com.adautopilot.common.policy;

import java.util.List;
import java.util.Map;

/**
 * Parameters of a campaign about to be created.
 *
 * @param budgetDistribution country code → share of budget, required when more than one country
 */
public record CampaignDraft(
    double              budgetUsd,
    String              pixelId,
    List<String>        countries,
    Map<String, Double> budgetDistribution
) {}
