package com.adautopilot.optimization.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Request body for POST /api/v1/optimization/run. An empty campaign list means
 * every active campaign.
 */
public record ManualRunRequest(
    @JsonProperty("campaignIds")  List<String> campaignIds,
    @JsonProperty("lookbackDays") int lookbackDays
) {}
