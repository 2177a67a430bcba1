package com.adautopilot.optimization.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

public record RecordMetricsRequest(
    @JsonProperty("campaignId") String campaignId,
    @JsonProperty("adsetId")    String adsetId,
    @JsonProperty("adId")       String adId,
    @JsonProperty("date")       LocalDate date
) {}
