package com.adautopilot.common.roas;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;

/**
 * Smoothed, confidence-bounded ROAS for one scope over {@code [dateStart, dateEnd)}.
 */
public record RoasResult(
    @JsonProperty("actualRoas")             double actualRoas,
    @JsonProperty("smoothedRoas")           double smoothedRoas,
    @JsonProperty("totalRevenueUsd")        double totalRevenueUsd,
    @JsonProperty("totalCostUsd")           double totalCostUsd,
    @JsonProperty("totalConversions")       int totalConversions,
    @JsonProperty("clicks")                 long clicks,
    @JsonProperty("impressions")            long impressions,
    @JsonProperty("conversionRate")         double conversionRate,
    @JsonProperty("confidenceIntervalLow")  double confidenceIntervalLow,
    @JsonProperty("confidenceIntervalHigh") double confidenceIntervalHigh,
    @JsonProperty("isOutlier")              boolean isOutlier,
    @JsonProperty("outlierReason")          String outlierReason,
    @JsonProperty("sampleSize")             int sampleSize,
    @JsonProperty("dateStart")              LocalDateTime dateStart,
    @JsonProperty("dateEnd")                LocalDateTime dateEnd
) {}
