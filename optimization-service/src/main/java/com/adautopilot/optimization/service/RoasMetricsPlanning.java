package com.adautopilot.optimization.service;

import com.adautopilot.optimization.model.RoasMetricsRecord;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/** Null-safe reads over metrics rows used by action generation. */
final class RoasMetricsPlanning {

    static final double DEFAULT_CONFIDENCE = 0.5;

    private RoasMetricsPlanning() {}

    static double roas(RoasMetricsRecord row) {
        return row.getActualRoas() == null ? 0.0 : row.getActualRoas();
    }

    static double confidence(RoasMetricsRecord row) {
        return row.getConfidenceScore() == null ? DEFAULT_CONFIDENCE : row.getConfidenceScore();
    }

    static double spend(RoasMetricsRecord row) {
        return row.getTotalCostUsd() == null ? 0.0 : row.getTotalCostUsd();
    }

    static long impressions(RoasMetricsRecord row) {
        return row.getImpressions() == null ? 0L : row.getImpressions();
    }

    /**
     * First row seen per ad. With rows ordered newest first this is each ad's latest row.
     */
    static Map<String, RoasMetricsRecord> latestPerAd(Collection<RoasMetricsRecord> rowsNewestFirst) {
        Map<String, RoasMetricsRecord> latest = new LinkedHashMap<>();
        for (RoasMetricsRecord row : rowsNewestFirst) {
            if (row.getAdId() != null) {
                latest.putIfAbsent(row.getAdId(), row);
            }
        }
        return latest;
    }
}
