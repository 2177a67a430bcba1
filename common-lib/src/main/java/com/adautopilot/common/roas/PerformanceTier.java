package com.adautopilot.common.roas;

/**
 * Coarse performance bucket stored on each ROAS metrics row.
 *
 * <pre>
 *   EXCELLENT  roas ≥ 5.0 and conversion rate ≥ 5%
 *   GOOD       roas ≥ 3.0 and conversion rate ≥ 3%
 *   AVERAGE    roas ≥ 2.0 and conversion rate ≥ 2%
 *   POOR       roas ≥ 1.0 and conversion rate ≥ 1%
 *   FAILING    otherwise
 * </pre>
 */
public enum PerformanceTier {
    EXCELLENT,
    GOOD,
    AVERAGE,
    POOR,
    FAILING;

    public static PerformanceTier classify(double actualRoas, double conversionRate) {
        if (actualRoas >= 5.0 && conversionRate >= 0.05) return EXCELLENT;
        if (actualRoas >= 3.0 && conversionRate >= 0.03) return GOOD;
        if (actualRoas >= 2.0 && conversionRate >= 0.02) return AVERAGE;
        if (actualRoas >= 1.0 && conversionRate >= 0.01) return POOR;
        return FAILING;
    }
}
