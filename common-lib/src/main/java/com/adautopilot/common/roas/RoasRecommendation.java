package com.adautopilot.common.roas;

/**
 * Advisory recommendation persisted alongside a ROAS metrics row. Not an action;
 * the Optimization Service derives actions from the ROAS values themselves.
 *
 * @param recommendation    scale_up | monitor | test | scale_down | pause
 * @param budgetChangePct   suggested change in percent (50.0 = +50%)
 */
public record RoasRecommendation(String recommendation, double budgetChangePct) {

    public static RoasRecommendation from(PerformanceTier tier, double smoothedRoas, double predictedRoas) {
        return switch (tier) {
            case EXCELLENT -> new RoasRecommendation("scale_up", 50.0);
            case GOOD      -> predictedRoas >= smoothedRoas
                                  ? new RoasRecommendation("scale_up", 25.0)
                                  : new RoasRecommendation("monitor", 0.0);
            case AVERAGE   -> new RoasRecommendation("test", 0.0);
            case POOR      -> new RoasRecommendation("scale_down", -30.0);
            case FAILING   -> new RoasRecommendation("pause", -100.0);
        };
    }
}
