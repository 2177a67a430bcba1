package com.adautopilot.common.config;

import com.adautopilot.common.model.WorkerMode;

/**
 * Immutable threshold set shared by every engine in the decision core.
 *
 * <p>Built once at startup and handed to each engine's constructor. Tests build
 * their own instance (usually via {@link #defaults()} plus a {@code with*} copy)
 * so alternate thresholds never leak between test cases.
 *
 * <h3>Groups</h3>
 * <ul>
 *   <li>{@link RoasSettings}: smoothing prior, bootstrap size</li>
 *   <li>{@link OptimizerSettings}: action generation bands and caps</li>
 *   <li>{@link PolicySettings}: business rules (budget caps, hard stop, geo)</li>
 *   <li>{@link SafetySettings}: operational guardrails (spend, embargo, data)</li>
 *   <li>{@link WorkerSettings}: control loop mode, tempo and per-tick limits</li>
 * </ul>
 */
public record AutopilotSettings(
    RoasSettings      roas,
    OptimizerSettings optimizer,
    PolicySettings    policy,
    SafetySettings    safety,
    WorkerSettings    worker
) {

    public static AutopilotSettings defaults() {
        return new AutopilotSettings(
            RoasSettings.defaults(),
            OptimizerSettings.defaults(),
            PolicySettings.defaults(),
            SafetySettings.defaults(),
            WorkerSettings.defaults());
    }

    public AutopilotSettings withOptimizer(OptimizerSettings optimizer) {
        return new AutopilotSettings(roas, optimizer, policy, safety, worker);
    }

    public AutopilotSettings withPolicy(PolicySettings policy) {
        return new AutopilotSettings(roas, optimizer, policy, safety, worker);
    }

    public AutopilotSettings withSafety(SafetySettings safety) {
        return new AutopilotSettings(roas, optimizer, policy, safety, worker);
    }

    public AutopilotSettings withWorker(WorkerSettings worker) {
        return new AutopilotSettings(roas, optimizer, policy, safety, worker);
    }

    public record RoasSettings(
        int    minSampleSize,
        double priorWeightBase,
        double defaultPriorRoas,
        int    bootstrapSamples,
        double confidenceLevel,
        int    defaultWindowDays,
        double emaAlpha,
        int    predictionLookbackDays,
        int    fullConfidencePoints
    ) {
        public static RoasSettings defaults() {
            return new RoasSettings(30, 0.2, 2.0, 1000, 0.95, 7, 0.3, 30, 30);
        }
    }

    public record OptimizerSettings(
        double scaleUpMinRoas,
        double scaleDownMaxRoas,
        double pauseRoas,
        double maxDailyChangePct,
        double scaleDownPct,
        double minConfidence,
        int    cooldownHours,
        int    embargoHours,
        int    reallocateMinAds,
        double reallocateThresholdDiff,
        double reallocateMinConfidence,
        double reallocationConfidence,
        int    maxActionsPerCampaign,
        int    actionExpiryHours,
        int    lookbackDays
    ) {
        public static OptimizerSettings defaults() {
            return new OptimizerSettings(2.0, 1.5, 0.8, 0.20, 0.30, 0.65, 24, 48,
                                         3, 1.5, 0.6, 0.7, 5, 48, 7);
        }
    }

    public record PolicySettings(
        double  maxDailyChangePct,
        double  maxAutoChangePct,
        double  maxCampaignBudgetUsd,
        double  minSpendUsd,
        double  hardStopRoas,
        double  hardStopConfidence,
        String  homeMarket,
        double  minHomePct,
        double  maxSingleCountryPct,
        double  distributionTolerance,
        int     creativeEmbargoHours,
        boolean requireHumanApprovalCreatives
    ) {
        public static PolicySettings defaults() {
            return new PolicySettings(0.20, 0.10, 10_000.0, 100.0, 0.9, 0.70,
                                      "ES", 0.35, 0.70, 0.01, 48, true);
        }

        public PolicySettings withMaxAutoChangePct(double pct) {
            return new PolicySettings(maxDailyChangePct, pct, maxCampaignBudgetUsd, minSpendUsd,
                hardStopRoas, hardStopConfidence, homeMarket, minHomePct, maxSingleCountryPct,
                distributionTolerance, creativeEmbargoHours, requireHumanApprovalCreatives);
        }
    }

    public record SafetySettings(
        double  maxDailySpendUsd,
        int     minAgeHours,
        long    minImpressions,
        double  minSpendUsd,
        int     rateLimitCooldownHours,
        double  dangerousRoas,
        double  dangerousConfidence,
        boolean requireHumanApprovalCreatives
    ) {
        public static SafetySettings defaults() {
            return new SafetySettings(50_000.0, 48, 1000, 100.0, 24, 0.5, 0.8, true);
        }
    }

    public record WorkerSettings(
        boolean    enabled,
        WorkerMode mode,
        long       intervalSeconds,
        long       errorBackoffSeconds,
        int        maxCampaignsPerTick,
        int        maxActionsPerTick,
        double     autoMinConfidence,
        double     maxAutoChangePct
    ) {
        public static WorkerSettings defaults() {
            return new WorkerSettings(true, WorkerMode.SUGGEST, 1800, 60, 100, 50, 0.75, 0.10);
        }

        public WorkerSettings withMode(WorkerMode mode) {
            return new WorkerSettings(enabled, mode, intervalSeconds, errorBackoffSeconds,
                maxCampaignsPerTick, maxActionsPerTick, autoMinConfidence, maxAutoChangePct);
        }

        public WorkerSettings withMaxAutoChangePct(double pct) {
            return new WorkerSettings(enabled, mode, intervalSeconds, errorBackoffSeconds,
                maxCampaignsPerTick, maxActionsPerTick, autoMinConfidence, pct);
        }
    }
}
