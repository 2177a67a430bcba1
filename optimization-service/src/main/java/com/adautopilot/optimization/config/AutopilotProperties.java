package com.adautopilot.optimization.config;

import com.adautopilot.common.config.AutopilotSettings;
import com.adautopilot.common.model.WorkerMode;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Binds {@code autopilot.*} from application.yml. Every field defaults to the value in
 * {@link AutopilotSettings#defaults()}, so an empty section yields the stock thresholds.
 *
 * <p>Read once at startup by {@link #toSettings()}; engines never see this class.
 */
@Data
@ConfigurationProperties(prefix = "autopilot")
public class AutopilotProperties {

    private Roas      roas      = new Roas();
    private Optimizer optimizer = new Optimizer();
    private Policy    policy    = new Policy();
    private Safety    safety    = new Safety();
    private Worker    worker    = new Worker();

    public AutopilotSettings toSettings() {
        return new AutopilotSettings(
            new AutopilotSettings.RoasSettings(
                roas.minSampleSize, roas.priorWeightBase, roas.defaultPriorRoas, roas.bootstrapSamples,
                roas.confidenceLevel, roas.defaultWindowDays, roas.emaAlpha, roas.predictionLookbackDays,
                roas.fullConfidencePoints),
            new AutopilotSettings.OptimizerSettings(
                optimizer.scaleUpMinRoas, optimizer.scaleDownMaxRoas, optimizer.pauseRoas,
                optimizer.maxDailyChangePct, optimizer.scaleDownPct, optimizer.minConfidence,
                optimizer.cooldownHours, optimizer.embargoHours, optimizer.reallocateMinAds,
                optimizer.reallocateThresholdDiff, optimizer.reallocateMinConfidence,
                optimizer.reallocationConfidence, optimizer.maxActionsPerCampaign,
                optimizer.actionExpiryHours, optimizer.lookbackDays),
            new AutopilotSettings.PolicySettings(
                policy.maxDailyChangePct, policy.maxAutoChangePct, policy.maxCampaignBudgetUsd,
                policy.minSpendUsd, policy.hardStopRoas, policy.hardStopConfidence, policy.homeMarket,
                policy.minHomePct, policy.maxSingleCountryPct, policy.distributionTolerance,
                policy.creativeEmbargoHours, policy.requireHumanApprovalCreatives),
            new AutopilotSettings.SafetySettings(
                safety.maxDailySpendUsd, safety.minAgeHours, safety.minImpressions, safety.minSpendUsd,
                safety.rateLimitCooldownHours, safety.dangerousRoas, safety.dangerousConfidence,
                safety.requireHumanApprovalCreatives),
            new AutopilotSettings.WorkerSettings(
                worker.enabled, worker.mode, worker.intervalSeconds, worker.errorBackoffSeconds,
                worker.maxCampaignsPerTick, worker.maxActionsPerTick, worker.autoMinConfidence,
                worker.maxAutoChangePct));
    }

    @Data
    public static class Roas {
        private static final AutopilotSettings.RoasSettings D = AutopilotSettings.RoasSettings.defaults();

        private int    minSampleSize          = D.minSampleSize();
        private double priorWeightBase        = D.priorWeightBase();
        private double defaultPriorRoas       = D.defaultPriorRoas();
        private int    bootstrapSamples       = D.bootstrapSamples();
        private double confidenceLevel        = D.confidenceLevel();
        private int    defaultWindowDays      = D.defaultWindowDays();
        private double emaAlpha               = D.emaAlpha();
        private int    predictionLookbackDays = D.predictionLookbackDays();
        private int    fullConfidencePoints   = D.fullConfidencePoints();
    }

    @Data
    public static class Optimizer {
        private static final AutopilotSettings.OptimizerSettings D = AutopilotSettings.OptimizerSettings.defaults();

        private double scaleUpMinRoas          = D.scaleUpMinRoas();
        private double scaleDownMaxRoas        = D.scaleDownMaxRoas();
        private double pauseRoas               = D.pauseRoas();
        private double maxDailyChangePct       = D.maxDailyChangePct();
        private double scaleDownPct            = D.scaleDownPct();
        private double minConfidence           = D.minConfidence();
        private int    cooldownHours           = D.cooldownHours();
        private int    embargoHours            = D.embargoHours();
        private int    reallocateMinAds        = D.reallocateMinAds();
        private double reallocateThresholdDiff = D.reallocateThresholdDiff();
        private double reallocateMinConfidence = D.reallocateMinConfidence();
        private double reallocationConfidence  = D.reallocationConfidence();
        private int    maxActionsPerCampaign   = D.maxActionsPerCampaign();
        private int    actionExpiryHours       = D.actionExpiryHours();
        private int    lookbackDays            = D.lookbackDays();
    }

    @Data
    public static class Policy {
        private static final AutopilotSettings.PolicySettings D = AutopilotSettings.PolicySettings.defaults();

        private double  maxDailyChangePct             = D.maxDailyChangePct();
        private double  maxAutoChangePct              = D.maxAutoChangePct();
        private double  maxCampaignBudgetUsd          = D.maxCampaignBudgetUsd();
        private double  minSpendUsd                   = D.minSpendUsd();
        private double  hardStopRoas                  = D.hardStopRoas();
        private double  hardStopConfidence            = D.hardStopConfidence();
        private String  homeMarket                    = D.homeMarket();
        private double  minHomePct                    = D.minHomePct();
        private double  maxSingleCountryPct           = D.maxSingleCountryPct();
        private double  distributionTolerance         = D.distributionTolerance();
        private int     creativeEmbargoHours          = D.creativeEmbargoHours();
        private boolean requireHumanApprovalCreatives = D.requireHumanApprovalCreatives();
    }

    @Data
    public static class Safety {
        private static final AutopilotSettings.SafetySettings D = AutopilotSettings.SafetySettings.defaults();

        private double  maxDailySpendUsd              = D.maxDailySpendUsd();
        private int     minAgeHours                   = D.minAgeHours();
        private long    minImpressions                = D.minImpressions();
        private double  minSpendUsd                   = D.minSpendUsd();
        private int     rateLimitCooldownHours        = D.rateLimitCooldownHours();
        private double  dangerousRoas                 = D.dangerousRoas();
        private double  dangerousConfidence           = D.dangerousConfidence();
        private boolean requireHumanApprovalCreatives = D.requireHumanApprovalCreatives();
    }

    @Data
    public static class Worker {
        private static final AutopilotSettings.WorkerSettings D = AutopilotSettings.WorkerSettings.defaults();

        private boolean    enabled             = D.enabled();
        private WorkerMode mode                = D.mode();
        private long       intervalSeconds     = D.intervalSeconds();
        private long       errorBackoffSeconds = D.errorBackoffSeconds();
        private int        maxCampaignsPerTick = D.maxCampaignsPerTick();
        private int        maxActionsPerTick   = D.maxActionsPerTick();
        private double     autoMinConfidence   = D.autoMinConfidence();
        private double     maxAutoChangePct    = D.maxAutoChangePct();
    }
}
