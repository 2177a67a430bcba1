package com.adautopilot.common.prediction;

import com.adautopilot.common.config.AutopilotSettings.RoasSettings;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Forecasts ROAS from daily history and scores conversion likelihood.
 *
 * <h3>ROAS forecast</h3>
 * History arrives newest first. The EMA is seeded with the oldest value and folded
 * toward the newest:
 * <pre>
 *   ema = α · value + (1 − α) · ema      (α = emaAlpha, default 0.3)
 * </pre>
 * No history yields the calculator's prior with zero confidence.
 *
 * <h3>Conversion probability</h3>
 * Beta-Binomial conjugate update, 95% credible interval from the posterior inverse CDF.
 */
public final class PredictionEngine {

    private static final double CREDIBLE_LOW  = 0.025;
    private static final double CREDIBLE_HIGH = 0.975;

    private final RoasSettings settings;

    public PredictionEngine(RoasSettings settings) {
        this.settings = settings;
    }

    /**
     * @param roasNewestFirst daily actual ROAS values ordered newest first; nulls are skipped
     */
    public RoasPrediction predict(List<Double> roasNewestFirst) {
        List<Double> values = roasNewestFirst.stream().filter(Objects::nonNull).collect(Collectors.toList());
        if (values.isEmpty()) {
            return new RoasPrediction(settings.defaultPriorRoas(), 0.0, 0, Trend.UNKNOWN);
        }

        double alpha = settings.emaAlpha();
        int last = values.size() - 1;
        double ema = values.get(last);
        for (int i = last - 1; i >= 0; i--) {
            ema = alpha * values.get(i) + (1.0 - alpha) * ema;
        }

        double confidence = Math.min((double) values.size() / settings.fullConfidencePoints(), 1.0);
        Trend trend = values.get(0) > values.get(last) ? Trend.INCREASING : Trend.DECREASING;
        return new RoasPrediction(ema, confidence, values.size(), trend);
    }

    public ConversionProbability conversionProbability(long clicks, long conversions) {
        return conversionProbability(clicks, conversions, 1.0, 1.0);
    }

    public ConversionProbability conversionProbability(long clicks, long conversions,
                                                       double priorAlpha, double priorBeta) {
        if (clicks <= 0) {
            return ConversionProbability.ZERO;
        }
        double posteriorAlpha = priorAlpha + conversions;
        double posteriorBeta  = priorBeta + Math.max(clicks - conversions, 0);

        double probability = BetaDistribution.mean(posteriorAlpha, posteriorBeta);
        double low  = BetaDistribution.inverseCdf(CREDIBLE_LOW, posteriorAlpha, posteriorBeta);
        double high = BetaDistribution.inverseCdf(CREDIBLE_HIGH, posteriorAlpha, posteriorBeta);
        return new ConversionProbability(probability, low, high);
    }

    public ExpectedValue expectedValue(double conversionProbability, double averageOrderValue,
                                       double costPerClick) {
        double expectedRevenue = conversionProbability * averageOrderValue;
        double expectedValue   = expectedRevenue - costPerClick;
        double breakevenRate   = averageOrderValue > 0 ? costPerClick / averageOrderValue : 0.0;
        return new ExpectedValue(expectedValue, expectedRevenue, breakevenRate, expectedValue > 0);
    }
}
