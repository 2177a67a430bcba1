package com.adautopilot.common.roas;

import com.adautopilot.common.config.AutopilotSettings.RoasSettings;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.SplittableRandom;
import java.util.function.Supplier;
import java.util.random.RandomGenerator;

/**
 * Turns conversion values and spend into a smoothed, confidence-bounded ROAS.
 *
 * <h3>Bayesian smoothing</h3>
 * <pre>
 *   dataWeight  = min(conversions / minSampleSize, 1.0)
 *   priorWeight = priorWeightBase * (1 - dataWeight)
 *   smoothed    = (priorWeight * prior + dataWeight * raw) / (priorWeight + dataWeight)
 * </pre>
 * Zero conversions return the prior exactly; at {@code minSampleSize} conversions or
 * more the raw ROAS is returned exactly.
 *
 * <h3>Confidence interval</h3>
 * Bootstrap: resample the conversion values with replacement
 * {@code bootstrapSamples} times, take {@code sum / spend} per resample and read
 * the two-sided percentiles (linear interpolation between order statistics).
 * Fewer than 3 conversions or zero spend yields {@link ConfidenceInterval#ZERO}.
 *
 * <p>Pure and thread-safe as long as the random source hands out a fresh generator
 * per call (the default does).
 */
public final class RoasCalculator {

    private static final int MIN_CONVERSIONS_FOR_INTERVAL = 3;

    private final RoasSettings settings;
    private final Supplier<RandomGenerator> randomSource;
    private final List<OutlierRule> outlierRules;

    public RoasCalculator(RoasSettings settings) {
        this(settings, SplittableRandom::new);
    }

    public RoasCalculator(RoasSettings settings, Supplier<RandomGenerator> randomSource) {
        this(settings, randomSource, OutlierRule.DEFAULT_CHAIN);
    }

    public RoasCalculator(RoasSettings settings, Supplier<RandomGenerator> randomSource,
                          List<OutlierRule> outlierRules) {
        this.settings     = settings;
        this.randomSource = randomSource;
        this.outlierRules = List.copyOf(outlierRules);
    }

    /**
     * @param conversionValues revenue of each conversion in the window (already
     *                         attribution-weighted if the caller applied a model)
     * @param spend            total spend in the window
     * @param clicks           total clicks in the window
     * @param impressions      total impressions in the window
     */
    public RoasResult calculate(List<Double> conversionValues, double spend, long clicks,
                                long impressions, LocalDateTime dateStart, LocalDateTime dateEnd) {
        int conversions = conversionValues.size();
        double revenue = conversionValues.stream().mapToDouble(Double::doubleValue).sum();

        double rawRoas        = spend > 0 ? revenue / spend : 0.0;
        double smoothedRoas   = smooth(rawRoas, conversions);
        ConfidenceInterval ci = bootstrapInterval(conversionValues, spend);
        OutlierVerdict outlier = detectOutlier(rawRoas, conversions, spend);
        double conversionRate = clicks > 0 ? (double) conversions / clicks : 0.0;

        return new RoasResult(rawRoas, smoothedRoas, revenue, spend, conversions, clicks, impressions,
            conversionRate, ci.low(), ci.high(), outlier.outlier(), outlier.reason(),
            conversions, dateStart, dateEnd);
    }

    public double smooth(double rawRoas, int conversions) {
        if (conversions <= 0) {
            return settings.defaultPriorRoas();
        }
        double dataWeight  = Math.min((double) conversions / settings.minSampleSize(), 1.0);
        double priorWeight = settings.priorWeightBase() * (1.0 - dataWeight);
        if (priorWeight == 0.0) {
            return rawRoas;
        }
        return (priorWeight * settings.defaultPriorRoas() + dataWeight * rawRoas)
            / (priorWeight + dataWeight);
    }

    public ConfidenceInterval bootstrapInterval(List<Double> conversionValues, double spend) {
        int n = conversionValues.size();
        if (n < MIN_CONVERSIONS_FOR_INTERVAL || spend == 0.0) {
            return ConfidenceInterval.ZERO;
        }
        double[] values = conversionValues.stream().mapToDouble(Double::doubleValue).toArray();
        RandomGenerator random = randomSource.get();

        double[] samples = new double[settings.bootstrapSamples()];
        for (int i = 0; i < samples.length; i++) {
            double sum = 0.0;
            for (int j = 0; j < n; j++) {
                sum += values[random.nextInt(n)];
            }
            samples[i] = sum / spend;
        }
        Arrays.sort(samples);

        double alpha = 1.0 - settings.confidenceLevel();
        double low   = percentile(samples, alpha / 2.0);
        double high  = percentile(samples, 1.0 - alpha / 2.0);
        return new ConfidenceInterval(Math.min(low, high), Math.max(low, high));
    }

    public OutlierVerdict detectOutlier(double roas, int conversions, double spend) {
        return OutlierRule.evaluate(outlierRules, roas, conversions, spend);
    }

    /**
     * Percentile of an ascending-sorted sample, {@code fraction} in [0, 1].
     * Linear interpolation between the two closest ranks.
     */
    static double percentile(double[] sorted, double fraction) {
        if (sorted.length == 0) return 0.0;
        if (sorted.length == 1) return sorted[0];
        double rank = fraction * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        if (lower == upper) return sorted[lower];
        double weight = rank - lower;
        return sorted[lower] + (sorted[upper] - sorted[lower]) * weight;
    }
}
