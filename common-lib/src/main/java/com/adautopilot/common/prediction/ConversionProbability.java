package com.adautopilot.common.prediction;

/**
 * Posterior mean conversion rate with its 95% credible interval.
 */
public record ConversionProbability(double probability, double credibleIntervalLow, double credibleIntervalHigh) {

    public static final ConversionProbability ZERO = new ConversionProbability(0.0, 0.0, 0.0);
}
