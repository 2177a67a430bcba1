package com.adautopilot.common.prediction;

/**
 * EMA forecast over daily ROAS history.
 *
 * @param confidence       {@code min(historicalPoints / fullConfidencePoints, 1.0)}
 * @param historicalPoints number of daily rows the forecast used
 */
public record RoasPrediction(double predictedRoas, double confidence, int historicalPoints, Trend trend) {}
