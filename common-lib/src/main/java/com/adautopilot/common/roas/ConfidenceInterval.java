package com.adautopilot.common.roas;

/**
 * Two-sided interval around a ROAS estimate. Invariant: {@code low <= high}.
 */
public record ConfidenceInterval(double low, double high) {

    public static final ConfidenceInterval ZERO = new ConfidenceInterval(0.0, 0.0);

    public ConfidenceInterval {
        if (low > high) {
            throw new IllegalArgumentException("Interval low " + low + " exceeds high " + high);
        }
    }
}
