package com.adautopilot.common.prediction;

public enum Trend {
    INCREASING,
    DECREASING,
    /** No history to compare. */
    UNKNOWN
}
