package com.adautopilot.common.prediction;

public record ExpectedValue(double expectedValue, double expectedRevenue, double breakevenRate, boolean isProfitable) {}
