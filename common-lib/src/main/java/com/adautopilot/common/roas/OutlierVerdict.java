package com.adautopilot.common.roas;

public record OutlierVerdict(boolean outlier, String reason) {

    public static final OutlierVerdict NONE = new OutlierVerdict(false, null);

    public static OutlierVerdict of(String reason) {
        return new OutlierVerdict(true, reason);
    }
}
