package com.adautopilot.optimization.ledger;

public enum LedgerEventType {
    OPTIMIZATION_SUGGESTED("optimization_suggested"),
    OPTIMIZATION_APPROVED("optimization_approved"),
    OPTIMIZATION_EXECUTED("optimization_executed"),
    OPTIMIZATION_FAILED("optimization_failed"),
    OPTIMIZATION_CANCELLED("optimization_cancelled"),
    OPTIMIZATION_EXPIRED("optimization_expired");

    private final String wireName;

    LedgerEventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
