package com.adautopilot.common.policy;

import java.time.LocalDateTime;

/**
 * Snapshot both guardrail engines read. Built by the caller, never mutated by the engines.
 *
 * @param isAutoMode         true only when the change is about to be applied without a human
 * @param currentBudget      the target's daily budget before the change
 * @param roas               aggregate ROAS over the evaluation window
 * @param confidence         aggregate confidence over the evaluation window
 * @param spend              spend over the evaluation window
 * @param impressions        impressions over the evaluation window
 * @param createdAt          entity creation time, null skips the embargo check
 * @param entityId           id used in rate-limit reasons
 * @param spendToday         spend booked so far today
 * @param lastActionTime     last same-type action on the entity, null when none
 * @param lastCreativeChange last creative swap, null when none
 */
public record GuardrailContext(
    boolean       isAutoMode,
    double        currentBudget,
    double        roas,
    double        confidence,
    double        spend,
    long          impressions,
    LocalDateTime createdAt,
    String        entityId,
    double        spendToday,
    LocalDateTime lastActionTime,
    LocalDateTime lastCreativeChange
) {

    public GuardrailContext withAutoMode(boolean autoMode) {
        return new GuardrailContext(autoMode, currentBudget, roas, confidence, spend, impressions,
            createdAt, entityId, spendToday, lastActionTime, lastCreativeChange);
    }

    public GuardrailContext withLastActionTime(LocalDateTime lastAction) {
        return new GuardrailContext(isAutoMode, currentBudget, roas, confidence, spend, impressions,
            createdAt, entityId, spendToday, lastAction, lastCreativeChange);
    }
}
