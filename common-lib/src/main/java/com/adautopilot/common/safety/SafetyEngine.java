package com.adautopilot.common.safety;

import com.adautopilot.common.config.AutopilotSettings.SafetySettings;
import com.adautopilot.common.model.GuardedOperation;
import com.adautopilot.common.model.GuardrailVerdict;
import com.adautopilot.common.policy.CreativeMetadata;
import com.adautopilot.common.policy.GuardrailContext;
import com.adautopilot.common.policy.ProposedChange;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;

/**
 * Operational guardrails, independent of the Policy Engine. Both must pass.
 *
 * <h3>Chain order (first block wins)</h3>
 * <pre>
 *   1. embargo            all operations, skipped when createdAt is unknown
 *   2. minimum data       all operations
 *   3. roas confidence    SCALE_UP
 *   4. rate limit         all operations, skipped when there is no previous action
 *   5. overspend          SCALE_UP, CREATE_CAMPAIGN
 *   6. creative approval  CHANGE_CREATIVE
 * </pre>
 */
public final class SafetyEngine {

    private final SafetySettings settings;
    private final Clock clock;
    private final List<SafetyCheck> chain;

    public SafetyEngine(SafetySettings settings, Clock clock) {
        this.settings = settings;
        this.clock    = clock;
        this.chain    = List.of(
            SafetyCheck.always("embargo", (change, ctx) ->
                ctx.createdAt() == null ? GuardrailVerdict.pass() : enforceEmbargoPeriod(ctx.createdAt())),
            SafetyCheck.always("minimum-data", (change, ctx) ->
                checkMinimumData(ctx.impressions(), ctx.spend())),
            SafetyCheck.only("roas-confidence", EnumSet.of(GuardedOperation.SCALE_UP), (change, ctx) ->
                validateRoasConfidence(ctx.roas(), ctx.confidence())),
            SafetyCheck.always("rate-limit", (change, ctx) ->
                checkActionRateLimit(ctx.entityId(), ctx.lastActionTime())),
            SafetyCheck.only("overspend",
                EnumSet.of(GuardedOperation.SCALE_UP, GuardedOperation.CREATE_CAMPAIGN), (change, ctx) ->
                preventOverspend(ctx.spendToday(), change.proposedSpendUsd())),
            SafetyCheck.only("creative-approval", EnumSet.of(GuardedOperation.CHANGE_CREATIVE), (change, ctx) ->
                blockUnapprovedCreatives(change.creative()))
        );
    }

    public GuardrailVerdict preventOverspend(double spendToday, double proposed) {
        return preventOverspend(spendToday, proposed, settings.maxDailySpendUsd());
    }

    public GuardrailVerdict preventOverspend(double spendToday, double proposed, double cap) {
        if (spendToday >= cap) {
            return GuardrailVerdict.block(String.format(
                "Daily spend limit reached: $%.2f >= $%.2f", spendToday, cap));
        }
        double projected = spendToday + proposed;
        if (projected > cap) {
            return GuardrailVerdict.block(String.format(
                "Proposed budget $%.2f would exceed daily limit: $%.2f > $%.2f", proposed, projected, cap));
        }
        return GuardrailVerdict.pass();
    }

    public GuardrailVerdict enforceEmbargoPeriod(LocalDateTime createdAt) {
        return enforceEmbargoPeriod(createdAt, settings.minAgeHours());
    }

    public GuardrailVerdict enforceEmbargoPeriod(LocalDateTime createdAt, int embargoHours) {
        double age = hoursSince(createdAt);
        if (age < embargoHours) {
            return GuardrailVerdict.block(String.format(
                "Entity in embargo: %.1fh < %dh required (created: %s)", age, embargoHours, createdAt));
        }
        return GuardrailVerdict.pass();
    }

    public GuardrailVerdict blockUnapprovedCreatives(CreativeMetadata creative) {
        if (!settings.requireHumanApprovalCreatives()) {
            return GuardrailVerdict.pass();
        }
        if (creative == null || !creative.isHumanApproved()) {
            String id = creative == null || creative.creativeId() == null ? "unknown" : creative.creativeId();
            return GuardrailVerdict.block("Creative " + id + " requires human approval");
        }
        return GuardrailVerdict.pass();
    }

    public GuardrailVerdict checkMinimumData(long impressions, double spend) {
        if (impressions < settings.minImpressions()) {
            return GuardrailVerdict.block(String.format(
                "Insufficient impressions: %d < %d required", impressions, settings.minImpressions()));
        }
        if (spend < settings.minSpendUsd()) {
            return GuardrailVerdict.block(String.format(
                "Insufficient spend: $%.2f < $%.2f required", spend, settings.minSpendUsd()));
        }
        return GuardrailVerdict.pass();
    }

    public GuardrailVerdict checkActionRateLimit(String entityId, LocalDateTime lastActionTime) {
        return checkActionRateLimit(entityId, lastActionTime, settings.rateLimitCooldownHours());
    }

    public GuardrailVerdict checkActionRateLimit(String entityId, LocalDateTime lastActionTime, int cooldownHours) {
        if (lastActionTime == null) {
            return GuardrailVerdict.pass();
        }
        double since = hoursSince(lastActionTime);
        if (since < cooldownHours) {
            return GuardrailVerdict.block(String.format(
                "Rate limit: %.1fh since last action < %dh cooldown (entity: %s)",
                since, cooldownHours, entityId == null ? "unknown" : entityId));
        }
        return GuardrailVerdict.pass();
    }

    public GuardrailVerdict validateRoasConfidence(double roas, double confidence) {
        if (roas < settings.dangerousRoas() && confidence > settings.dangerousConfidence()) {
            return GuardrailVerdict.block(String.format(
                "Dangerously low ROAS %.2f with high confidence %.0f%%", roas, confidence * 100));
        }
        if (roas < 0) {
            return GuardrailVerdict.block(String.format("Negative ROAS %.2f is invalid", roas));
        }
        return GuardrailVerdict.pass();
    }

    /** Runs the chain in order and returns the first block, or a pass. */
    public GuardrailVerdict validateAction(GuardedOperation operation, ProposedChange change,
                                           GuardrailContext context) {
        for (SafetyCheck check : chain) {
            if (!check.appliesTo(operation)) continue;
            GuardrailVerdict verdict = check.check().evaluate(change, context);
            if (verdict.blocked()) {
                return verdict;
            }
        }
        return GuardrailVerdict.pass();
    }

    List<SafetyCheck> chain() {
        return chain;
    }

    private double hoursSince(LocalDateTime time) {
        return Duration.between(time, LocalDateTime.now(clock)).toMillis() / 3_600_000.0;
    }
}
