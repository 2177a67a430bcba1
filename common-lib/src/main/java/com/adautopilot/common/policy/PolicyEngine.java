package com.adautopilot.common.policy;

import com.adautopilot.common.config.AutopilotSettings.PolicySettings;
import com.adautopilot.common.model.BudgetAllocation;
import com.adautopilot.common.model.GuardedOperation;
import com.adautopilot.common.model.GuardrailVerdict;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Business-rule validator: budget caps, hard stop, geo distribution, creative approval.
 *
 * <p>Stateless apart from its settings and clock. Every check returns a
 * {@link GuardrailVerdict}; {@link GuardrailVerdict#allowed()} is the answer.
 */
public final class PolicyEngine {

    /** Float noise allowed on a percentage cap, so a change of exactly the cap passes. */
    static final double CAP_TOLERANCE = 1e-9;

    private final PolicySettings settings;
    private final Clock clock;

    public PolicyEngine(PolicySettings settings, Clock clock) {
        this.settings = settings;
        this.clock    = clock;
    }

    /**
     * Budget change {@code current → proposed}. A change to zero is a pause and is
     * always allowed. Otherwise the relative change must stay within the auto cap
     * (auto mode) or the daily cap (manual), and the new budget under the campaign cap.
     */
    public GuardrailVerdict canScaleBudget(double currentBudget, double newBudget, boolean isAutoMode) {
        if (currentBudget <= 0) {
            return GuardrailVerdict.block("Current budget must be positive");
        }
        if (newBudget == 0.0) {
            return GuardrailVerdict.pass();
        }
        double changePct = Math.abs(newBudget - currentBudget) / currentBudget;
        double cap = isAutoMode ? settings.maxAutoChangePct() : settings.maxDailyChangePct();
        if (changePct > cap + CAP_TOLERANCE) {
            return GuardrailVerdict.block(String.format(
                "Change %.1f%% exceeds %s limit %.1f%% ($%.2f -> $%.2f)",
                changePct * 100, isAutoMode ? "auto" : "daily", cap * 100, currentBudget, newBudget));
        }
        if (newBudget > settings.maxCampaignBudgetUsd()) {
            return GuardrailVerdict.block(String.format(
                "New budget $%.2f exceeds limit $%.2f", newBudget, settings.maxCampaignBudgetUsd()));
        }
        return GuardrailVerdict.pass();
    }

    /**
     * Hard stop. Only evaluated once spend reaches the minimum; halts when ROAS is
     * under the hard-stop line at or above the hard-stop confidence.
     *
     * @return true when the entity must be halted
     */
    public boolean mustHalt(double roas, double confidence, double spend) {
        return haltReason(roas, confidence, spend) != null;
    }

    /** Reason for a hard stop, null when none applies. */
    public String haltReason(double roas, double confidence, double spend) {
        if (spend < settings.minSpendUsd()) {
            return null;
        }
        if (roas < settings.hardStopRoas() && confidence >= settings.hardStopConfidence()) {
            return String.format("HARD STOP: ROAS %.2f < %.2f with confidence %.0f%% (spend: $%.2f)",
                roas, settings.hardStopRoas(), confidence * 100, spend);
        }
        return null;
    }

    public GuardrailVerdict validateGeoDistribution(Map<String, Double> distribution, List<String> countries) {
        if (distribution == null || distribution.isEmpty()) {
            return GuardrailVerdict.block("Distribution is empty");
        }
        String home = settings.homeMarket();
        if (countries.contains(home)) {
            double homeShare = distribution.getOrDefault(home, 0.0);
            if (homeShare < settings.minHomePct()) {
                return GuardrailVerdict.block(String.format(
                    "Home market %s share below minimum %.0f%% (current: %.0f%%)",
                    home, settings.minHomePct() * 100, homeShare * 100));
            }
        }
        if (countries.size() > 1) {
            double largest = Collections.max(distribution.values());
            if (largest > settings.maxSingleCountryPct()) {
                return GuardrailVerdict.block(String.format(
                    "No country may exceed %.0f%% of budget (found: %.0f%%)",
                    settings.maxSingleCountryPct() * 100, largest * 100));
            }
        }
        double total = distribution.values().stream().mapToDouble(Double::doubleValue).sum();
        if (Math.abs(total - 1.0) > settings.distributionTolerance()) {
            return GuardrailVerdict.block(String.format(
                "Distribution must sum to 100%% (current: %.1f%%)", total * 100));
        }
        return GuardrailVerdict.pass();
    }

    public GuardrailVerdict canChangeCreative(CreativeMetadata creative, LocalDateTime lastChange) {
        if (settings.requireHumanApprovalCreatives() && (creative == null || !creative.isHumanApproved())) {
            return GuardrailVerdict.block("Creative requires human approval");
        }
        if (lastChange != null) {
            double hoursSince = hoursSince(lastChange);
            if (hoursSince < settings.creativeEmbargoHours()) {
                return GuardrailVerdict.block(String.format(
                    "Creative embargo: %.1fh < %dh required", hoursSince, settings.creativeEmbargoHours()));
            }
        }
        return GuardrailVerdict.pass();
    }

    public GuardrailVerdict canCreateCampaign(CampaignDraft draft) {
        if (draft.budgetUsd() <= 0) {
            return GuardrailVerdict.block("Budget must be positive");
        }
        if (draft.budgetUsd() > settings.maxCampaignBudgetUsd()) {
            return GuardrailVerdict.block(String.format(
                "Budget exceeds limit: $%.2f > $%.2f", draft.budgetUsd(), settings.maxCampaignBudgetUsd()));
        }
        if (draft.pixelId() == null || draft.pixelId().isBlank()) {
            return GuardrailVerdict.block("Pixel ID is required");
        }
        List<String> countries = draft.countries() == null ? List.of() : draft.countries();
        if (countries.isEmpty()) {
            return GuardrailVerdict.block("At least one country is required");
        }
        if (countries.size() > 1) {
            return validateGeoDistribution(draft.budgetDistribution(), countries);
        }
        return GuardrailVerdict.pass();
    }

    /**
     * A reallocation moves budget between ads of one campaign. No single ad may end
     * above the campaign budget cap and the plan may not grow the total.
     */
    public GuardrailVerdict canReallocate(List<BudgetAllocation> allocations) {
        if (allocations == null || allocations.isEmpty()) {
            return GuardrailVerdict.block("Reallocation plan is empty");
        }
        double currentTotal = 0.0;
        double newTotal     = 0.0;
        for (BudgetAllocation allocation : allocations) {
            if (allocation.newBudgetUsd() < 0) {
                return GuardrailVerdict.block("Negative allocation for ad " + allocation.adId());
            }
            if (allocation.newBudgetUsd() > settings.maxCampaignBudgetUsd()) {
                return GuardrailVerdict.block(String.format(
                    "Allocation $%.2f for ad %s exceeds limit $%.2f",
                    allocation.newBudgetUsd(), allocation.adId(), settings.maxCampaignBudgetUsd()));
            }
            currentTotal += allocation.currentBudgetUsd();
            newTotal     += allocation.newBudgetUsd();
        }
        if (newTotal > currentTotal + settings.distributionTolerance()) {
            return GuardrailVerdict.block(String.format(
                "Reallocation grows total budget: $%.2f > $%.2f", newTotal, currentTotal));
        }
        return GuardrailVerdict.pass();
    }

    public GuardrailVerdict validateAction(GuardedOperation operation, ProposedChange change,
                                           GuardrailContext context) {
        return switch (operation) {
            case SCALE_UP, SCALE_DOWN -> canScaleBudget(
                context.currentBudget(),
                change.newBudgetUsd() == null ? 0.0 : change.newBudgetUsd(),
                context.isAutoMode());
            case PAUSE -> GuardrailVerdict.pass();
            case RESUME -> {
                String halt = haltReason(context.roas(), context.confidence(), context.spend());
                yield halt == null ? GuardrailVerdict.pass() : GuardrailVerdict.block("Cannot resume: " + halt);
            }
            case REALLOCATE      -> canReallocate(change.allocations());
            case CHANGE_CREATIVE -> canChangeCreative(change.creative(), context.lastCreativeChange());
            case CREATE_CAMPAIGN -> change.draft() == null
                ? GuardrailVerdict.block("Campaign draft is required")
                : canCreateCampaign(change.draft());
        };
    }

    private double hoursSince(LocalDateTime time) {
        return Duration.between(time, LocalDateTime.now(clock)).toMillis() / 3_600_000.0;
    }
}
