package com.adautopilot.common.policy;

import com.adautopilot.common.model.BudgetAllocation;

import java.util.List;

/**
 * What an operation would change. Only the field relevant to the operation is set.
 *
 * @param newBudgetUsd daily budget after a scale up / scale down / pause
 * @param creative     creative being swapped in
 * @param draft        campaign being created
 * @param allocations  per-ad budgets of a reallocation
 */
public record ProposedChange(
    Double                 newBudgetUsd,
    CreativeMetadata       creative,
    CampaignDraft          draft,
    List<BudgetAllocation> allocations
) {

    public static ProposedChange none() {
        return new ProposedChange(null, null, null, List.of());
    }

    public static ProposedChange budget(double newBudgetUsd) {
        return new ProposedChange(newBudgetUsd, null, null, List.of());
    }

    public static ProposedChange creative(CreativeMetadata creative) {
        return new ProposedChange(null, creative, null, List.of());
    }

    public static ProposedChange campaign(CampaignDraft draft) {
        return new ProposedChange(draft.budgetUsd(), null, draft, List.of());
    }

    public static ProposedChange reallocation(List<BudgetAllocation> allocations) {
        return new ProposedChange(null, null, null, List.copyOf(allocations));
    }

    /** Amount the overspend check adds to today's spend. */
    public double proposedSpendUsd() {
        return newBudgetUsd == null ? 0.0 : newBudgetUsd;
    }
}
