package com.adautopilot.optimization.service;

import com.adautopilot.common.config.AutopilotSettings.OptimizerSettings;
import com.adautopilot.common.model.BudgetAllocation;
import com.adautopilot.optimization.model.Ad;
import com.adautopilot.optimization.model.RoasMetricsRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.stream.Collectors;

/**
 * Splits a campaign's ad budgets in proportion to {@code roas * confidence}.
 *
 * <p>An ad below the pause threshold weighs nothing; one below the scale-down
 * threshold weighs half. Ads whose latest row is an outlier, has confidence below
 * {@code reallocateMinConfidence}, or whose ad has no daily budget, take no part:
 * they keep their budget and it is not counted in the total being redistributed.
 * New budgets are floored to the cent so their sum never exceeds the total.
 */
public class ReallocationPlanner {

    private final OptimizerSettings settings;

    public ReallocationPlanner(OptimizerSettings settings) {
        this.settings = settings;
    }

    /**
     * True when the campaign has enough ads and the ROAS spread between its best
     * and worst ad reaches {@code reallocateThresholdDiff}.
     */
    public boolean qualifies(Collection<RoasMetricsRecord> latestPerAd) {
        if (latestPerAd.size() < settings.reallocateMinAds()) {
            return false;
        }
        OptionalDouble max = latestPerAd.stream().mapToDouble(RoasMetricsPlanning::roas).max();
        OptionalDouble min = latestPerAd.stream().mapToDouble(RoasMetricsPlanning::roas).min();
        if (max.isEmpty() || min.isEmpty()) {
            return false;
        }
        if (min.getAsDouble() <= 0.0) {
            return max.getAsDouble() > 0.0;
        }
        return max.getAsDouble() / min.getAsDouble() >= settings.reallocateThresholdDiff();
    }

    /**
     * @param latestPerAd newest metrics row of each ad
     * @param adsById     the campaign's ads, for current budgets
     * @return allocations ordered by new budget, largest first; empty when no ad carries weight
     */
    public List<BudgetAllocation> plan(Collection<RoasMetricsRecord> latestPerAd, Map<String, Ad> adsById) {
        List<RoasMetricsRecord> eligible = latestPerAd.stream()
            .filter(r -> !r.isOutlierRow())
            .filter(r -> RoasMetricsPlanning.confidence(r) >= settings.reallocateMinConfidence())
            .filter(r -> currentBudget(adsById.get(r.getAdId())) > 0.0)
            .collect(Collectors.toList());

        double totalBudget = eligible.stream()
            .mapToDouble(r -> currentBudget(adsById.get(r.getAdId())))
            .sum();
        double totalWeight = eligible.stream().mapToDouble(this::weight).sum();
        if (eligible.size() < 2 || totalWeight <= 0.0) {
            return List.of();
        }

        List<BudgetAllocation> plan = new ArrayList<>();
        for (RoasMetricsRecord r : eligible) {
            double roas       = RoasMetricsPlanning.roas(r);
            double confidence = RoasMetricsPlanning.confidence(r);
            double weight     = weight(r);
            double current    = currentBudget(adsById.get(r.getAdId()));
            double proposed   = Math.floor(weight / totalWeight * totalBudget * 100.0) / 100.0;
            plan.add(new BudgetAllocation(r.getAdId(), roas, confidence, weight, current, proposed));
        }
        plan.sort(Comparator.comparingDouble(BudgetAllocation::newBudgetUsd).reversed());
        return plan;
    }

    double weight(RoasMetricsRecord row) {
        double roas = RoasMetricsPlanning.roas(row);
        if (roas < settings.pauseRoas()) {
            return 0.0;
        }
        double weight = roas * RoasMetricsPlanning.confidence(row);
        return roas < settings.scaleDownMaxRoas() ? weight * 0.5 : weight;
    }

    private static double currentBudget(Ad ad) {
        return ad == null || ad.getDailyBudgetUsd() == null ? 0.0 : ad.getDailyBudgetUsd();
    }
}
