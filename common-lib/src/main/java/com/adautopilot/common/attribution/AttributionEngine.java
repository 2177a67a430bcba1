package com.adautopilot.common.attribution;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Rewrites {@code attributionWeight} / {@code attributionModel} on a set of
 * conversions before they are aggregated into revenue.
 *
 * <pre>
 *   last_click, first_click  weight = 1.0 on every outcome
 *   linear                   weight = 1 / N
 *   time_decay               weight ∝ exp(-ln2/7 · daysBeforeLatest), normalised to Σ = 1
 * </pre>
 *
 * Unknown model names leave the outcomes untouched.
 */
public final class AttributionEngine {

    static final double HALF_LIFE_DAYS = 7.0;
    private static final double SECONDS_PER_DAY = 86_400.0;

    private AttributionEngine() {}

    /**
     * Applies the named model. Returns the same list instance; weights are mutated in place.
     */
    public static <T extends AttributedConversion> List<T> apply(List<T> outcomes, String modelName) {
        Optional<AttributionModel> model = AttributionModel.fromName(modelName);
        if (model.isEmpty()) {
            return outcomes;
        }
        return apply(outcomes, model.get());
    }

    public static <T extends AttributedConversion> List<T> apply(List<T> outcomes, AttributionModel model) {
        if (outcomes.isEmpty()) {
            return outcomes;
        }
        switch (model) {
            case LAST_CLICK, FIRST_CLICK -> assignUniform(outcomes, 1.0, model);
            case LINEAR                  -> assignUniform(outcomes, 1.0 / outcomes.size(), model);
            case TIME_DECAY              -> assignTimeDecay(outcomes);
        }
        return outcomes;
    }

    /** Revenue after attribution: Σ value × weight, a missing weight counts as 1.0. */
    public static double attributedRevenue(List<? extends AttributedConversion> outcomes) {
        return outcomes.stream()
            .mapToDouble(o -> value(o) * (o.getAttributionWeight() == null ? 1.0 : o.getAttributionWeight()))
            .sum();
    }

    private static void assignUniform(List<? extends AttributedConversion> outcomes, double weight,
                                      AttributionModel model) {
        for (AttributedConversion outcome : outcomes) {
            outcome.setAttributionWeight(weight);
            outcome.setAttributionModel(model.wireName());
        }
    }

    private static void assignTimeDecay(List<? extends AttributedConversion> outcomes) {
        double decayConstant = Math.log(2.0) / HALF_LIFE_DAYS;

        List<AttributedConversion> sorted = new ArrayList<>(outcomes);
        sorted.sort(Comparator.comparing(AttributedConversion::getEventTimestamp));
        LocalDateTime latest = sorted.get(sorted.size() - 1).getEventTimestamp();

        double[] raw = new double[sorted.size()];
        double total = 0.0;
        for (int i = 0; i < sorted.size(); i++) {
            double daysAgo = Duration.between(sorted.get(i).getEventTimestamp(), latest).toMillis()
                / 1000.0 / SECONDS_PER_DAY;
            raw[i] = Math.exp(-decayConstant * daysAgo);
            total += raw[i];
        }
        for (int i = 0; i < sorted.size(); i++) {
            sorted.get(i).setAttributionWeight(raw[i] / total);
            sorted.get(i).setAttributionModel(AttributionModel.TIME_DECAY.wireName());
        }
    }

    private static double value(AttributedConversion outcome) {
        return outcome.getValueUsd() == null ? 0.0 : outcome.getValueUsd();
    }
}
