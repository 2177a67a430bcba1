package com.adautopilot.common.roas;

import java.util.List;
import java.util.Optional;

/**
 * One entry of the ordered outlier rule chain.
 *
 * <p>Invariant: rules in {@link #DEFAULT_CHAIN} are evaluated top to bottom and the
 * first matching rule decides the reason. Reordering the list changes results
 * (a spend of $5 at ROAS 60 is "extremely high", not "low spend").
 */
public record OutlierRule(String name, Condition condition, Reason reason) {

    @FunctionalInterface
    public interface Condition {
        boolean matches(double roas, int conversions, double spend);
    }

    @FunctionalInterface
    public interface Reason {
        String describe(double roas, int conversions, double spend);
    }

    public static final List<OutlierRule> DEFAULT_CHAIN = List.of(
        new OutlierRule("extremely-high",
            (roas, conversions, spend) -> roas > 50,
            (roas, conversions, spend) -> "Extremely high ROAS (>50x)"),
        new OutlierRule("negative",
            (roas, conversions, spend) -> roas < 0,
            (roas, conversions, spend) -> "Negative ROAS"),
        new OutlierRule("low-spend-high-roas",
            (roas, conversions, spend) -> spend < 10 && roas > 10,
            (roas, conversions, spend) -> "Low spend (<$10) with high ROAS"),
        new OutlierRule("too-few-conversions",
            (roas, conversions, spend) -> conversions < 3 && roas > 5,
            (roas, conversions, spend) -> "Too few conversions (" + conversions + ") for reliable ROAS")
    );

    public static OutlierVerdict evaluate(List<OutlierRule> chain, double roas, int conversions, double spend) {
        Optional<OutlierRule> hit = chain.stream()
            .filter(rule -> rule.condition().matches(roas, conversions, spend))
            .findFirst();
        return hit
            .map(rule -> OutlierVerdict.of(rule.reason().describe(roas, conversions, spend)))
            .orElse(OutlierVerdict.NONE);
    }
}
