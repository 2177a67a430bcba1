package com.adautopilot.common.model;

import com.adautopilot.common.exception.ValidationException;

import java.util.Arrays;

/**
 * The closed set of optimization action types.
 *
 * <p>Every dispatch point (generation, guardrail mapping, execution) switches over
 * this enum exhaustively, so adding a type is a compile-time change everywhere.
 */
public enum ActionType {
    SCALE_UP("scale_up"),
    SCALE_DOWN("scale_down"),
    PAUSE("pause"),
    RESUME("resume"),
    REALLOCATE("reallocate");

    private final String wireName;

    ActionType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /** True for the types that change a daily budget by a percentage. */
    public boolean isBudgetChange() {
        return this == SCALE_UP || this == SCALE_DOWN;
    }

    /**
     * Parses either the wire name ({@code scale_up}) or the enum name ({@code SCALE_UP}).
     *
     * @throws ValidationException for anything else
     */
    public static ActionType fromWireName(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Action type is required");
        }
        String trimmed = value.trim();
        return Arrays.stream(values())
            .filter(t -> t.wireName.equalsIgnoreCase(trimmed) || t.name().equalsIgnoreCase(trimmed))
            .findFirst()
            .orElseThrow(() -> new ValidationException("Unknown action type: " + value));
    }
}
