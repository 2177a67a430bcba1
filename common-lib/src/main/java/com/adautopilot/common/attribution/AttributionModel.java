package com.adautopilot.common.attribution;

import java.util.Arrays;
import java.util.Optional;

public enum AttributionModel {
    LAST_CLICK("last_click"),
    FIRST_CLICK("first_click"),
    LINEAR("linear"),
    TIME_DECAY("time_decay");

    private final String wireName;

    AttributionModel(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /** Empty for names no model answers to; callers decide what unknown means. */
    public static Optional<AttributionModel> fromName(String name) {
        if (name == null) return Optional.empty();
        String trimmed = name.trim();
        return Arrays.stream(values())
            .filter(m -> m.wireName.equalsIgnoreCase(trimmed) || m.name().equalsIgnoreCase(trimmed))
            .findFirst();
    }
}
