package com.adautopilot.optimization.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Audit record appended to the event ledger.
 */
public record LedgerEvent(
    @JsonProperty("eventType")  String eventType,
    @JsonProperty("actionId")   String actionId,
    @JsonProperty("actionType") String actionType,
    @JsonProperty("targetId")   String targetId,
    @JsonProperty("actor")      String actor,
    @JsonProperty("occurredAt") LocalDateTime occurredAt,
    @JsonProperty("details")    Map<String, Object> details
) {
    public static LedgerEvent of(LedgerEventType type, String actionId, String actionType, String targetId,
                                 String actor, LocalDateTime occurredAt, Map<String, Object> details) {
        return new LedgerEvent(type.wireName(), actionId, actionType, targetId, actor, occurredAt,
            details == null ? Map.of() : details);
    }
}
