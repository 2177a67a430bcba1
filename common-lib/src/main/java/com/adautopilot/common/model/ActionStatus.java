package com.adautopilot.common.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of an optimization action.
 *
 * <pre>
 *   SUGGESTED ─approve→ PENDING ─execute→ EXECUTING ─success→ EXECUTED
 *       │                  │                  └──failure→ FAILED
 *       └──────cancel──────┴──→ CANCELLED
 * </pre>
 *
 * SUGGESTED may also go straight to EXECUTING (auto mode, or manual execute
 * without a prior approval).
 */
public enum ActionStatus {
    SUGGESTED,
    PENDING,
    EXECUTING,
    EXECUTED,
    FAILED,
    CANCELLED;

    /** Statuses an action may be executed or cancelled from. */
    public static final Set<ActionStatus> OPEN = EnumSet.of(SUGGESTED, PENDING);

    /** Statuses that still count against the one-per-target cooldown invariant. */
    public static final Set<ActionStatus> NON_TERMINAL = EnumSet.of(SUGGESTED, PENDING, EXECUTING);

    public boolean isTerminal() {
        return !NON_TERMINAL.contains(this);
    }

    public boolean isOpen() {
        return OPEN.contains(this);
    }
}
