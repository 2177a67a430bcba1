package com.adautopilot.common.model;

/**
 * Operations the Policy and Safety engines know how to validate.
 *
 * <p>The five {@link ActionType}s map one-to-one; {@link #CHANGE_CREATIVE} and
 * {@link #CREATE_CAMPAIGN} are guarded outside the optimization queue.
 */
public enum GuardedOperation {
    SCALE_UP,
    SCALE_DOWN,
    PAUSE,
    RESUME,
    REALLOCATE,
    CHANGE_CREATIVE,
    CREATE_CAMPAIGN;

    public static GuardedOperation of(ActionType type) {
        return switch (type) {
            case SCALE_UP   -> SCALE_UP;
            case SCALE_DOWN -> SCALE_DOWN;
            case PAUSE      -> PAUSE;
            case RESUME     -> RESUME;
            case REALLOCATE -> REALLOCATE;
        };
    }
}
