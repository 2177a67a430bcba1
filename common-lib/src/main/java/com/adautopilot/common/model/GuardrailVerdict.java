package com.adautopilot.common.model;

/**
 * Result of a guardrail check. A block is a normal value carrying its reason,
 * never an exception.
 *
 * <p>The Policy Engine reads it as {@link #allowed()}, the Safety Engine as
 * {@link #blocked()}.
 */
public record GuardrailVerdict(boolean passed, String reason) {

    private static final GuardrailVerdict PASS = new GuardrailVerdict(true, null);

    public static GuardrailVerdict pass() {
        return PASS;
    }

    public static GuardrailVerdict block(String reason) {
        return new GuardrailVerdict(false, reason);
    }

    public boolean allowed() {
        return passed;
    }

    public boolean blocked() {
        return !passed;
    }

    /** Same verdict with the reason prefixed, passes are returned unchanged. */
    public GuardrailVerdict prefixed(String prefix) {
        return passed ? this : block(prefix + reason);
    }
}
