package com.adautopilot.common.exception;

/**
 * Root of the decision-core error taxonomy. Guardrail blocks are not exceptions;
 * see {@link com.adautopilot.common.model.GuardrailVerdict}.
 */
public class AutopilotException extends RuntimeException {

    public AutopilotException(String message) {
        super(message);
    }

    public AutopilotException(String message, Throwable cause) {
        super(message, cause);
    }
}
