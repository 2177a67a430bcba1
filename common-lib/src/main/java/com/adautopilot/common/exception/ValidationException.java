package com.adautopilot.common.exception;

/**
 * Malformed input (scope, date range, action type). Raised before any state change.
 */
public class ValidationException extends AutopilotException {

    public ValidationException(String message) {
        super(message);
    }
}
