package com.adautopilot.common.exception;

/**
 * The ad-platform call behind an executor failed. Recorded on the action as
 * FAILED, never propagated out of a tick.
 */
public class ActionExecutionException extends AutopilotException {

    private final String actionId;

    public ActionExecutionException(String actionId, String message) {
        super("[" + actionId + "] " + message);
        this.actionId = actionId;
    }

    public ActionExecutionException(String actionId, String message, Throwable cause) {
        super("[" + actionId + "] " + message, cause);
        this.actionId = actionId;
    }

    public String getActionId() {
        return actionId;
    }
}
