package com.adautopilot.common.exception;

import com.adautopilot.common.model.ActionStatus;

/**
 * An approve / execute / cancel was attempted on an action in the wrong phase.
 * Carries the status that was observed so callers can report the conflict.
 */
public class InvalidStateException extends AutopilotException {

    private final String actionId;
    private final ActionStatus currentStatus;

    public InvalidStateException(String actionId, ActionStatus currentStatus, String operation) {
        super("Action " + actionId + " status is " + currentStatus + ", cannot " + operation);
        this.actionId      = actionId;
        this.currentStatus = currentStatus;
    }

    public String getActionId() {
        return actionId;
    }

    public ActionStatus getCurrentStatus() {
        return currentStatus;
    }
}
