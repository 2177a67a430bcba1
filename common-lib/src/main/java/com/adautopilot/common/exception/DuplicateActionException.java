package com.adautopilot.common.exception;

import com.adautopilot.common.model.ActionType;

/**
 * An enqueue found an open or recently executed action of the same type on the target.
 */
public class DuplicateActionException extends AutopilotException {

    private final String     targetId;
    private final ActionType actionType;

    public DuplicateActionException(String targetId, ActionType actionType) {
        super("Target " + targetId + " already has an open or recent " + actionType.wireName() + " action");
        this.targetId   = targetId;
        this.actionType = actionType;
    }

    public String getTargetId() {
        return targetId;
    }

    public ActionType getActionType() {
        return actionType;
    }
}
