package com.linlay.goapengine.core;

/**
 * Raised for a {@link ActionResult.Failed} result so that retry policies see the failure.
 */
public class ActionExecutionException extends RuntimeException {

    private final String actionName;

    public ActionExecutionException(String actionName, Throwable cause) {
        super("Action " + actionName + " failed: " + (cause == null ? "unknown error" : cause.getMessage()), cause);
        this.actionName = actionName;
    }

    public String getActionName() {
        return actionName;
    }
}
