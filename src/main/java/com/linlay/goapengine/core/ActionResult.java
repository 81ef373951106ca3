package com.linlay.goapengine.core;

import com.linlay.goapengine.core.hitl.Awaitable;

/**
 * Outcome of an action body. Failures are returned, not thrown.
 */
public sealed interface ActionResult permits ActionResult.Completed, ActionResult.Waiting, ActionResult.Failed {

    static ActionResult completed(Object value) {
        return new Completed(value);
    }

    static ActionResult done() {
        return new Completed(null);
    }

    static ActionResult waiting(Awaitable<?, ?> awaitable) {
        return new Waiting(awaitable);
    }

    static ActionResult failed(Throwable error) {
        return new Failed(error);
    }

    static ActionResult failed(String message) {
        return new Failed(new IllegalStateException(message));
    }

    /**
     * @param value bound to the action's output; may be null when the action only has side effects
     */
    record Completed(Object value) implements ActionResult {
    }

    record Waiting(Awaitable<?, ?> awaitable) implements ActionResult {
        public Waiting {
            if (awaitable == null) {
                throw new IllegalArgumentException("awaitable is required");
            }
        }
    }

    record Failed(Throwable error) implements ActionResult {
        public Failed {
            error = error == null ? new IllegalStateException("Action failed") : error;
        }
    }
}
