package com.linlay.goapengine.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

/**
 * Runs an action body once, timing it and applying its {@link ActionResult} to the process.
 */
public final class ActionRunner {

    private static final Logger log = LoggerFactory.getLogger(ActionRunner.class);

    private ActionRunner() {
    }

    /**
     * @throws ActionExecutionException when the body returns {@link ActionResult.Failed}
     */
    public static ActionStatus execute(ProcessContext processContext, Action action, ActionBody body) {
        Instant start = Instant.now();
        try {
            ActionResult result = body.execute(processContext);
            if (result == null) {
                result = ActionResult.done();
            }
            if (result instanceof ActionResult.Failed failed) {
                throw new ActionExecutionException(action.name(), failed.error());
            }
            if (result instanceof ActionResult.Waiting waiting) {
                processContext.addObject(waiting.awaitable());
                log.debug("Action {} waiting on {}", action.name(), waiting.awaitable().infoString());
                return new ActionStatus(Duration.between(start, Instant.now()), ActionStatusCode.WAITING);
            }
            bindOutput(processContext, action, ((ActionResult.Completed) result).value());
            return new ActionStatus(Duration.between(start, Instant.now()), ActionStatusCode.SUCCEEDED);
        } catch (RuntimeException ex) {
            log.warn("Action {} failed after {}ms: {}", action.name(),
                    Duration.between(start, Instant.now()).toMillis(), ex.getMessage());
            log.debug("Action {} failure detail", action.name(), ex);
            throw ex;
        }
    }

    private static void bindOutput(ProcessContext processContext, Action action, Object value) {
        if (value == null) {
            return;
        }
        if (action.outputs().size() == 1) {
            String name = action.outputs().iterator().next().name();
            if (!IoBinding.DEFAULT_BINDING.equals(name)) {
                processContext.bind(name, value);
                return;
            }
        }
        processContext.addObject(value);
    }
}
