package com.linlay.goapengine.event;

import com.linlay.goapengine.core.policy.EarlyTermination;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes lifecycle events to the log. Per-binding events go to debug.
 */
public class LoggingAgenticEventListener implements AgenticEventListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingAgenticEventListener.class);

    @Override
    public void onPlatformEvent(AgentPlatformEvent event) {
        if (event instanceof AgentDeploymentEvent deployment) {
            log.info("[platform] deployed agent {}", deployment.agent().infoString(false));
            return;
        }
        log.info("[platform] {}", event);
    }

    @Override
    public void onProcessEvent(AgentProcessEvent event) {
        String processId = event.getProcessId();
        if (event instanceof ObjectAddedEvent || event instanceof ObjectBoundEvent
                || event instanceof AgentProcessReadyToPlanEvent) {
            log.debug("[{}] {}", processId, event);
        } else if (event instanceof AgentProcessPlanFormulatedEvent formulated) {
            log.info("[{}] formulated plan {}", processId, formulated.getPlan().infoString(false));
        } else if (event instanceof ActionExecutionStartEvent start) {
            log.info("[{}] executing action {}", processId, start.getActionName());
        } else if (event instanceof ActionExecutionResultEvent result) {
            log.info("[{}] action {} {} in {}ms", processId, result.getActionName(),
                    result.getActionStatus().status(), result.getRunningTime().toMillis());
        } else if (event instanceof GoalAchievedEvent achieved) {
            log.info("[{}] goal {} achieved", processId, achieved.getGoal().name());
        } else if (event instanceof EarlyTermination termination) {
            log.info("[{}] terminated early by {}: {}", processId, termination.getPolicy().name(), termination.getReason());
        } else if (event instanceof AgentProcessStuckEvent) {
            log.info("[{}] stuck: no plan to any goal", processId);
        } else {
            log.info("[{}] {}", processId, event.getClass().getSimpleName());
        }
    }
}
