package com.linlay.goapengine.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.linlay.goapengine.core.Action;
import com.linlay.goapengine.core.ActionStatus;
import com.linlay.goapengine.core.AgentProcess;

import java.time.Duration;
import java.time.Instant;

public class ActionExecutionStartEvent extends AbstractAgentProcessEvent {

    @JsonIgnore
    private final Action action;

    public ActionExecutionStartEvent(AgentProcess agentProcess, Action action) {
        super(agentProcess);
        this.action = action;
    }

    @JsonIgnore
    public Action getAction() {
        return action;
    }

    public String getActionName() {
        return action.name();
    }

    /**
     * The matching result event, timed from this start event.
     */
    public ActionExecutionResultEvent resultEvent(ActionStatus actionStatus) {
        return new ActionExecutionResultEvent(getAgentProcess(), action, actionStatus,
                Duration.between(getTimestamp(), Instant.now()));
    }
}
