package com.linlay.goapengine.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.linlay.goapengine.core.Action;
import com.linlay.goapengine.core.ActionStatus;
import com.linlay.goapengine.core.AgentProcess;

import java.time.Duration;

public class ActionExecutionResultEvent extends AbstractAgentProcessEvent {

    @JsonIgnore
    private final Action action;
    private final ActionStatus actionStatus;
    private final Duration runningTime;

    public ActionExecutionResultEvent(AgentProcess agentProcess, Action action, ActionStatus actionStatus, Duration runningTime) {
        super(agentProcess);
        this.action = action;
        this.actionStatus = actionStatus;
        this.runningTime = runningTime;
    }

    @JsonIgnore
    public Action getAction() {
        return action;
    }

    public String getActionName() {
        return action.name();
    }

    public ActionStatus getActionStatus() {
        return actionStatus;
    }

    public Duration getRunningTime() {
        return runningTime;
    }
}
