package com.linlay.goapengine.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.linlay.goapengine.core.AgentProcess;

import java.time.Instant;

public abstract class AbstractAgentProcessEvent implements AgentProcessEvent {

    @JsonIgnore
    private final AgentProcess agentProcess;
    private final String processId;
    private final Instant timestamp;

    protected AbstractAgentProcessEvent(AgentProcess agentProcess) {
        this.agentProcess = agentProcess;
        this.processId = agentProcess.id();
        this.timestamp = Instant.now();
    }

    @JsonIgnore
    public AgentProcess getAgentProcess() {
        return agentProcess;
    }

    @Override
    public String getProcessId() {
        return processId;
    }

    @Override
    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + processId + ")";
    }
}
