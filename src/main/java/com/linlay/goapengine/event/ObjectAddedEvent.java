package com.linlay.goapengine.event;

import com.linlay.goapengine.core.AgentProcess;

public class ObjectAddedEvent extends AbstractAgentProcessEvent {

    private final Object value;

    public ObjectAddedEvent(AgentProcess agentProcess, Object value) {
        super(agentProcess);
        this.value = value;
    }

    public Object getValue() {
        return value;
    }
}
