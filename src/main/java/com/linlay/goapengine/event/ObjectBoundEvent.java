package com.linlay.goapengine.event;

import com.linlay.goapengine.core.AgentProcess;

public class ObjectBoundEvent extends AbstractAgentProcessEvent {

    private final String name;
    private final Object value;

    public ObjectBoundEvent(AgentProcess agentProcess, String name, Object value) {
        super(agentProcess);
        this.name = name;
        this.value = value;
    }

    public String getName() {
        return name;
    }

    public Object getValue() {
        return value;
    }
}
