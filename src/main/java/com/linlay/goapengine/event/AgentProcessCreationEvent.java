package com.linlay.goapengine.event;

import com.linlay.goapengine.core.AgentProcess;

public class AgentProcessCreationEvent extends AbstractAgentProcessEvent {

    public AgentProcessCreationEvent(AgentProcess agentProcess) {
        super(agentProcess);
    }
}
