package com.linlay.goapengine.event;

import com.linlay.goapengine.core.AgentProcess;

public class AgentProcessStuckEvent extends AbstractAgentProcessEvent {

    public AgentProcessStuckEvent(AgentProcess agentProcess) {
        super(agentProcess);
    }
}
