package com.linlay.goapengine.event;

import com.linlay.goapengine.core.AgentProcess;

public class AgentProcessPausedEvent extends AbstractAgentProcessEvent {

    public AgentProcessPausedEvent(AgentProcess agentProcess) {
        super(agentProcess);
    }
}
