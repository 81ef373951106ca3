package com.linlay.goapengine.event;

import com.linlay.goapengine.core.AgentProcess;

public class AgentProcessWaitingEvent extends AbstractAgentProcessEvent {

    public AgentProcessWaitingEvent(AgentProcess agentProcess) {
        super(agentProcess);
    }
}
