package com.linlay.goapengine.event;

import com.linlay.goapengine.core.AgentProcess;

public class ProcessKilledEvent extends AbstractAgentProcessEvent {

    public ProcessKilledEvent(AgentProcess agentProcess) {
        super(agentProcess);
    }
}
