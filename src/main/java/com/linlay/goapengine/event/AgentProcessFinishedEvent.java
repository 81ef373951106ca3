package com.linlay.goapengine.event;

import com.linlay.goapengine.core.AgentProcess;

/**
 * Emitted when a run ends COMPLETED or FAILED.
 */
public class AgentProcessFinishedEvent extends AbstractAgentProcessEvent {

    public AgentProcessFinishedEvent(AgentProcess agentProcess) {
        super(agentProcess);
    }
}
