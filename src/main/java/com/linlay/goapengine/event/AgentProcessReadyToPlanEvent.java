package com.linlay.goapengine.event;

import com.linlay.goapengine.core.AgentProcess;
import com.linlay.goapengine.plan.WorldState;

public class AgentProcessReadyToPlanEvent extends WorldStateEvent {

    public AgentProcessReadyToPlanEvent(AgentProcess agentProcess, WorldState worldState) {
        super(agentProcess, worldState);
    }
}
