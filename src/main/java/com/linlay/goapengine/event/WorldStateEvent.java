package com.linlay.goapengine.event;

import com.linlay.goapengine.core.AgentProcess;
import com.linlay.goapengine.plan.WorldState;

public abstract class WorldStateEvent extends AbstractAgentProcessEvent {

    private final WorldState worldState;

    protected WorldStateEvent(AgentProcess agentProcess, WorldState worldState) {
        super(agentProcess);
        this.worldState = worldState;
    }

    public WorldState getWorldState() {
        return worldState;
    }
}
