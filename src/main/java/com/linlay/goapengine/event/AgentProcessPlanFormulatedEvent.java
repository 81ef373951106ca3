package com.linlay.goapengine.event;

import com.linlay.goapengine.core.AgentProcess;
import com.linlay.goapengine.plan.GoapPlan;
import com.linlay.goapengine.plan.WorldState;

public class AgentProcessPlanFormulatedEvent extends WorldStateEvent {

    private final GoapPlan plan;

    public AgentProcessPlanFormulatedEvent(AgentProcess agentProcess, WorldState worldState, GoapPlan plan) {
        super(agentProcess, worldState);
        this.plan = plan;
    }

    public GoapPlan getPlan() {
        return plan;
    }
}
