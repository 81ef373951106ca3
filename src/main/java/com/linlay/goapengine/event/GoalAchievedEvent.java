package com.linlay.goapengine.event;

import com.linlay.goapengine.core.AgentProcess;
import com.linlay.goapengine.core.Goal;
import com.linlay.goapengine.plan.WorldState;

public class GoalAchievedEvent extends WorldStateEvent {

    private final Goal goal;

    public GoalAchievedEvent(AgentProcess agentProcess, WorldState worldState, Goal goal) {
        super(agentProcess, worldState);
        this.goal = goal;
    }

    public Goal getGoal() {
        return goal;
    }
}
