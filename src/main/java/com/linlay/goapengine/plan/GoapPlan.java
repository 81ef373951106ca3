package com.linlay.goapengine.plan;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Ordered actions that reach a goal from the world state the plan was formulated in.
 * An empty action list means the goal is already satisfied.
 */
public record GoapPlan(
        List<GoapAction> actions,
        GoapGoal goal,
        WorldState worldState
) {

    public GoapPlan {
        actions = actions == null ? List.of() : List.copyOf(actions);
        worldState = worldState == null ? WorldState.empty() : worldState;
    }

    public boolean isComplete() {
        return actions.isEmpty();
    }

    public double cost() {
        return actions.stream().mapToDouble(GoapAction::cost).sum();
    }

    public double actionsValue() {
        return actions.stream().mapToDouble(GoapAction::value).sum();
    }

    public double netValue() {
        return goal.value() + actionsValue() - cost();
    }

    public String infoString(boolean verbose) {
        String steps = actions.stream().map(GoapAction::name).collect(Collectors.joining(" -> "));
        if (!verbose) {
            return steps.isEmpty() ? "[" + goal.name() + "]" : steps + " -> [" + goal.name() + "]";
        }
        return "plan <" + steps + "> to " + goal.name()
                + "; cost=" + cost()
                + "; netValue=" + netValue()
                + "; worldState=" + worldState.infoString(false);
    }
}
