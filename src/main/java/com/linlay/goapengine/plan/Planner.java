package com.linlay.goapengine.plan;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Finds plans from the current world state to one or more goals.
 */
public interface Planner {

    WorldState worldState();

    /**
     * @return the plan, or null when the goal cannot be reached
     */
    GoapPlan planToGoal(Collection<? extends GoapAction> actions, GoapGoal goal);

    /**
     * Plans for every reachable goal, best net value first.
     */
    default List<GoapPlan> plansToGoals(GoapPlanningSystem planningSystem) {
        List<GoapPlan> plans = new ArrayList<>();
        for (GoapGoal goal : planningSystem.goals()) {
            GoapPlan plan = planToGoal(planningSystem.actions(), goal);
            if (plan != null) {
                plans.add(plan);
            }
        }
        plans.sort(Comparator.comparingDouble(GoapPlan::netValue).reversed()
                .thenComparingInt(plan -> plan.actions().size())
                .thenComparing(plan -> plan.goal().name()));
        return plans;
    }

    /**
     * @return the highest net value plan, or null when no goal is reachable
     */
    default GoapPlan bestValuePlanToAnyGoal(GoapPlanningSystem planningSystem) {
        List<GoapPlan> plans = plansToGoals(planningSystem);
        return plans.isEmpty() ? null : plans.get(0);
    }
}
