package com.linlay.goapengine.plan;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * The actions and goals a planner may choose between.
 */
public record GoapPlanningSystem(
        Set<GoapAction> actions,
        Set<GoapGoal> goals
) {

    public GoapPlanningSystem {
        actions = actions == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(actions));
        goals = goals == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(goals));
    }

    public static GoapPlanningSystem of(
            Collection<? extends GoapAction> actions,
            Collection<? extends GoapGoal> goals
    ) {
        return new GoapPlanningSystem(new LinkedHashSet<>(actions), new LinkedHashSet<>(goals));
    }

    /**
     * Every condition named by an action or a goal. The world state determiner evaluates exactly these.
     */
    public Set<String> knownConditions() {
        Set<String> known = new LinkedHashSet<>();
        for (GoapAction action : actions) {
            known.addAll(action.knownConditions());
        }
        for (GoapGoal goal : goals) {
            known.addAll(goal.knownConditions());
        }
        return known;
    }
}
