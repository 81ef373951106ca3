package com.linlay.goapengine.plan;

import java.util.Map;
import java.util.Set;

/**
 * Common shape of planning actions and goals.
 */
public interface GoapStep {

    String name();

    Map<String, ConditionDetermination> preconditions();

    double value();

    default Set<String> knownConditions() {
        return preconditions().keySet();
    }

    /**
     * A step is achievable when every precondition matches the state exactly.
     * Conditions absent from the state never match.
     */
    default boolean isAchievable(WorldState state) {
        for (Map.Entry<String, ConditionDetermination> entry : preconditions().entrySet()) {
            if (state.get(entry.getKey()) != entry.getValue()) {
                return false;
            }
        }
        return true;
    }
}
