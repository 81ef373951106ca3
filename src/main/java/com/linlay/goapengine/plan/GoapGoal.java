package com.linlay.goapengine.plan;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

public interface GoapGoal extends GoapStep {

    static GoapGoal of(String name, Collection<String> requiredConditions, double value) {
        Map<String, ConditionDetermination> preconditions = new LinkedHashMap<>();
        for (String condition : requiredConditions) {
            preconditions.put(condition, ConditionDetermination.TRUE);
        }
        return new SimpleGoapGoal(name, preconditions, value);
    }

    record SimpleGoapGoal(
            String name,
            Map<String, ConditionDetermination> preconditions,
            double value
    ) implements GoapGoal {
        public SimpleGoapGoal {
            preconditions = preconditions == null ? Map.of() : Map.copyOf(preconditions);
        }
    }
}
