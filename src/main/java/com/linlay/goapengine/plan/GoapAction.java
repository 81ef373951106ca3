package com.linlay.goapengine.plan;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

public interface GoapAction extends GoapStep {

    Map<String, ConditionDetermination> effects();

    double cost();

    @Override
    default Set<String> knownConditions() {
        Set<String> known = new LinkedHashSet<>(preconditions().keySet());
        known.addAll(effects().keySet());
        return known;
    }

    static GoapAction of(
            String name,
            Map<String, ConditionDetermination> preconditions,
            Map<String, ConditionDetermination> effects,
            double cost,
            double value
    ) {
        return new SimpleGoapAction(name, preconditions, effects, cost, value);
    }

    record SimpleGoapAction(
            String name,
            Map<String, ConditionDetermination> preconditions,
            Map<String, ConditionDetermination> effects,
            double cost,
            double value
    ) implements GoapAction {
        public SimpleGoapAction {
            preconditions = preconditions == null ? Map.of() : Map.copyOf(preconditions);
            effects = effects == null ? Map.of() : Map.copyOf(effects);
        }
    }
}
