package com.linlay.goapengine.core;

import com.linlay.goapengine.plan.ConditionDetermination;

/**
 * A named predicate over the process state used by the planner.
 * Cost lies in [0, 1] and orders evaluation inside composites.
 */
public interface Condition {

    String name();

    double cost();

    ConditionDetermination evaluate(OperationContext context);

    default Condition not() {
        return new CompositeConditions.Not(this);
    }

    /**
     * TRUE only when this condition evaluates to UNKNOWN.
     */
    default Condition unknown() {
        return new CompositeConditions.Unknown(this);
    }

    default Condition and(Condition other) {
        return new CompositeConditions.And(this, other);
    }

    default Condition or(Condition other) {
        return new CompositeConditions.Or(this, other);
    }

    default String infoString() {
        return name() + " (cost=" + cost() + ")";
    }
}
