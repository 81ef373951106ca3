package com.linlay.goapengine.core;

import com.linlay.goapengine.plan.ConditionDetermination;

import java.util.function.Predicate;

/**
 * A condition backed by a boolean predicate over the operation context.
 */
public record ComputedBooleanCondition(
        String name,
        double cost,
        Predicate<OperationContext> evaluator
) implements Condition {

    public ComputedBooleanCondition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Condition name must not be blank");
        }
        if (cost < 0.0 || cost > 1.0) {
            throw new IllegalArgumentException("Condition cost must be in [0, 1], was " + cost);
        }
        if (evaluator == null) {
            throw new IllegalArgumentException("Condition evaluator is required");
        }
    }

    public ComputedBooleanCondition(String name, Predicate<OperationContext> evaluator) {
        this(name, 0.0, evaluator);
    }

    @Override
    public ConditionDetermination evaluate(OperationContext context) {
        return ConditionDetermination.of(evaluator.test(context));
    }
}
