package com.linlay.goapengine.core;

import com.linlay.goapengine.plan.ConditionDetermination;

/**
 * Combinators behind {@link Condition#not()}, {@link Condition#and(Condition)} and friends.
 * Binary forms run the cheaper operand first (left on a tie) and short-circuit.
 */
final class CompositeConditions {

    private CompositeConditions() {
    }

    record Not(Condition operand) implements Condition {

        @Override
        public String name() {
            return "!" + operand.name();
        }

        @Override
        public double cost() {
            return operand.cost();
        }

        @Override
        public ConditionDetermination evaluate(OperationContext context) {
            return operand.evaluate(context).not();
        }
    }

    record Unknown(Condition operand) implements Condition {

        @Override
        public String name() {
            return "?" + operand.name();
        }

        @Override
        public double cost() {
            return operand.cost();
        }

        @Override
        public ConditionDetermination evaluate(OperationContext context) {
            return operand.evaluate(context) == ConditionDetermination.UNKNOWN
                    ? ConditionDetermination.TRUE
                    : ConditionDetermination.FALSE;
        }
    }

    record And(Condition left, Condition right) implements Condition {

        @Override
        public String name() {
            return "(" + left.name() + " && " + right.name() + ")";
        }

        @Override
        public double cost() {
            return Math.min(left.cost(), right.cost());
        }

        @Override
        public ConditionDetermination evaluate(OperationContext context) {
            Condition first = right.cost() < left.cost() ? right : left;
            Condition second = first == left ? right : left;
            ConditionDetermination firstResult = first.evaluate(context);
            if (firstResult == ConditionDetermination.FALSE) {
                return ConditionDetermination.FALSE;
            }
            return firstResult.and(second.evaluate(context));
        }
    }

    record Or(Condition left, Condition right) implements Condition {

        @Override
        public String name() {
            return "(" + left.name() + " || " + right.name() + ")";
        }

        @Override
        public double cost() {
            return Math.min(left.cost(), right.cost());
        }

        @Override
        public ConditionDetermination evaluate(OperationContext context) {
            Condition first = right.cost() < left.cost() ? right : left;
            Condition second = first == left ? right : left;
            ConditionDetermination firstResult = first.evaluate(context);
            if (firstResult == ConditionDetermination.TRUE) {
                return ConditionDetermination.TRUE;
            }
            return firstResult.or(second.evaluate(context));
        }
    }
}
