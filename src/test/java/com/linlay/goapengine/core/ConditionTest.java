package com.linlay.goapengine.core;

import com.linlay.goapengine.plan.ConditionDetermination;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

class ConditionTest {

    private final OperationContext context = mock(OperationContext.class);
    private final List<String> evaluated = new ArrayList<>();

    @Test
    void shouldEvaluateCheaperOperandFirstAndShortCircuitAnd() {
        Condition expensive = recording("expensive", 0.9, ConditionDetermination.TRUE);
        Condition cheap = recording("cheap", 0.1, ConditionDetermination.FALSE);

        ConditionDetermination result = expensive.and(cheap).evaluate(context);

        assertThat(result).isEqualTo(ConditionDetermination.FALSE);
        assertThat(evaluated).containsExactly("cheap");
    }

    @Test
    void shouldShortCircuitOrOnTrue() {
        Condition expensive = recording("expensive", 0.9, ConditionDetermination.FALSE);
        Condition cheap = recording("cheap", 0.2, ConditionDetermination.TRUE);

        ConditionDetermination result = expensive.or(cheap).evaluate(context);

        assertThat(result).isEqualTo(ConditionDetermination.TRUE);
        assertThat(evaluated).containsExactly("cheap");
    }

    @Test
    void shouldEvaluateLeftFirstOnEqualCost() {
        Condition left = recording("left", 0.5, ConditionDetermination.TRUE);
        Condition right = recording("right", 0.5, ConditionDetermination.UNKNOWN);

        ConditionDetermination result = left.and(right).evaluate(context);

        assertThat(result).isEqualTo(ConditionDetermination.UNKNOWN);
        assertThat(evaluated).containsExactly("left", "right");
    }

    @Test
    void shouldTakeMinimumCostForComposites() {
        Condition a = recording("a", 0.7, ConditionDetermination.TRUE);
        Condition b = recording("b", 0.3, ConditionDetermination.TRUE);

        assertThat(a.and(b).cost()).isEqualTo(0.3);
        assertThat(a.or(b).cost()).isEqualTo(0.3);
        assertThat(a.not().cost()).isEqualTo(0.7);
        assertThat(a.and(b).name()).isEqualTo("(a && b)");
    }

    @Test
    void shouldNegateAndDetectUnknown() {
        Condition unknown = recording("unknown", 0.0, ConditionDetermination.UNKNOWN);
        Condition yes = recording("yes", 0.0, ConditionDetermination.TRUE);

        assertThat(yes.not().evaluate(context)).isEqualTo(ConditionDetermination.FALSE);
        assertThat(unknown.not().evaluate(context)).isEqualTo(ConditionDetermination.UNKNOWN);
        assertThat(unknown.unknown().evaluate(context)).isEqualTo(ConditionDetermination.TRUE);
        assertThat(yes.unknown().evaluate(context)).isEqualTo(ConditionDetermination.FALSE);
    }

    @Test
    void shouldEvaluateComputedConditionAgainstContext() {
        Condition computed = new ComputedBooleanCondition("has-context", ctx -> ctx == context);

        assertThat(computed.evaluate(context)).isEqualTo(ConditionDetermination.TRUE);
        assertThat(computed.cost()).isZero();
    }

    @Test
    void shouldRejectCostOutsideUnitInterval() {
        assertThatThrownBy(() -> new ComputedBooleanCondition("bad", 1.5, ctx -> true))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("[0, 1]");
    }

    private Condition recording(String name, double cost, ConditionDetermination determination) {
        return new Condition() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public double cost() {
                return cost;
            }

            @Override
            public ConditionDetermination evaluate(OperationContext ctx) {
                evaluated.add(name);
                return determination;
            }
        };
    }
}
