package com.linlay.goapengine.core.support;

import com.linlay.goapengine.core.ActionQos;
import com.linlay.goapengine.core.ActionResult;
import com.linlay.goapengine.core.IoBinding;
import com.linlay.goapengine.core.support.TestAgents.Bar;
import com.linlay.goapengine.core.support.TestAgents.Foo;
import org.junit.jupiter.api.Test;

import static com.linlay.goapengine.plan.ConditionDetermination.FALSE;
import static com.linlay.goapengine.plan.ConditionDetermination.TRUE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

class FunctionActionTest {

    @Test
    void shouldGuardSingleRunActionAgainstExistingOutputAndPriorRun() {
        FunctionAction action = FunctionAction.builder("fooToBar")
                .pre("approved")
                .post("converted")
                .input(Foo.class)
                .output(Bar.class)
                .body(context -> ActionResult.done())
                .build();

        assertThat(action.preconditions()).containsOnly(
                entry("approved", TRUE),
                entry("it:Foo", TRUE),
                entry("it:Bar", FALSE),
                entry("hasRun_fooToBar", FALSE));
        assertThat(action.effects()).containsOnly(
                entry("converted", TRUE),
                entry("it:Bar", TRUE),
                entry("hasRun_fooToBar", TRUE));
        assertThat(action.knownConditions())
                .containsExactlyInAnyOrder("approved", "converted", "it:Foo", "it:Bar", "hasRun_fooToBar");
    }

    @Test
    void shouldOnlyRequireInputsWhenRerunIsAllowed() {
        FunctionAction action = FunctionAction.builder("refine")
                .input(new IoBinding("draft", Foo.class))
                .output(new IoBinding("draft", Foo.class))
                .canRerun(true)
                .body(context -> ActionResult.done())
                .build();

        assertThat(action.preconditions()).containsOnly(entry("draft:Foo", TRUE));
        assertThat(action.effects()).containsOnly(entry("draft:Foo", TRUE), entry("hasRun_refine", TRUE));
    }

    @Test
    void shouldNotRequireAbsenceOfOutputThatIsAlsoInput() {
        FunctionAction action = FunctionAction.builder("polish")
                .input(Foo.class)
                .output(Foo.class)
                .body(context -> ActionResult.done())
                .build();

        assertThat(action.preconditions()).containsOnly(entry("it:Foo", TRUE), entry("hasRun_polish", FALSE));
    }

    @Test
    void shouldApplyDefaults() {
        FunctionAction action = FunctionAction.builder("plain")
                .body(context -> ActionResult.done())
                .build();

        assertThat(action.description()).isEqualTo("plain");
        assertThat(action.canRerun()).isFalse();
        assertThat(action.qos()).isEqualTo(ActionQos.DEFAULT);
        assertThat(action.cost()).isZero();
        assertThat(action.toolGroups()).isEmpty();
    }

    @Test
    void shouldRejectBlankName() {
        assertThatThrownBy(() -> FunctionAction.builder("").body(context -> ActionResult.done()).build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
