package com.linlay.goapengine.core;

import com.linlay.goapengine.core.support.FunctionAction;
import com.linlay.goapengine.core.support.TestAgents;
import com.linlay.goapengine.core.support.TestAgents.Bar;
import com.linlay.goapengine.core.support.TestAgents.Dog;
import com.linlay.goapengine.core.support.TestAgents.DogWalk;
import com.linlay.goapengine.core.support.TestAgents.Foo;
import com.linlay.goapengine.core.support.TestAgents.Leash;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AgentTest {

    @Test
    void shouldMergeSchemaTypesAcrossActionsAndSortByName() {
        Agent agent = Agent.builder("typed")
                .action(FunctionAction.builder("readFoo")
                        .input(Foo.class)
                        .inputProperty("it", new PropertyDefinition("value"))
                        .output(Bar.class)
                        .body(context -> ActionResult.done())
                        .build())
                .action(FunctionAction.builder("measureFoo")
                        .input(Foo.class)
                        .inputProperty("it", new PropertyDefinition("length", "integer", "how long"))
                        .body(context -> ActionResult.done())
                        .build())
                .goal(Goal.createInstance("a bar exists", Bar.class))
                .build();

        assertThat(agent.schemaTypes()).extracting(SchemaType::name).containsExactly("Bar", "Foo");
        assertThat(agent.resolveSchemaType("Foo").properties())
                .extracting(PropertyDefinition::name)
                .containsExactlyInAnyOrder("value", "length");
        assertThatThrownBy(() -> agent.resolveSchemaType("Baz"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Baz");
    }

    @Test
    void shouldBuildPlanningSystemFromActionsAndGoals() {
        Agent agent = TestAgents.fooToBarAgent();

        assertThat(agent.planningSystem().actions()).hasSize(2);
        assertThat(agent.planningSystem().goals()).hasSize(1);
        assertThat(agent.planningSystem().knownConditions())
                .contains("it:Foo", "it:Bar", "hasRun_makeFoo", "hasRun_fooToBar");
        assertThat(agent.findAction("fooToBar")).isNotNull();
        assertThat(agent.findAction("missing")).isNull();
        assertThat(agent.version()).isEqualTo(Agent.DEFAULT_VERSION);
    }

    @Test
    void shouldKeepOnlyTheChosenGoal() {
        Goal other = new Goal("other", "another goal", List.of("ready"));
        Agent agent = Agent.builder("two-goals")
                .goal(Goal.createInstance("a bar exists", Bar.class))
                .goal(other)
                .build();

        Agent single = agent.withSingleGoal(other);

        assertThat(agent.goals()).hasSize(2);
        assertThat(single.goals()).containsExactly(other);
        assertThat(single.name()).isEqualTo("two-goals");
    }

    @Test
    void shouldExposeRegisteredAggregationsAsDomainTypes() {
        Agent agent = Agent.builder("walker")
                .aggregation(DogWalk.class, lookup -> Optional.empty())
                .build();

        assertThat(agent.aggregations().supports("DogWalk")).isTrue();
        assertThat(agent.aggregations().supports(DogWalk.class.getName())).isTrue();
        assertThat(agent.aggregations().supports(Dog.class.getSimpleName())).isFalse();
        assertThat(agent.domainTypes()).contains(new JvmType(DogWalk.class));
        assertThat(agent.aggregations().supports(Leash.class.getSimpleName())).isFalse();
    }

    @Test
    void shouldRejectBlankName() {
        assertThatThrownBy(() -> Agent.builder(" ").build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
