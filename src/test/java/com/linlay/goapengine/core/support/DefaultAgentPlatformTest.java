package com.linlay.goapengine.core.support;

import com.linlay.goapengine.core.ActionResult;
import com.linlay.goapengine.core.Agent;
import com.linlay.goapengine.core.AgentProcess;
import com.linlay.goapengine.core.AgentProcessStatusCode;
import com.linlay.goapengine.core.AgentScope;
import com.linlay.goapengine.core.Goal;
import com.linlay.goapengine.core.NoSuchAgentException;
import com.linlay.goapengine.core.ProcessOptions;
import com.linlay.goapengine.core.support.TestAgents.Bar;
import com.linlay.goapengine.core.support.TestAgents.Foo;
import com.linlay.goapengine.event.AgentDeploymentEvent;
import com.linlay.goapengine.event.AgentProcessCreationEvent;
import com.linlay.goapengine.event.EventSavingAgenticEventListener;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DefaultAgentPlatformTest {

    private EventSavingAgenticEventListener listener;
    private DefaultAgentPlatform platform;

    @BeforeEach
    void setUp() {
        listener = new EventSavingAgenticEventListener();
        platform = TestAgents.platform(listener);
    }

    @Test
    void shouldDeployAndFindAgentByName() {
        Agent agent = platform.deploy(TestAgents.fooToBarAgent());

        assertThat(platform.agentByName("foo-to-bar")).isSameAs(agent);
        assertThat(platform.agents()).containsExactly(agent);
        assertThat(listener.platformEvents()).hasSize(1);
        AgentDeploymentEvent event = (AgentDeploymentEvent) listener.platformEvents().get(0);
        assertThat(event.agent()).isSameAs(agent);
        assertThat(event.getAgentPlatform()).isSameAs(platform);
    }

    @Test
    void shouldReplaceAgentDeployedUnderSameName() {
        platform.deploy(TestAgents.fooToBarAgent());
        Agent replacement = TestAgents.fooToBarAgent();

        platform.deploy(replacement);

        assertThat(platform.agents()).containsExactly(replacement);
    }

    @Test
    void shouldThrowForUnknownAgent() {
        platform.deploy(TestAgents.fooToBarAgent());

        assertThatThrownBy(() -> platform.agentByName("nobody"))
                .isInstanceOf(NoSuchAgentException.class)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("nobody")
                .hasMessageContaining("foo-to-bar");
    }

    @Test
    void shouldAggregateActionsAndGoalsOfAllAgents() {
        platform.deploy(TestAgents.fooToBarAgent());
        platform.deploy(Agent.builder("another")
                .action(FunctionAction.builder("makeBar")
                        .output(Bar.class)
                        .body(context -> ActionResult.completed(new Bar("direct")))
                        .build())
                .goal(new Goal("ready", "ready to go", List.of("ready")))
                .build());

        assertThat(platform.actions()).extracting(action -> action.name())
                .containsExactly("makeBar", "makeFoo", "fooToBar");
        assertThat(platform.goals()).extracting(Goal::name).containsExactly("ready", "create-Bar");
        assertThat(platform.agents()).extracting(Agent::name).containsExactly("another", "foo-to-bar");
    }

    @Test
    void shouldDeployBareScopeAsAgent() {
        Agent source = TestAgents.fooToBarAgent();
        AgentScope scope = AgentScope.of("scoped", "a bare scope", source.actions(), source.goals(), List.of());

        Agent deployed = platform.deploy(scope);

        assertThat(deployed.name()).isEqualTo("scoped");
        assertThat(platform.agentByName("scoped").actions()).hasSize(2);
    }

    @Test
    void shouldCreateProcessAndFindItById() {
        AgentProcess process = platform.createAgentProcess(TestAgents.fooToBarAgent(), ProcessOptions.DEFAULT,
                Map.of("seed", new Foo("seed")));

        assertThat(process.status()).isEqualTo(AgentProcessStatusCode.NOT_STARTED);
        assertThat(process.parentId()).isNull();
        assertThat(process.blackboard().get("seed")).isEqualTo(new Foo("seed"));
        assertThat(platform.getAgentProcess(process.id())).isSameAs(process);
        assertThat(platform.getAgentProcess("missing")).isNull();
        assertThat(listener.processEventsOfType(AgentProcessCreationEvent.class)).hasSize(1);
    }

    @Test
    void shouldCreateChildProcessWithSpawnedBlackboard() {
        AgentProcess parent = platform.createAgentProcess(TestAgents.fooToBarAgent(), ProcessOptions.DEFAULT,
                Map.of("seed", new Foo("seed")));

        AgentProcess child = platform.createChildProcess(TestAgents.fooToBarAgent(), parent);
        child.addObject(new Bar("child only"));

        assertThat(child.id()).startsWith("foo-to-bar >> ");
        assertThat(child.parentId()).isEqualTo(parent.id());
        assertThat(child.blackboard().get("seed")).isEqualTo(new Foo("seed"));
        assertThat(child.blackboard().blackboardId()).isNotEqualTo(parent.blackboard().blackboardId());
        assertThat(parent.blackboard().last(Bar.class)).isNull();
        assertThat(platform.getAgentProcess(child.id())).isSameAs(child);
    }

    @Test
    void shouldRunProcessToCompletion() {
        AgentProcess process = platform.runAgentFrom(TestAgents.fooToBarAgent(), ProcessOptions.DEFAULT, Map.of());

        assertThat(process.status()).isEqualTo(AgentProcessStatusCode.COMPLETED);
        assertThat(process.finished()).isTrue();
        assertThat(process.resultOfType(Bar.class)).isEqualTo(new Bar("foo-bar"));
    }

    @Test
    void shouldStartProcessAsynchronously() throws Exception {
        AgentProcess process = platform.createAgentProcess(TestAgents.fooToBarAgent(), ProcessOptions.DEFAULT, Map.of());

        AgentProcess finished = platform.start(process).get(10, TimeUnit.SECONDS);

        assertThat(finished).isSameAs(process);
        assertThat(finished.status()).isEqualTo(AgentProcessStatusCode.COMPLETED);
    }

    @Test
    void shouldKillKnownProcessAndIgnoreUnknown() {
        AgentProcess process = platform.createAgentProcess(TestAgents.fooToBarAgent(), ProcessOptions.DEFAULT, Map.of());

        assertThat(platform.killAgentProcess(process.id())).isNotNull();
        assertThat(process.status()).isEqualTo(AgentProcessStatusCode.KILLED);
        assertThat(platform.killAgentProcess(process.id())).isNull();
        assertThat(platform.killAgentProcess("missing")).isNull();
    }

    @Test
    void shouldUseDefaultOptionsWhenNoneGiven() {
        AgentProcess process = platform.createAgentProcess(TestAgents.fooToBarAgent(), null, Map.of());

        assertThat(process.processOptions()).isEqualTo(platform.defaultProcessOptions());
    }
}
