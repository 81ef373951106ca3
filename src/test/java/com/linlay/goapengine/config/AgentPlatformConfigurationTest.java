package com.linlay.goapengine.config;

import com.linlay.goapengine.core.ActionResult;
import com.linlay.goapengine.core.Agent;
import com.linlay.goapengine.core.AgentPlatform;
import com.linlay.goapengine.core.AgentProcess;
import com.linlay.goapengine.core.AgentProcessStatusCode;
import com.linlay.goapengine.core.Goal;
import com.linlay.goapengine.core.ProcessOptions;
import com.linlay.goapengine.core.support.DefaultAgentPlatform;
import com.linlay.goapengine.core.support.FunctionAction;
import com.linlay.goapengine.core.support.TestAgents;
import com.linlay.goapengine.core.support.TestAgents.Bar;
import com.linlay.goapengine.core.support.TestAgents.Foo;
import com.linlay.goapengine.event.EventSavingAgenticEventListener;
import com.linlay.goapengine.event.LoggingAgenticEventListener;
import com.linlay.goapengine.spi.AgentProcessRepository;
import com.linlay.goapengine.spi.ToolGroup;
import com.linlay.goapengine.spi.ToolGroupResolver;
import com.linlay.goapengine.spi.support.InMemoryAgentProcessRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(
        webEnvironment = SpringBootTest.WebEnvironment.NONE,
        properties = {
                "agent.platform.name=test-platform",
                "agent.platform.allow-goal-change=false",
                "agent.platform.budget.actions=7",
                "agent.platform.process-repository.window-size=20"
        }
)
class AgentPlatformConfigurationTest {

    @Autowired
    private AgentPlatform agentPlatform;

    @Autowired
    private AgentPlatformProperties properties;

    @Autowired
    private AgentProcessRepository agentProcessRepository;

    @Autowired
    private ToolGroupResolver toolGroupResolver;

    @Autowired
    private LoggingAgenticEventListener loggingAgenticEventListener;

    @Autowired
    private EventSavingAgenticEventListener eventSavingAgenticEventListener;

    @Test
    void shouldBindPlatformProperties() {
        assertThat(properties.getName()).isEqualTo("test-platform");
        assertThat(properties.isAllowGoalChange()).isFalse();
        assertThat(properties.getBudget().getActions()).isEqualTo(7);
        assertThat(properties.getBudget().getTokens()).isEqualTo(1_000_000);
        assertThat(properties.getValidation().isEnabled()).isTrue();

        ProcessOptions defaults = ((DefaultAgentPlatform) agentPlatform).defaultProcessOptions();
        assertThat(defaults.allowGoalChange()).isFalse();
        assertThat(defaults.budget().actions()).isEqualTo(7);
    }

    @Test
    void shouldWireDefaultPortsAndDeployValidAgentBeans() {
        assertThat(agentPlatform.name()).isEqualTo("test-platform");
        assertThat(agentPlatform.agents()).extracting(Agent::name).containsExactly("foo-to-bar");
        assertThat(agentProcessRepository).isInstanceOf(InMemoryAgentProcessRepository.class);
        assertThat(((InMemoryAgentProcessRepository) agentProcessRepository).getWindowSize()).isEqualTo(20);
        assertThat(toolGroupResolver.resolveToolGroup("search")).isPresent();
        assertThat(loggingAgenticEventListener).isNotNull();
    }

    @Test
    void shouldRunDeployedAgentEndToEnd() {
        Agent agent = agentPlatform.agentByName("foo-to-bar");

        AgentProcess process = agentPlatform.runAgentFrom(agent, null, Map.of());

        assertThat(process.status()).isEqualTo(AgentProcessStatusCode.COMPLETED);
        assertThat(process.resultOfType(Bar.class).value()).isEqualTo("foo-bar");
        assertThat(agentPlatform.getAgentProcess(process.id())).isSameAs(process);
        assertThat(eventSavingAgenticEventListener.processEvents())
                .anySatisfy(event -> assertThat(event.getProcessId()).isEqualTo(process.id()));
    }

    @TestConfiguration
    static class TestAgentConfiguration {

        @Bean
        Agent fooToBarAgent() {
            return TestAgents.fooToBarAgent();
        }

        @Bean
        Agent unreachableAgent() {
            return Agent.builder("no-bar")
                    .action(FunctionAction.builder("makeFoo")
                            .output(Foo.class)
                            .body(context -> ActionResult.completed(new Foo("foo")))
                            .build())
                    .goal(Goal.createInstance("a bar exists", Bar.class))
                    .build();
        }

        @Bean
        ToolGroup searchToolGroup() {
            return new ToolGroup("search", "web search", List.of("search"));
        }

        @Bean
        EventSavingAgenticEventListener eventSavingAgenticEventListener() {
            return new EventSavingAgenticEventListener();
        }
    }
}
