package com.linlay.goapengine.core.support;

import com.linlay.goapengine.core.ActionQos;
import com.linlay.goapengine.core.ActionResult;
import com.linlay.goapengine.core.Aggregation;
import com.linlay.goapengine.core.Agent;
import com.linlay.goapengine.core.Goal;
import com.linlay.goapengine.core.ProcessOptions;
import com.linlay.goapengine.event.AgenticEventListener;
import com.linlay.goapengine.spi.AgentProcessIdGenerator;
import com.linlay.goapengine.spi.LlmOperations;
import com.linlay.goapengine.spi.OperationScheduler;
import com.linlay.goapengine.spi.support.InMemoryAgentProcessRepository;
import com.linlay.goapengine.spi.support.ReactorAsyncer;
import com.linlay.goapengine.spi.support.RegistryToolGroupResolver;

import java.util.List;

/**
 * Domain types, agents and platforms shared by the engine tests.
 */
public final class TestAgents {

    /**
     * Retries quickly so failing actions do not slow the tests down.
     */
    public static final ActionQos FAST_QOS = new ActionQos(3, 1, 1.0, 1, false);

    private TestAgents() {
    }

    public record Foo(String value) {
    }

    public record Bar(String value) {
    }

    public record Counter(int value) {
    }

    public record Draft(String text) {
    }

    public record Published(String text) {
    }

    public interface Animal {
        String name();
    }

    public record Dog(String name) implements Animal {
    }

    public record Leash(String color) {
    }

    public record DogWalk(Dog dog, Leash leash) implements Aggregation {
    }

    public static DefaultAgentPlatform platform(AgenticEventListener listener) {
        return platform(listener, OperationScheduler.PRONTO, LlmOperations.UNAVAILABLE);
    }

    public static DefaultAgentPlatform platform(
            AgenticEventListener listener,
            OperationScheduler scheduler,
            LlmOperations llmOperations
    ) {
        return new DefaultAgentPlatform(
                "test-platform",
                "platform for tests",
                llmOperations,
                listener,
                new RegistryToolGroupResolver("test-tools", List.of()),
                new ReactorAsyncer(),
                scheduler,
                new InMemoryAgentProcessRepository(),
                AgentProcessIdGenerator.RANDOM,
                ProcessOptions.DEFAULT
        );
    }

    /**
     * Makes a Foo from nothing, then a Bar from the Foo.
     */
    public static Agent fooToBarAgent() {
        return Agent.builder("foo-to-bar")
                .description("turns nothing into a bar")
                .action(FunctionAction.builder("makeFoo")
                        .output(Foo.class)
                        .qos(FAST_QOS)
                        .body(context -> ActionResult.completed(new Foo("foo")))
                        .build())
                .action(FunctionAction.builder("fooToBar")
                        .input(Foo.class)
                        .output(Bar.class)
                        .qos(FAST_QOS)
                        .body(context -> {
                            Foo foo = (Foo) context.getValue("it", "Foo");
                            return ActionResult.completed(new Bar(foo.value() + "-bar"));
                        })
                        .build())
                .goal(Goal.createInstance("a bar exists", Bar.class))
                .build();
    }
}
