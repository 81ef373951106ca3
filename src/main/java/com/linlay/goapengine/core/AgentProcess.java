package com.linlay.goapengine.core;

import com.linlay.goapengine.event.ProcessKilledEvent;
import com.linlay.goapengine.plan.WorldState;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * A running instance of an agent: its blackboard, the actions taken so far and the status
 * of the plan-act loop.
 */
public interface AgentProcess {

    String id();

    /**
     * @return the id of the process that spawned this one, or null for a top-level process
     */
    String parentId();

    Agent agent();

    ProcessOptions processOptions();

    Blackboard blackboard();

    ProcessContext processContext();

    AgentProcessStatusCode status();

    List<ActionInvocation> history();

    /**
     * @return the world state seen by the latest tick, or null before the first tick
     */
    WorldState lastWorldState();

    /**
     * @return what stopped the process: an exception after failed retries, an early termination, or null
     */
    Object failureInfo();

    /**
     * @return the goal the process is committed to, or null before the first plan
     */
    Goal goal();

    Instant timestamp();

    Duration runningTime();

    List<LlmInvocation> llmInvocations();

    void recordLlmInvocation(LlmInvocation invocation);

    /**
     * Binds through the process so that an object bound event is emitted.
     */
    AgentProcess bind(String name, Object value);

    AgentProcess addObject(Object value);

    /**
     * Runs the plan-act loop on the calling thread until the status leaves RUNNING.
     */
    AgentProcess run();

    /**
     * Plans once and executes at most one action.
     */
    AgentProcess tick();

    /**
     * @return the kill event, or null when the process had already finished
     */
    ProcessKilledEvent kill();

    default boolean finished() {
        return status().isTerminal();
    }

    default double cost() {
        return llmInvocations().stream().mapToDouble(LlmInvocation::cost).sum();
    }

    default Usage usage() {
        Usage usage = Usage.NONE;
        for (LlmInvocation invocation : llmInvocations()) {
            usage = usage.plus(invocation);
        }
        return usage;
    }

    /**
     * The last value of the type on the blackboard of a completed process.
     *
     * @throws IllegalStateException when the process has not completed or holds no such value
     */
    default <O> O resultOfType(Class<O> type) {
        if (status() != AgentProcessStatusCode.COMPLETED) {
            throw new IllegalStateException("Process " + id() + " has not completed: status is " + status());
        }
        Object value = blackboard().getValue(IoBinding.DEFAULT_BINDING, type.getSimpleName(), agent().aggregations());
        if (!type.isInstance(value)) {
            throw new IllegalStateException("No result of type " + type.getSimpleName() + " in process " + id());
        }
        return type.cast(value);
    }

    default String infoString(boolean verbose) {
        String summary = "AgentProcess " + id() + " of " + agent().name() + ": status=" + status()
                + ", actions=" + history().size()
                + ", goal=" + (goal() == null ? "none" : goal().name())
                + ", cost=" + String.format("$%.4f", cost());
        if (!verbose) {
            return summary;
        }
        return summary + "\n" + blackboard().infoString(true);
    }
}
