package com.linlay.goapengine.core;

import com.linlay.goapengine.event.ProcessKilledEvent;
import com.linlay.goapengine.spi.PlatformServices;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Hosts deployed agents and the processes running them. The platform is itself a scope
 * aggregating the actions, goals and conditions of all its agents.
 */
public interface AgentPlatform extends AgentScope {

    PlatformServices platformServices();

    List<Agent> agents();

    /**
     * @throws NoSuchAgentException when no agent of that name is deployed
     */
    Agent agentByName(String name);

    Agent deploy(Agent agent);

    /**
     * Deploys a bare scope as an agent of the same name.
     */
    default Agent deploy(AgentScope agentScope) {
        if (agentScope instanceof Agent agent) {
            return deploy(agent);
        }
        return deploy(new Agent(agentScope.name(), "", Agent.DEFAULT_VERSION, agentScope.description(),
                agentScope.conditions(), agentScope.actions(), agentScope.goals(), null, agentScope.aggregations()));
    }

    AgentProcess createAgentProcess(Agent agent, ProcessOptions processOptions, Map<String, ?> bindings);

    /**
     * Creates a process and runs it on the calling thread.
     */
    default AgentProcess runAgentFrom(Agent agent, ProcessOptions processOptions, Map<String, ?> bindings) {
        return createAgentProcess(agent, processOptions, bindings).run();
    }

    /**
     * A process for the agent whose blackboard is spawned from the parent's.
     */
    AgentProcess createChildProcess(Agent agent, AgentProcess parentAgentProcess);

    /**
     * @return the process, or null when it is unknown or has been evicted
     */
    AgentProcess getAgentProcess(String id);

    /**
     * @return the kill event, or null when the process is unknown or already finished
     */
    ProcessKilledEvent killAgentProcess(String id);

    /**
     * Runs the process off the calling thread.
     */
    CompletableFuture<AgentProcess> start(AgentProcess agentProcess);

    @Override
    default List<Action> actions() {
        List<Action> actions = new ArrayList<>();
        agents().forEach(agent -> actions.addAll(agent.actions()));
        return actions;
    }

    @Override
    default Set<Goal> goals() {
        Set<Goal> goals = new LinkedHashSet<>();
        agents().forEach(agent -> goals.addAll(agent.goals()));
        return goals;
    }

    @Override
    default Set<Condition> conditions() {
        Set<Condition> conditions = new LinkedHashSet<>();
        agents().forEach(agent -> conditions.addAll(agent.conditions()));
        return conditions;
    }

    @Override
    default AggregationRegistry aggregations() {
        AggregationRegistry registry = AggregationRegistry.EMPTY;
        for (Agent agent : agents()) {
            registry = registry.merge(agent.aggregations());
        }
        return registry;
    }
}
