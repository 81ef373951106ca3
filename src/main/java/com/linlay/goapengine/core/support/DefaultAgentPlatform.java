package com.linlay.goapengine.core.support;

import com.linlay.goapengine.core.Agent;
import com.linlay.goapengine.core.AgentPlatform;
import com.linlay.goapengine.core.AgentProcess;
import com.linlay.goapengine.core.Blackboard;
import com.linlay.goapengine.core.NoSuchAgentException;
import com.linlay.goapengine.core.ProcessOptions;
import com.linlay.goapengine.event.AgentDeploymentEvent;
import com.linlay.goapengine.event.AgentProcessCreationEvent;
import com.linlay.goapengine.event.AgenticEventListener;
import com.linlay.goapengine.event.ProcessKilledEvent;
import com.linlay.goapengine.spi.AgentProcessIdGenerator;
import com.linlay.goapengine.spi.AgentProcessRepository;
import com.linlay.goapengine.spi.Asyncer;
import com.linlay.goapengine.spi.LlmOperations;
import com.linlay.goapengine.spi.OperationScheduler;
import com.linlay.goapengine.spi.PlatformServices;
import com.linlay.goapengine.spi.ToolGroupResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Platform holding deployed agents in memory and running their processes as {@link SimpleAgentProcess}es.
 */
public class DefaultAgentPlatform implements AgentPlatform {

    private static final Logger log = LoggerFactory.getLogger(DefaultAgentPlatform.class);
    private static final String CHILD_ID_SEPARATOR = " >> ";

    private final String name;
    private final String description;
    private final PlatformServices platformServices;
    private final AgentProcessRepository agentProcessRepository;
    private final AgentProcessIdGenerator idGenerator;
    private final ProcessOptions defaultProcessOptions;

    private final Object deployLock = new Object();
    private volatile Map<String, Agent> agents = Map.of();

    public DefaultAgentPlatform(
            String name,
            String description,
            LlmOperations llmOperations,
            AgenticEventListener eventListener,
            ToolGroupResolver toolGroupResolver,
            Asyncer asyncer,
            OperationScheduler operationScheduler,
            AgentProcessRepository agentProcessRepository,
            AgentProcessIdGenerator idGenerator,
            ProcessOptions defaultProcessOptions
    ) {
        this.name = name;
        this.description = description == null ? name : description;
        this.platformServices = new PlatformServices(this, llmOperations, eventListener,
                toolGroupResolver, asyncer, operationScheduler);
        this.agentProcessRepository = agentProcessRepository;
        this.idGenerator = idGenerator == null ? AgentProcessIdGenerator.RANDOM : idGenerator;
        this.defaultProcessOptions = defaultProcessOptions == null ? ProcessOptions.DEFAULT : defaultProcessOptions;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String description() {
        return description;
    }

    @Override
    public PlatformServices platformServices() {
        return platformServices;
    }

    public ProcessOptions defaultProcessOptions() {
        return defaultProcessOptions;
    }

    @Override
    public List<Agent> agents() {
        return agents.values().stream()
                .sorted(Comparator.comparing(Agent::name))
                .toList();
    }

    @Override
    public Agent agentByName(String agentName) {
        Map<String, Agent> snapshot = agents;
        Agent agent = snapshot.get(agentName);
        if (agent == null) {
            throw new NoSuchAgentException(agentName + ". Available: " + snapshot.keySet().stream().sorted().toList());
        }
        return agent;
    }

    @Override
    public Agent deploy(Agent agent) {
        synchronized (deployLock) {
            Map<String, Agent> updated = new LinkedHashMap<>(agents);
            Agent previous = updated.put(agent.name(), agent);
            this.agents = Map.copyOf(updated);
            if (previous != null) {
                log.info("Redeployed agent {} to platform {}", agent.name(), name);
            } else {
                log.info("Deployed agent {} to platform {}", agent.name(), name);
            }
        }
        platformServices.eventListener().onPlatformEvent(new AgentDeploymentEvent(this, agent));
        return agent;
    }

    @Override
    public AgentProcess createAgentProcess(Agent agent, ProcessOptions processOptions, Map<String, ?> bindings) {
        ProcessOptions options = processOptions == null ? defaultProcessOptions : processOptions;
        Blackboard blackboard = options.blackboard() == null ? new InMemoryBlackboard() : options.blackboard();
        blackboard.bindAll(bindings);
        String id = idGenerator.createProcessId(agent, options);
        AgentProcess agentProcess = new SimpleAgentProcess(id, null, agent, options, blackboard, platformServices);
        return register(agentProcess);
    }

    @Override
    public AgentProcess createChildProcess(Agent agent, AgentProcess parentAgentProcess) {
        Blackboard childBlackboard = parentAgentProcess.blackboard().spawn();
        ProcessOptions options = parentAgentProcess.processOptions().withBlackboard(childBlackboard);
        String id = parentAgentProcess.agent().name() + CHILD_ID_SEPARATOR + idGenerator.createProcessId(agent, options);
        AgentProcess child = new SimpleAgentProcess(id, parentAgentProcess.id(), agent, options,
                childBlackboard, platformServices);
        return register(child);
    }

    private AgentProcess register(AgentProcess agentProcess) {
        agentProcessRepository.save(agentProcess);
        log.debug("Created process {} for agent {}", agentProcess.id(), agentProcess.agent().name());
        platformServices.eventListener().onProcessEvent(new AgentProcessCreationEvent(agentProcess));
        return agentProcess;
    }

    @Override
    public AgentProcess getAgentProcess(String id) {
        return agentProcessRepository.findById(id).orElse(null);
    }

    @Override
    public ProcessKilledEvent killAgentProcess(String id) {
        AgentProcess agentProcess = getAgentProcess(id);
        if (agentProcess == null) {
            log.warn("Cannot kill unknown process {}", id);
            return null;
        }
        return agentProcess.kill();
    }

    @Override
    public CompletableFuture<AgentProcess> start(AgentProcess agentProcess) {
        if (platformServices.asyncer() == null) {
            throw new IllegalStateException("Platform " + name + " has no asyncer configured");
        }
        return platformServices.asyncer().async(agentProcess::run);
    }

    @Override
    public String toString() {
        return "DefaultAgentPlatform(" + name + ", agents=" + agents.keySet() + ")";
    }
}
