package com.linlay.goapengine.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.linlay.goapengine.core.Agent;
import com.linlay.goapengine.core.AgentPlatform;

import java.time.Instant;

public record AgentDeploymentEvent(
        @JsonIgnore AgentPlatform agentPlatform,
        Agent agent,
        Instant timestamp
) implements AgentPlatformEvent {

    public AgentDeploymentEvent(AgentPlatform agentPlatform, Agent agent) {
        this(agentPlatform, agent, Instant.now());
    }

    @Override
    public AgentPlatform getAgentPlatform() {
        return agentPlatform;
    }

    @Override
    public Instant getTimestamp() {
        return timestamp;
    }
}
