package com.linlay.goapengine.spi;

import com.linlay.goapengine.core.Agent;
import com.linlay.goapengine.core.ProcessOptions;

import java.util.UUID;

@FunctionalInterface
public interface AgentProcessIdGenerator {

    AgentProcessIdGenerator RANDOM = (agent, processOptions) -> UUID.randomUUID().toString();

    String createProcessId(Agent agent, ProcessOptions processOptions);
}
