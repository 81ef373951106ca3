package com.linlay.goapengine.spi;

import com.linlay.goapengine.core.AgentProcess;

import java.util.Optional;

public interface AgentProcessRepository {

    AgentProcess save(AgentProcess agentProcess);

    Optional<AgentProcess> findById(String id);

    void delete(AgentProcess agentProcess);

    int size();

    void clear();
}
