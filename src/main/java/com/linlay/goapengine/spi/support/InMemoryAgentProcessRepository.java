package com.linlay.goapengine.spi.support;

import com.linlay.goapengine.core.AgentProcess;
import com.linlay.goapengine.spi.AgentProcessRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Keeps the most recently saved processes, evicting the oldest beyond the window size.
 */
public class InMemoryAgentProcessRepository implements AgentProcessRepository {

    private static final Logger log = LoggerFactory.getLogger(InMemoryAgentProcessRepository.class);

    public static final int DEFAULT_WINDOW_SIZE = 1000;

    private final int windowSize;
    private final Map<String, AgentProcess> processes;
    private final Object lock = new Object();

    public InMemoryAgentProcessRepository() {
        this(DEFAULT_WINDOW_SIZE);
    }

    public InMemoryAgentProcessRepository(int windowSize) {
        if (windowSize <= 0) {
            throw new IllegalArgumentException("windowSize must be positive, was " + windowSize);
        }
        this.windowSize = windowSize;
        this.processes = new LinkedHashMap<>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, AgentProcess> eldest) {
                boolean evict = size() > InMemoryAgentProcessRepository.this.windowSize;
                if (evict) {
                    log.debug("Evicting agent process {} beyond window of {}", eldest.getKey(), InMemoryAgentProcessRepository.this.windowSize);
                }
                return evict;
            }
        };
    }

    @Override
    public AgentProcess save(AgentProcess agentProcess) {
        synchronized (lock) {
            processes.remove(agentProcess.id());
            processes.put(agentProcess.id(), agentProcess);
        }
        return agentProcess;
    }

    @Override
    public Optional<AgentProcess> findById(String id) {
        if (id == null) {
            return Optional.empty();
        }
        synchronized (lock) {
            return Optional.ofNullable(processes.get(id));
        }
    }

    @Override
    public void delete(AgentProcess agentProcess) {
        synchronized (lock) {
            processes.remove(agentProcess.id());
        }
    }

    @Override
    public int size() {
        synchronized (lock) {
            return processes.size();
        }
    }

    @Override
    public void clear() {
        synchronized (lock) {
            processes.clear();
        }
    }

    public int getWindowSize() {
        return windowSize;
    }
}
