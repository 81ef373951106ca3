package com.linlay.goapengine.core;

import com.linlay.goapengine.event.AgentProcessEvent;
import com.linlay.goapengine.spi.LlmOperations;
import com.linlay.goapengine.spi.PlatformServices;

import java.util.Objects;

/**
 * Per-process view of the platform: services, options and the process itself.
 * Writes go through the process so that binding events are emitted.
 */
public final class ProcessContext implements OperationContext {

    private final PlatformServices platformServices;
    private final AgentProcess agentProcess;
    private final ProcessOptions processOptions;

    public ProcessContext(PlatformServices platformServices, AgentProcess agentProcess, ProcessOptions processOptions) {
        this.platformServices = Objects.requireNonNull(platformServices, "platformServices");
        this.agentProcess = Objects.requireNonNull(agentProcess, "agentProcess");
        this.processOptions = processOptions == null ? ProcessOptions.DEFAULT : processOptions;
    }

    @Override
    public ProcessContext processContext() {
        return this;
    }

    @Override
    public AgentProcess agentProcess() {
        return agentProcess;
    }

    public PlatformServices platformServices() {
        return platformServices;
    }

    public ProcessOptions processOptions() {
        return processOptions;
    }

    public LlmOperations llmOperations() {
        return platformServices.llmOperations();
    }

    public void bind(String name, Object value) {
        agentProcess.bind(name, value);
    }

    public void addObject(Object value) {
        agentProcess.addObject(value);
    }

    public void onProcessEvent(AgentProcessEvent event) {
        platformServices.eventListener().onProcessEvent(event);
    }
}
