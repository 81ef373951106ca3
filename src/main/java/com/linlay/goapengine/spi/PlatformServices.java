package com.linlay.goapengine.spi;

import com.linlay.goapengine.core.AgentPlatform;
import com.linlay.goapengine.event.AgenticEventListener;

/**
 * Services shared by every process on a platform.
 */
public record PlatformServices(
        AgentPlatform agentPlatform,
        LlmOperations llmOperations,
        AgenticEventListener eventListener,
        ToolGroupResolver toolGroupResolver,
        Asyncer asyncer,
        OperationScheduler operationScheduler
) {

    public PlatformServices {
        llmOperations = llmOperations == null ? LlmOperations.UNAVAILABLE : llmOperations;
        eventListener = eventListener == null ? AgenticEventListener.DEVNULL : eventListener;
        operationScheduler = operationScheduler == null ? OperationScheduler.PRONTO : operationScheduler;
    }

    public PlatformServices withEventListener(AgenticEventListener eventListener) {
        return new PlatformServices(agentPlatform, llmOperations, eventListener, toolGroupResolver, asyncer, operationScheduler);
    }

    public PlatformServices withLlmOperations(LlmOperations llmOperations) {
        return new PlatformServices(agentPlatform, llmOperations, eventListener, toolGroupResolver, asyncer, operationScheduler);
    }

    public PlatformServices withOperationScheduler(OperationScheduler operationScheduler) {
        return new PlatformServices(agentPlatform, llmOperations, eventListener, toolGroupResolver, asyncer, operationScheduler);
    }
}
