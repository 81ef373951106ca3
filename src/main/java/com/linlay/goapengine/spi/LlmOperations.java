package com.linlay.goapengine.spi;

import com.linlay.goapengine.core.AgentProcess;

/**
 * Port to a language model. Implementations record each call on the process with
 * {@link AgentProcess#recordLlmInvocation} so token and cost budgets apply.
 */
public interface LlmOperations {

    LlmOperations UNAVAILABLE = new LlmOperations() {
        @Override
        public <O> O createObject(String prompt, Class<O> outputClass, AgentProcess agentProcess) {
            throw new IllegalStateException("No LLM operations configured for process " + agentProcess.id());
        }
    };

    <O> O createObject(String prompt, Class<O> outputClass, AgentProcess agentProcess);
}
