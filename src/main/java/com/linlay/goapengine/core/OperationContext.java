package com.linlay.goapengine.core;

/**
 * What conditions and action bodies see of the running process.
 */
public interface OperationContext {

    ProcessContext processContext();

    default AgentProcess agentProcess() {
        return processContext().agentProcess();
    }

    default Blackboard blackboard() {
        return agentProcess().blackboard();
    }

    default Object getValue(String variable, String type) {
        return blackboard().getValue(variable, type, agentProcess().agent().aggregations());
    }
}
