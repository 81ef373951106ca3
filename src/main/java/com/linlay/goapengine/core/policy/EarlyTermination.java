package com.linlay.goapengine.core.policy;

import com.linlay.goapengine.core.AgentProcess;
import com.linlay.goapengine.event.AbstractAgentProcessEvent;

/**
 * Emitted when a policy stops a process; also kept as the process's failure info.
 */
public class EarlyTermination extends AbstractAgentProcessEvent {

    private final boolean error;
    private final String reason;
    private final EarlyTerminationPolicy policy;

    public EarlyTermination(AgentProcess agentProcess, boolean error, String reason, EarlyTerminationPolicy policy) {
        super(agentProcess);
        this.error = error;
        this.reason = reason;
        this.policy = policy;
    }

    public boolean isError() {
        return error;
    }

    public String getReason() {
        return reason;
    }

    public EarlyTerminationPolicy getPolicy() {
        return policy;
    }

    @Override
    public String toString() {
        return "EarlyTermination(" + policy.name() + ": " + reason + ")";
    }
}
