package com.linlay.goapengine.core;

public enum AgentProcessStatusCode {
    NOT_STARTED,
    RUNNING,
    COMPLETED,
    FAILED,
    WAITING,
    PAUSED,
    STUCK,
    TERMINATED,
    KILLED;

    /**
     * Terminal processes never run again. FAILED, WAITING, PAUSED and STUCK can be resumed.
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == TERMINATED || this == KILLED;
    }
}
