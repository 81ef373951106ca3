package com.linlay.goapengine.event;

public interface AgentProcessEvent extends AgenticEvent {

    String getProcessId();
}
