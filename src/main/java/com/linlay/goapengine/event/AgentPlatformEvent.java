package com.linlay.goapengine.event;

import com.linlay.goapengine.core.AgentPlatform;

public interface AgentPlatformEvent extends AgenticEvent {

    AgentPlatform getAgentPlatform();
}
