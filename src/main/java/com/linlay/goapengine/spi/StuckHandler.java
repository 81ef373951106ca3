package com.linlay.goapengine.spi;

import com.linlay.goapengine.core.AgentProcess;

/**
 * Chance for an agent to recover when no plan can be found or its process is paused,
 * typically by adding objects to the blackboard.
 */
@FunctionalInterface
public interface StuckHandler {

    StuckHandlerResult handleStuck(AgentProcess agentProcess);
}
