package com.linlay.goapengine.event;

import java.util.List;

/**
 * Observer of engine events. Both methods default to no-ops.
 */
public interface AgenticEventListener {

    AgenticEventListener DEVNULL = new AgenticEventListener() {
    };

    default void onPlatformEvent(AgentPlatformEvent event) {
    }

    default void onProcessEvent(AgentProcessEvent event) {
    }

    /**
     * A listener that forwards every event to each delegate in order.
     */
    static AgenticEventListener from(List<? extends AgenticEventListener> listeners) {
        if (listeners == null || listeners.isEmpty()) {
            return DEVNULL;
        }
        if (listeners.size() == 1) {
            return listeners.get(0);
        }
        return new MulticastAgenticEventListener(listeners);
    }
}
