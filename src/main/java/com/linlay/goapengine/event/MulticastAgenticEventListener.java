package com.linlay.goapengine.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Forwards to each delegate; a failing listener is logged and does not stop the others.
 */
public class MulticastAgenticEventListener implements AgenticEventListener {

    private static final Logger log = LoggerFactory.getLogger(MulticastAgenticEventListener.class);

    private final List<AgenticEventListener> listeners;

    public MulticastAgenticEventListener(List<? extends AgenticEventListener> listeners) {
        this.listeners = List.copyOf(listeners);
    }

    @Override
    public void onPlatformEvent(AgentPlatformEvent event) {
        for (AgenticEventListener listener : listeners) {
            try {
                listener.onPlatformEvent(event);
            } catch (RuntimeException ex) {
                log.warn("Listener {} failed on {}: {}", listener.getClass().getSimpleName(), event, ex.getMessage());
            }
        }
    }

    @Override
    public void onProcessEvent(AgentProcessEvent event) {
        for (AgenticEventListener listener : listeners) {
            try {
                listener.onProcessEvent(event);
            } catch (RuntimeException ex) {
                log.warn("Listener {} failed on {}: {}", listener.getClass().getSimpleName(), event, ex.getMessage());
            }
        }
    }
}
