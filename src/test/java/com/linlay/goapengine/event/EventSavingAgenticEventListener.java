package com.linlay.goapengine.event;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Records every event so tests can assert on what was emitted.
 */
public class EventSavingAgenticEventListener implements AgenticEventListener {

    private final List<AgentProcessEvent> processEvents = new CopyOnWriteArrayList<>();
    private final List<AgentPlatformEvent> platformEvents = new CopyOnWriteArrayList<>();

    @Override
    public void onPlatformEvent(AgentPlatformEvent event) {
        platformEvents.add(event);
    }

    @Override
    public void onProcessEvent(AgentProcessEvent event) {
        processEvents.add(event);
    }

    public List<AgentProcessEvent> processEvents() {
        return List.copyOf(processEvents);
    }

    public List<AgentPlatformEvent> platformEvents() {
        return List.copyOf(platformEvents);
    }

    public <T> List<T> processEventsOfType(Class<T> type) {
        return processEvents.stream().filter(type::isInstance).map(type::cast).toList();
    }
}
