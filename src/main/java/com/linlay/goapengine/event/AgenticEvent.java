package com.linlay.goapengine.event;

import java.time.Instant;

/**
 * Anything the engine reports to listeners.
 */
public interface AgenticEvent {

    Instant getTimestamp();
}
