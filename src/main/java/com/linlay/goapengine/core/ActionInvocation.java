package com.linlay.goapengine.core;

import java.time.Duration;
import java.time.Instant;

public record ActionInvocation(
        String actionName,
        Instant timestamp,
        Duration runningTime
) {
    public ActionInvocation {
        timestamp = timestamp == null ? Instant.now() : timestamp;
        runningTime = runningTime == null ? Duration.ZERO : runningTime;
    }
}
