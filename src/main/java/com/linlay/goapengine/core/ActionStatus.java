package com.linlay.goapengine.core;

import java.time.Duration;

public record ActionStatus(
        Duration runningTime,
        ActionStatusCode status
) {
    public ActionStatus {
        runningTime = runningTime == null ? Duration.ZERO : runningTime;
        if (status == null) {
            throw new IllegalArgumentException("status is required");
        }
    }
}
