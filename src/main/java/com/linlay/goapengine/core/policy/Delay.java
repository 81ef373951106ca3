package com.linlay.goapengine.core.policy;

import java.time.Duration;

public enum Delay {
    NONE(Duration.ZERO),
    MEDIUM(Duration.ofMillis(400)),
    LONG(Duration.ofSeconds(2));

    private final Duration duration;

    Delay(Duration duration) {
        this.duration = duration;
    }

    public Duration duration() {
        return duration;
    }
}
