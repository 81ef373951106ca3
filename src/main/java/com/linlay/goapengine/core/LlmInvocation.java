package com.linlay.goapengine.core;

import java.time.Duration;

/**
 * One model call made on behalf of a process.
 *
 * @param cost in dollars
 */
public record LlmInvocation(
        String model,
        int promptTokens,
        int completionTokens,
        double cost,
        Duration runningTime
) {
    public LlmInvocation {
        model = model == null ? "unknown" : model;
        promptTokens = Math.max(0, promptTokens);
        completionTokens = Math.max(0, completionTokens);
        cost = Math.max(0.0, cost);
        runningTime = runningTime == null ? Duration.ZERO : runningTime;
    }

    public long totalTokens() {
        return (long) promptTokens + completionTokens;
    }
}
