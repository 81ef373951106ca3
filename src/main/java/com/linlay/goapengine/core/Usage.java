package com.linlay.goapengine.core;

/**
 * Token counts accumulated over a process.
 */
public record Usage(long promptTokens, long completionTokens) {

    public static final Usage NONE = new Usage(0, 0);

    public long totalTokens() {
        return promptTokens + completionTokens;
    }

    public Usage plus(LlmInvocation invocation) {
        return new Usage(promptTokens + invocation.promptTokens(), completionTokens + invocation.completionTokens());
    }
}
