package com.linlay.goapengine.core;

public class NoSuchAgentException extends IllegalArgumentException {

    public NoSuchAgentException(String agentName) {
        super("Unknown agent: " + agentName);
    }
}
