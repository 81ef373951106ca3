package com.linlay.goapengine.validation;

public record ValidationError(
        String code,
        String message,
        String agentName,
        String component
) {
    public ValidationError {
        component = component == null ? agentName : component;
    }

    @Override
    public String toString() {
        return code + " in " + component + ": " + message;
    }
}
