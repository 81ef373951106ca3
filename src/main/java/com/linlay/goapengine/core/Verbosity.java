package com.linlay.goapengine.core;

public record Verbosity(
        boolean showPrompts,
        boolean showLlmResponses,
        boolean debug,
        boolean showPlanning
) {

    public static final Verbosity DEFAULT = new Verbosity(false, false, false, false);

    public boolean showLongPlans() {
        return showPlanning || debug;
    }

    public Verbosity withShowPlanning(boolean showPlanning) {
        return new Verbosity(showPrompts, showLlmResponses, debug, showPlanning);
    }
}
