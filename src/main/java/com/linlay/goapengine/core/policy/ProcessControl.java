package com.linlay.goapengine.core.policy;

/**
 * Pacing and termination controls for a process.
 *
 * @param operationDelay pause before each action runs
 */
public record ProcessControl(
        Delay operationDelay,
        EarlyTerminationPolicy earlyTerminationPolicy
) {

    public ProcessControl {
        operationDelay = operationDelay == null ? Delay.NONE : operationDelay;
        earlyTerminationPolicy = earlyTerminationPolicy == null
                ? Budget.DEFAULT.earlyTerminationPolicy()
                : earlyTerminationPolicy;
    }

    public static ProcessControl of(Budget budget) {
        return new ProcessControl(Delay.NONE, budget.earlyTerminationPolicy());
    }

    public ProcessControl withEarlyTerminationPolicy(EarlyTerminationPolicy policy) {
        return new ProcessControl(operationDelay, policy);
    }

    public ProcessControl withOperationDelay(Delay delay) {
        return new ProcessControl(delay, earlyTerminationPolicy);
    }
}
