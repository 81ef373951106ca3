package com.linlay.goapengine.core;

import com.linlay.goapengine.core.policy.Budget;
import com.linlay.goapengine.core.policy.ProcessControl;

/**
 * Options for one agent process.
 *
 * @param contextId   optional id of an external context the process belongs to
 * @param blackboard  blackboard to use instead of a fresh one; may be null
 * @param test        whether the process runs against test doubles
 * @param allowGoalChange whether replanning may switch to a different goal
 */
public record ProcessOptions(
        String contextId,
        Blackboard blackboard,
        boolean test,
        Verbosity verbosity,
        boolean allowGoalChange,
        Budget budget,
        ProcessControl control
) {

    public static final ProcessOptions DEFAULT = new ProcessOptions(
            null, null, false, Verbosity.DEFAULT, true, Budget.DEFAULT, null);

    public ProcessOptions {
        verbosity = verbosity == null ? Verbosity.DEFAULT : verbosity;
        budget = budget == null ? Budget.DEFAULT : budget;
        control = control == null ? ProcessControl.of(budget) : control;
    }

    /**
     * Also replaces the early termination policy with the new budget's.
     */
    public ProcessOptions withBudget(Budget budget) {
        Budget next = budget == null ? Budget.DEFAULT : budget;
        return new ProcessOptions(contextId, blackboard, test, verbosity, allowGoalChange, next,
                control.withEarlyTerminationPolicy(next.earlyTerminationPolicy()));
    }

    public ProcessOptions withControl(ProcessControl control) {
        return new ProcessOptions(contextId, blackboard, test, verbosity, allowGoalChange, budget, control);
    }

    public ProcessOptions withBlackboard(Blackboard blackboard) {
        return new ProcessOptions(contextId, blackboard, test, verbosity, allowGoalChange, budget, control);
    }

    public ProcessOptions withAllowGoalChange(boolean allowGoalChange) {
        return new ProcessOptions(contextId, blackboard, test, verbosity, allowGoalChange, budget, control);
    }

    public ProcessOptions withContextId(String contextId) {
        return new ProcessOptions(contextId, blackboard, test, verbosity, allowGoalChange, budget, control);
    }

    public ProcessOptions withTest(boolean test) {
        return new ProcessOptions(contextId, blackboard, test, verbosity, allowGoalChange, budget, control);
    }

    public ProcessOptions withVerbosity(Verbosity verbosity) {
        return new ProcessOptions(contextId, blackboard, test, verbosity, allowGoalChange, budget, control);
    }
}
