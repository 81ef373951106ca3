package com.linlay.goapengine.core.policy;

import com.linlay.goapengine.core.AgentProcess;

import java.util.List;

/**
 * Decides, before each tick, whether a running process must stop.
 */
public interface EarlyTerminationPolicy {

    /**
     * @return the termination to apply, or null to keep going
     */
    EarlyTermination shouldTerminate(AgentProcess agentProcess);

    default String name() {
        return getClass().getSimpleName();
    }

    static EarlyTerminationPolicy maxActions(int maxActions) {
        return new MaxActionsEarlyTerminationPolicy(maxActions);
    }

    static EarlyTerminationPolicy maxTokens(int maxTokens) {
        return new MaxTokensEarlyTerminationPolicy(maxTokens);
    }

    static EarlyTerminationPolicy hardBudgetLimit(double budget) {
        return new HardBudgetLimitTerminationPolicy(budget);
    }

    static EarlyTerminationPolicy firstOf(EarlyTerminationPolicy... policies) {
        return new FirstOfEarlyTerminationPolicy(List.of(policies));
    }

    record MaxActionsEarlyTerminationPolicy(int maxActions) implements EarlyTerminationPolicy {

        @Override
        public EarlyTermination shouldTerminate(AgentProcess agentProcess) {
            int taken = agentProcess.history().size();
            if (taken < maxActions) {
                return null;
            }
            return new EarlyTermination(agentProcess, false,
                    "Max actions of " + maxActions + " reached after " + taken + " actions", this);
        }
    }

    record MaxTokensEarlyTerminationPolicy(int maxTokens) implements EarlyTerminationPolicy {

        @Override
        public EarlyTermination shouldTerminate(AgentProcess agentProcess) {
            long used = agentProcess.usage().totalTokens();
            if (used < maxTokens) {
                return null;
            }
            return new EarlyTermination(agentProcess, false,
                    "Max tokens of " + maxTokens + " reached with " + used + " tokens used", this);
        }
    }

    record HardBudgetLimitTerminationPolicy(double budget) implements EarlyTerminationPolicy {

        @Override
        public EarlyTermination shouldTerminate(AgentProcess agentProcess) {
            double spent = agentProcess.cost();
            if (spent < budget) {
                return null;
            }
            return new EarlyTermination(agentProcess, true,
                    String.format("Budget of $%.4f exhausted: spent $%.4f", budget, spent), this);
        }
    }

    record FirstOfEarlyTerminationPolicy(List<EarlyTerminationPolicy> policies) implements EarlyTerminationPolicy {

        public FirstOfEarlyTerminationPolicy {
            policies = policies == null ? List.of() : List.copyOf(policies);
        }

        @Override
        public EarlyTermination shouldTerminate(AgentProcess agentProcess) {
            for (EarlyTerminationPolicy policy : policies) {
                EarlyTermination termination = policy.shouldTerminate(agentProcess);
                if (termination != null) {
                    return termination;
                }
            }
            return null;
        }
    }
}
