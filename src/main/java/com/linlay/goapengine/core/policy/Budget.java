package com.linlay.goapengine.core.policy;

/**
 * Limits applied to one agent process. Non-positive values fall back to the defaults.
 */
public record Budget(
        double cost,
        int actions,
        int tokens
) {

    public static final double DEFAULT_COST_LIMIT = 2.0;
    public static final int DEFAULT_ACTION_LIMIT = 50;
    public static final int DEFAULT_TOKEN_LIMIT = 1_000_000;

    public static final Budget DEFAULT = new Budget(DEFAULT_COST_LIMIT, DEFAULT_ACTION_LIMIT, DEFAULT_TOKEN_LIMIT);

    public Budget {
        cost = cost > 0 ? cost : DEFAULT_COST_LIMIT;
        actions = actions > 0 ? actions : DEFAULT_ACTION_LIMIT;
        tokens = tokens > 0 ? tokens : DEFAULT_TOKEN_LIMIT;
    }

    public static Budget ofActions(int actions) {
        return new Budget(DEFAULT_COST_LIMIT, actions, DEFAULT_TOKEN_LIMIT);
    }

    public Budget withCost(double cost) {
        return new Budget(cost, actions, tokens);
    }

    public Budget withActions(int actions) {
        return new Budget(cost, actions, tokens);
    }

    public Budget withTokens(int tokens) {
        return new Budget(cost, actions, tokens);
    }

    /**
     * Action count first, then tokens, then cost.
     */
    public EarlyTerminationPolicy earlyTerminationPolicy() {
        return EarlyTerminationPolicy.firstOf(
                EarlyTerminationPolicy.maxActions(actions),
                EarlyTerminationPolicy.maxTokens(tokens),
                EarlyTerminationPolicy.hardBudgetLimit(cost)
        );
    }
}
