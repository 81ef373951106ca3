package com.linlay.goapengine.config;

import com.linlay.goapengine.core.ProcessOptions;
import com.linlay.goapengine.core.policy.Budget;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "agent.platform")
public class AgentPlatformProperties {

    private String name = "goap-agent-platform";
    private String description = "Goal-oriented agent platform";
    private boolean allowGoalChange = true;
    private boolean logEvents = true;
    private BudgetProperties budget = new BudgetProperties();
    private ProcessRepositoryProperties processRepository = new ProcessRepositoryProperties();
    private ValidationProperties validation = new ValidationProperties();

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public boolean isAllowGoalChange() {
        return allowGoalChange;
    }

    public void setAllowGoalChange(boolean allowGoalChange) {
        this.allowGoalChange = allowGoalChange;
    }

    public boolean isLogEvents() {
        return logEvents;
    }

    public void setLogEvents(boolean logEvents) {
        this.logEvents = logEvents;
    }

    public BudgetProperties getBudget() {
        return budget;
    }

    public void setBudget(BudgetProperties budget) {
        this.budget = budget;
    }

    public ProcessRepositoryProperties getProcessRepository() {
        return processRepository;
    }

    public void setProcessRepository(ProcessRepositoryProperties processRepository) {
        this.processRepository = processRepository;
    }

    public ValidationProperties getValidation() {
        return validation;
    }

    public void setValidation(ValidationProperties validation) {
        this.validation = validation;
    }

    public ProcessOptions defaultProcessOptions() {
        return ProcessOptions.DEFAULT
                .withAllowGoalChange(allowGoalChange)
                .withBudget(budget.toBudget());
    }

    public static class BudgetProperties {

        private double cost = Budget.DEFAULT_COST_LIMIT;
        private int actions = Budget.DEFAULT_ACTION_LIMIT;
        private int tokens = Budget.DEFAULT_TOKEN_LIMIT;

        public double getCost() {
            return cost;
        }

        public void setCost(double cost) {
            this.cost = cost;
        }

        public int getActions() {
            return actions;
        }

        public void setActions(int actions) {
            this.actions = actions;
        }

        public int getTokens() {
            return tokens;
        }

        public void setTokens(int tokens) {
            this.tokens = tokens;
        }

        public Budget toBudget() {
            return new Budget(cost, actions, tokens);
        }
    }

    public static class ProcessRepositoryProperties {

        private int windowSize = 1000;

        public int getWindowSize() {
            return windowSize;
        }

        public void setWindowSize(int windowSize) {
            this.windowSize = windowSize;
        }
    }

    public static class ValidationProperties {

        /**
         * Skip agents that fail validation instead of deploying them.
         */
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }
}
