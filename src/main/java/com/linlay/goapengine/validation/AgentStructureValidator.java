package com.linlay.goapengine.validation;

import com.linlay.goapengine.core.AgentScope;

import java.util.ArrayList;
import java.util.List;

/**
 * Rejects empty agents and agents without goals.
 */
public class AgentStructureValidator implements AgentValidator {

    public static final String EMPTY_AGENT_STRUCTURE = "EMPTY_AGENT_STRUCTURE";
    public static final String MISSING_GOALS = "MISSING_GOALS";

    @Override
    public ValidationResult validate(AgentScope agentScope) {
        List<ValidationError> errors = new ArrayList<>();
        if (agentScope.actions().isEmpty() && agentScope.conditions().isEmpty() && agentScope.goals().isEmpty()) {
            errors.add(new ValidationError(EMPTY_AGENT_STRUCTURE,
                    "Agent '" + agentScope.name() + "' has no actions, conditions or goals", agentScope.name(), null));
        }
        if (agentScope.goals().isEmpty()) {
            errors.add(new ValidationError(MISSING_GOALS,
                    "Agent '" + agentScope.name() + "' must have at least one goal", agentScope.name(), null));
        }
        return new ValidationResult(errors);
    }
}
