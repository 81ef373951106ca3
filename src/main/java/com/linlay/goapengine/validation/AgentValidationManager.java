package com.linlay.goapengine.validation;

import com.linlay.goapengine.core.AgentScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Runs every registered validator against an agent and merges their errors.
 */
public class AgentValidationManager {

    private static final Logger log = LoggerFactory.getLogger(AgentValidationManager.class);

    private final List<AgentValidator> validators;

    public AgentValidationManager(List<AgentValidator> validators) {
        this.validators = validators == null ? List.of() : List.copyOf(validators);
    }

    public ValidationResult validate(AgentScope agentScope) {
        ValidationResult result = ValidationResult.VALID;
        for (AgentValidator validator : validators) {
            result = result.plus(validator.validate(agentScope));
        }
        if (!result.isValid()) {
            result.errors().forEach(error -> log.warn("Agent {} failed validation: {}", agentScope.name(), error));
        }
        return result;
    }
}
