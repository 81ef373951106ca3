package com.linlay.goapengine.validation;

import com.linlay.goapengine.core.AgentScope;

/**
 * Checks an agent definition before it is deployed.
 */
public interface AgentValidator {

    ValidationResult validate(AgentScope agentScope);
}
