package com.linlay.goapengine.validation;

import com.linlay.goapengine.core.Agent;
import com.linlay.goapengine.core.support.TestAgents;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AgentValidationManagerTest {

    @Test
    void shouldMergeErrorsOfAllValidators() {
        AgentValidator first = mock(AgentValidator.class);
        AgentValidator second = mock(AgentValidator.class);
        when(first.validate(any())).thenReturn(ValidationResult.of(new ValidationError("A", "first", "x", null)));
        when(second.validate(any())).thenReturn(ValidationResult.of(new ValidationError("B", "second", "x", "step")));

        ValidationResult result = new AgentValidationManager(List.of(first, second)).validate(TestAgents.fooToBarAgent());

        assertThat(result.isValid()).isFalse();
        assertThat(result.errors()).extracting(ValidationError::code).containsExactly("A", "B");
        assertThat(result.errors().get(0).component()).isEqualTo("x");
    }

    @Test
    void shouldPassValidAgentThroughDefaultValidators() {
        AgentValidationManager manager = new AgentValidationManager(
                List.of(new AgentStructureValidator(), new GoapPathToCompletionValidator()));

        assertThat(manager.validate(TestAgents.fooToBarAgent()).isValid()).isTrue();
        assertThat(manager.validate(Agent.builder("empty").build()).isValid()).isFalse();
    }
}
