package com.linlay.goapengine.core.policy;

import com.linlay.goapengine.core.ActionInvocation;
import com.linlay.goapengine.core.AgentProcess;
import com.linlay.goapengine.core.Usage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class EarlyTerminationPolicyTest {

    private AgentProcess agentProcess;

    @BeforeEach
    void setUp() {
        agentProcess = mock(AgentProcess.class);
        when(agentProcess.id()).thenReturn("process-1");
        when(agentProcess.history()).thenReturn(List.of());
        when(agentProcess.usage()).thenReturn(Usage.NONE);
        when(agentProcess.cost()).thenReturn(0.0);
    }

    @Test
    void shouldContinueWithinAllLimits() {
        assertThat(Budget.DEFAULT.earlyTerminationPolicy().shouldTerminate(agentProcess)).isNull();
    }

    @Test
    void shouldStopAtActionLimit() {
        when(agentProcess.history()).thenReturn(invocations(3));

        EarlyTermination termination = EarlyTerminationPolicy.maxActions(3).shouldTerminate(agentProcess);

        assertThat(termination).isNotNull();
        assertThat(termination.isError()).isFalse();
        assertThat(termination.getProcessId()).isEqualTo("process-1");
        assertThat(termination.getReason()).contains("3");
        assertThat(EarlyTerminationPolicy.maxActions(4).shouldTerminate(agentProcess)).isNull();
    }

    @Test
    void shouldStopAtTokenLimit() {
        when(agentProcess.usage()).thenReturn(new Usage(400, 600));

        assertThat(EarlyTerminationPolicy.maxTokens(1000).shouldTerminate(agentProcess)).isNotNull();
        assertThat(EarlyTerminationPolicy.maxTokens(1001).shouldTerminate(agentProcess)).isNull();
    }

    @Test
    void shouldStopAtTokenLimitWhenUsageExceedsIntRange() {
        Usage usage = new Usage(Integer.MAX_VALUE, Integer.MAX_VALUE);
        when(agentProcess.usage()).thenReturn(usage);

        assertThat(usage.totalTokens()).isEqualTo(2L * Integer.MAX_VALUE);
        assertThat(EarlyTerminationPolicy.maxTokens(Integer.MAX_VALUE).shouldTerminate(agentProcess)).isNotNull();
    }

    @Test
    void shouldStopWithErrorWhenCostBudgetIsSpent() {
        when(agentProcess.cost()).thenReturn(2.5);

        EarlyTermination termination = EarlyTerminationPolicy.hardBudgetLimit(2.0).shouldTerminate(agentProcess);

        assertThat(termination.isError()).isTrue();
        assertThat(termination.getPolicy().name()).isEqualTo("HardBudgetLimitTerminationPolicy");
    }

    @Test
    void shouldReportFirstTriggeredPolicyInBudgetOrder() {
        when(agentProcess.history()).thenReturn(invocations(3));
        when(agentProcess.usage()).thenReturn(new Usage(5000, 5000));
        when(agentProcess.cost()).thenReturn(10.0);

        EarlyTermination termination = new Budget(1.0, 3, 100).earlyTerminationPolicy().shouldTerminate(agentProcess);

        assertThat(termination.getPolicy().name()).isEqualTo("MaxActionsEarlyTerminationPolicy");
    }

    @Test
    void shouldFallBackToDefaultsForNonPositiveLimits() {
        Budget budget = new Budget(0, -1, 0);

        assertThat(budget).isEqualTo(Budget.DEFAULT);
        assertThat(Budget.ofActions(7).actions()).isEqualTo(7);
        assertThat(Budget.ofActions(7).cost()).isEqualTo(Budget.DEFAULT_COST_LIMIT);
        assertThat(Budget.DEFAULT.withTokens(10).tokens()).isEqualTo(10);
    }

    @Test
    void shouldDeriveControlFromBudget() {
        ProcessControl control = ProcessControl.of(Budget.ofActions(2));

        assertThat(control.operationDelay()).isEqualTo(Delay.NONE);
        assertThat(control.withOperationDelay(Delay.MEDIUM).operationDelay().duration()).isEqualTo(Duration.ofMillis(400));
        when(agentProcess.history()).thenReturn(invocations(2));
        assertThat(control.earlyTerminationPolicy().shouldTerminate(agentProcess)).isNotNull();
    }

    private static List<ActionInvocation> invocations(int count) {
        List<ActionInvocation> invocations = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            invocations.add(new ActionInvocation("action-" + i, Instant.now(), Duration.ZERO));
        }
        return invocations;
    }
}
