package com.linlay.goapengine.core.support;

import com.linlay.goapengine.core.ActionInvocation;
import com.linlay.goapengine.core.AgentProcess;
import com.linlay.goapengine.core.Blackboard;
import com.linlay.goapengine.core.Condition;
import com.linlay.goapengine.core.IoBinding;
import com.linlay.goapengine.core.ProcessContext;
import com.linlay.goapengine.plan.ConditionDetermination;
import com.linlay.goapengine.plan.WorldState;
import com.linlay.goapengine.plan.WorldStateDeterminer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Evaluates the agent's known conditions against the process blackboard and history:
 * <ul>
 *     <li>{@code name:Type} is TRUE when a value of that type resolves for the name</li>
 *     <li>{@code hasRun_X} is TRUE when action X appears in the history</li>
 *     <li>an agent condition of that name is evaluated</li>
 *     <li>anything else is the explicit blackboard condition, FALSE when unset</li>
 * </ul>
 */
public class BlackboardWorldStateDeterminer implements WorldStateDeterminer {

    private static final Logger log = LoggerFactory.getLogger(BlackboardWorldStateDeterminer.class);

    private final ProcessContext processContext;

    public BlackboardWorldStateDeterminer(ProcessContext processContext) {
        this.processContext = processContext;
    }

    @Override
    public WorldState determineWorldState() {
        Map<String, ConditionDetermination> state = new LinkedHashMap<>();
        for (String condition : processContext.agentProcess().agent().planningSystem().knownConditions()) {
            state.put(condition, determineCondition(condition));
        }
        return new WorldState(state);
    }

    @Override
    public ConditionDetermination determineCondition(String condition) {
        AgentProcess agentProcess = processContext.agentProcess();
        Blackboard blackboard = agentProcess.blackboard();

        if (condition.startsWith(AbstractAction.HAS_RUN_CONDITION_PREFIX)) {
            String actionName = condition.substring(AbstractAction.HAS_RUN_CONDITION_PREFIX.length());
            boolean hasRun = false;
            for (ActionInvocation invocation : agentProcess.history()) {
                if (invocation.actionName().equals(actionName)) {
                    hasRun = true;
                    break;
                }
            }
            return ConditionDetermination.of(hasRun);
        }

        if (condition.contains(":")) {
            IoBinding binding = new IoBinding(condition);
            Object value = blackboard.getValue(binding.name(), binding.type(), agentProcess.agent().aggregations());
            return ConditionDetermination.of(value != null);
        }

        for (Condition known : agentProcess.agent().conditions()) {
            if (known.name().equals(condition) || known.name().endsWith("." + condition)) {
                ConditionDetermination determination = known.evaluate(processContext);
                log.debug("Condition {} evaluated to {} for process {}", condition, determination, agentProcess.id());
                return determination;
            }
        }

        return ConditionDetermination.of(blackboard.getCondition(condition)).asTrueOrFalse();
    }
}
