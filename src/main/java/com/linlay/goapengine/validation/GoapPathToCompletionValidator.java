package com.linlay.goapengine.validation;

import com.linlay.goapengine.core.Action;
import com.linlay.goapengine.core.AgentScope;
import com.linlay.goapengine.core.Condition;
import com.linlay.goapengine.core.Goal;
import com.linlay.goapengine.core.support.AbstractAction;
import com.linlay.goapengine.plan.AStarGoapPlanner;
import com.linlay.goapengine.plan.ConditionDetermination;
import com.linlay.goapengine.plan.GoapAction;
import com.linlay.goapengine.plan.GoapGoal;
import com.linlay.goapengine.plan.GoapPlan;
import com.linlay.goapengine.plan.WorldStateDeterminer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Plans every goal from a start state in which only external inputs hold.
 * <p>
 * An external input is a condition some action requires that no action produces,
 * or a condition the agent computes itself. Everything else starts FALSE.
 * Rerun guards are ignored.
 */
public class GoapPathToCompletionValidator implements AgentValidator {

    public static final String NO_ACTIONS_TO_GOALS = "NO_ACTIONS_TO_GOALS";
    public static final String NO_PATH_TO_GOAL = "NO_PATH_TO_GOAL";

    private static final Logger log = LoggerFactory.getLogger(GoapPathToCompletionValidator.class);

    @Override
    public ValidationResult validate(AgentScope agentScope) {
        if (agentScope.goals().isEmpty()) {
            return ValidationResult.VALID;
        }
        if (agentScope.actions().isEmpty()) {
            return ValidationResult.of(new ValidationError(NO_ACTIONS_TO_GOALS,
                    "Agent '" + agentScope.name() + "' has goals but no actions", agentScope.name(), null));
        }

        List<GoapAction> actions = new ArrayList<>();
        Set<String> produced = new LinkedHashSet<>();
        Set<String> required = new LinkedHashSet<>();
        for (Action action : agentScope.actions()) {
            Map<String, ConditionDetermination> preconditions = withoutRerunGuards(action.preconditions());
            Map<String, ConditionDetermination> effects = withoutRerunGuards(action.effects());
            actions.add(GoapAction.of(action.name(), preconditions, effects, action.cost(), action.value()));
            effects.forEach((condition, determination) -> {
                if (determination == ConditionDetermination.TRUE) {
                    produced.add(condition);
                }
            });
            preconditions.forEach((condition, determination) -> {
                if (determination == ConditionDetermination.TRUE) {
                    required.add(condition);
                }
            });
        }
        for (Condition condition : agentScope.conditions()) {
            required.add(condition.name());
        }

        Map<String, ConditionDetermination> startState = new LinkedHashMap<>();
        actions.forEach(action -> action.knownConditions()
                .forEach(condition -> startState.put(condition, ConditionDetermination.FALSE)));
        for (Goal goal : agentScope.goals()) {
            withoutRerunGuards(goal.preconditions()).keySet()
                    .forEach(condition -> startState.putIfAbsent(condition, ConditionDetermination.FALSE));
        }
        required.stream()
                .filter(condition -> !produced.contains(condition))
                .forEach(condition -> startState.put(condition, ConditionDetermination.TRUE));
        log.debug("Validating paths of agent {} from {}", agentScope.name(), startState);

        AStarGoapPlanner planner = new AStarGoapPlanner(WorldStateDeterminer.fromMap(startState));
        List<String> unreachable = new ArrayList<>();
        for (Goal goal : agentScope.goals()) {
            GoapGoal target = new GoapGoal.SimpleGoapGoal(goal.name(), withoutRerunGuards(goal.preconditions()), goal.value());
            GoapPlan plan = planner.planToGoal(actions, target);
            if (plan == null) {
                unreachable.add(goal.name());
            } else {
                log.debug("Agent {} reaches goal {} in {} action(s)", agentScope.name(), goal.name(), plan.actions().size());
            }
        }
        if (unreachable.isEmpty()) {
            return ValidationResult.VALID;
        }
        return ValidationResult.of(new ValidationError(NO_PATH_TO_GOAL,
                "No path found to goals " + unreachable + " of agent '" + agentScope.name() + "'",
                agentScope.name(), null));
    }

    private static Map<String, ConditionDetermination> withoutRerunGuards(Map<String, ConditionDetermination> conditions) {
        Map<String, ConditionDetermination> filtered = new LinkedHashMap<>();
        conditions.forEach((condition, determination) -> {
            if (!condition.startsWith(AbstractAction.HAS_RUN_CONDITION_PREFIX)) {
                filtered.put(condition, determination);
            }
        });
        return filtered;
    }
}
