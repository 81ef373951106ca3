package com.linlay.goapengine.plan;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * A* search over world states. Nodes are ordered by accumulated action cost plus the number
 * of goal conditions still unsatisfied. The raw path is then pruned backwards from the goal
 * and forwards from the start to drop actions that do not contribute.
 *
 * <p>UNKNOWN conditions in the start state are planned around first. When assuming TRUE or
 * FALSE for them would change the chosen plan, they are determined for real and the search
 * is repeated from the resolved state.
 */
public class AStarGoapPlanner implements Planner {

    private static final Logger log = LoggerFactory.getLogger(AStarGoapPlanner.class);
    private static final int MAX_ITERATIONS = 10_000;

    private final WorldStateDeterminer worldStateDeterminer;

    public AStarGoapPlanner(WorldStateDeterminer worldStateDeterminer) {
        this.worldStateDeterminer = Objects.requireNonNull(worldStateDeterminer, "worldStateDeterminer");
    }

    @Override
    public WorldState worldState() {
        return worldStateDeterminer.determineWorldState();
    }

    @Override
    public GoapPlan planToGoal(Collection<? extends GoapAction> actions, GoapGoal goal) {
        WorldState startState = worldState();
        GoapPlan directPlan = planToGoalFrom(startState, actions, goal);

        List<String> unknownConditions = startState.unknownConditions();
        if (unknownConditions.isEmpty()) {
            return directPlan;
        }

        Set<String> distinctPlans = new LinkedHashSet<>();
        distinctPlans.add(signature(directPlan));
        for (String condition : unknownConditions) {
            for (WorldState variant : startState.variants(condition)) {
                distinctPlans.add(signature(planToGoalFrom(variant, actions, goal)));
            }
        }
        if (distinctPlans.size() == 1) {
            return directPlan;
        }

        Map<String, ConditionDetermination> resolved = new LinkedHashMap<>();
        for (String condition : unknownConditions) {
            resolved.put(condition, worldStateDeterminer.determineCondition(condition));
        }
        log.debug("Resolved unknown conditions {} for goal {}", resolved, goal.name());
        return planToGoalFrom(startState.withAll(resolved), actions, goal);
    }

    GoapPlan planToGoalFrom(WorldState startState, Collection<? extends GoapAction> actions, GoapGoal goal) {
        PriorityQueue<SearchNode> openList = new PriorityQueue<>();
        Map<WorldState, Double> gScores = new HashMap<>();
        Map<WorldState, Step> cameFrom = new HashMap<>();
        Set<WorldState> closedSet = new HashSet<>();

        gScores.put(startState, 0.0);
        openList.add(new SearchNode(startState, 0.0, heuristic(startState, goal)));

        SearchNode bestGoalNode = null;
        double bestGoalScore = Double.MAX_VALUE;
        int iterations = 0;

        while (!openList.isEmpty() && iterations < MAX_ITERATIONS) {
            iterations++;
            SearchNode current = openList.poll();
            if (bestGoalNode != null && current.gScore() >= bestGoalScore) {
                continue;
            }
            if (!closedSet.add(current.state())) {
                continue;
            }
            if (goal.isAchievable(current.state())) {
                if (bestGoalNode == null || current.gScore() < bestGoalScore) {
                    bestGoalNode = current;
                    bestGoalScore = current.gScore();
                }
                continue;
            }

            for (GoapAction action : actions) {
                if (!action.isAchievable(current.state())) {
                    continue;
                }
                WorldState nextState = applyAction(current.state(), action);
                if (nextState.equals(current.state())) {
                    continue;
                }
                double tentative = gScores.getOrDefault(current.state(), Double.MAX_VALUE) + action.cost();
                if (bestGoalNode != null && tentative >= bestGoalScore) {
                    continue;
                }
                if (tentative < gScores.getOrDefault(nextState, Double.MAX_VALUE)) {
                    cameFrom.put(nextState, new Step(current.state(), action));
                    gScores.put(nextState, tentative);
                    closedSet.remove(nextState);
                    openList.add(new SearchNode(nextState, tentative, heuristic(nextState, goal)));
                }
            }
        }

        if (iterations >= MAX_ITERATIONS) {
            log.warn("Planning for goal {} stopped after {} iterations", goal.name(), iterations);
        }
        if (bestGoalNode == null) {
            return null;
        }

        List<GoapAction> path = reconstructPath(cameFrom, startState, bestGoalNode.state());
        List<GoapAction> backward = backwardOptimization(path, goal);
        List<GoapAction> optimized = forwardOptimization(backward, startState, goal);
        return new GoapPlan(optimized, goal, startState);
    }

    /**
     * Walk back from the goal keeping only actions whose effects some later step needs.
     */
    private List<GoapAction> backwardOptimization(List<GoapAction> plan, GoapGoal goal) {
        if (plan.isEmpty()) {
            return plan;
        }
        Map<String, ConditionDetermination> targets = new HashMap<>(goal.preconditions());
        List<GoapAction> kept = new ArrayList<>();
        for (int i = plan.size() - 1; i >= 0; i--) {
            GoapAction action = plan.get(i);
            boolean necessary = false;
            for (Map.Entry<String, ConditionDetermination> effect : action.effects().entrySet()) {
                if (effect.getValue() == targets.get(effect.getKey())) {
                    necessary = true;
                    targets.remove(effect.getKey());
                    targets.putAll(action.preconditions());
                }
            }
            if (necessary) {
                kept.add(action);
            }
        }
        Collections.reverse(kept);
        return kept;
    }

    /**
     * Replay the plan from the start, dropping actions that move no goal condition.
     * Falls back to the input when the pruned plan no longer reaches the goal.
     */
    private List<GoapAction> forwardOptimization(List<GoapAction> plan, WorldState startState, GoapGoal goal) {
        if (plan.isEmpty()) {
            return plan;
        }
        List<GoapAction> optimized = new ArrayList<>();
        WorldState currentState = startState;
        for (GoapAction action : plan) {
            if (!action.isAchievable(currentState)) {
                continue;
            }
            WorldState nextState = applyAction(currentState, action);
            if (!nextState.equals(currentState) && makesProgress(action, currentState, nextState, goal)) {
                optimized.add(action);
                currentState = nextState;
            }
        }
        if (!goal.isAchievable(simulate(startState, optimized))) {
            return plan;
        }
        return optimized;
    }

    private boolean makesProgress(GoapAction action, WorldState currentState, WorldState nextState, GoapGoal goal) {
        Map<String, ConditionDetermination> required = goal.preconditions();
        for (Map.Entry<String, ConditionDetermination> effect : action.effects().entrySet()) {
            String key = effect.getKey();
            if (!required.containsKey(key) || currentState.get(key) == required.get(key)) {
                continue;
            }
            if (effect.getValue() == required.get(key) || nextState.get(key) == null) {
                return true;
            }
        }
        return false;
    }

    private WorldState simulate(WorldState startState, List<GoapAction> actions) {
        WorldState state = startState;
        for (GoapAction action : actions) {
            if (action.isAchievable(state)) {
                state = applyAction(state, action);
            }
        }
        return state;
    }

    private double heuristic(WorldState state, GoapGoal goal) {
        long unsatisfied = goal.preconditions().entrySet().stream()
                .filter(entry -> state.get(entry.getKey()) != entry.getValue())
                .count();
        return unsatisfied;
    }

    private WorldState applyAction(WorldState state, GoapAction action) {
        return state.withAll(action.effects());
    }

    private List<GoapAction> reconstructPath(Map<WorldState, Step> cameFrom, WorldState startState, WorldState goalState) {
        List<GoapAction> actions = new ArrayList<>();
        WorldState current = goalState;
        Step step;
        while (!current.equals(startState) && (step = cameFrom.get(current)) != null) {
            actions.add(step.action());
            current = step.previous();
        }
        Collections.reverse(actions);
        return actions;
    }

    private static String signature(GoapPlan plan) {
        if (plan == null) {
            return "<none>";
        }
        return plan.actions().stream().map(GoapAction::name).reduce((a, b) -> a + "," + b).orElse("");
    }

    private record Step(WorldState previous, GoapAction action) {
    }

    private record SearchNode(WorldState state, double gScore, double hScore) implements Comparable<SearchNode> {

        double fScore() {
            return gScore + hScore;
        }

        @Override
        public int compareTo(SearchNode other) {
            return Double.compare(fScore(), other.fScore());
        }
    }
}
