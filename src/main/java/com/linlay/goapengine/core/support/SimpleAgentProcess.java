package com.linlay.goapengine.core.support;

import com.linlay.goapengine.core.Action;
import com.linlay.goapengine.core.ActionStatus;
import com.linlay.goapengine.core.Agent;
import com.linlay.goapengine.core.AgentProcess;
import com.linlay.goapengine.core.AgentProcessStatusCode;
import com.linlay.goapengine.core.Blackboard;
import com.linlay.goapengine.core.Goal;
import com.linlay.goapengine.core.ProcessOptions;
import com.linlay.goapengine.event.AgentProcessPlanFormulatedEvent;
import com.linlay.goapengine.event.AgentProcessReadyToPlanEvent;
import com.linlay.goapengine.event.GoalAchievedEvent;
import com.linlay.goapengine.plan.AStarGoapPlanner;
import com.linlay.goapengine.plan.ConditionDetermination;
import com.linlay.goapengine.plan.GoapPlan;
import com.linlay.goapengine.plan.Planner;
import com.linlay.goapengine.plan.WorldState;
import com.linlay.goapengine.plan.WorldStateDeterminer;
import com.linlay.goapengine.spi.PlatformServices;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Replans from scratch on every tick and executes the first action of the best plan.
 */
public class SimpleAgentProcess extends AbstractAgentProcess {

    private static final Logger log = LoggerFactory.getLogger(SimpleAgentProcess.class);

    private final WorldStateDeterminer worldStateDeterminer;

    public SimpleAgentProcess(
            String id,
            String parentId,
            Agent agent,
            ProcessOptions processOptions,
            Blackboard blackboard,
            PlatformServices platformServices
    ) {
        super(id, parentId, agent, processOptions, blackboard, platformServices);
        this.worldStateDeterminer = new BlackboardWorldStateDeterminer(processContext());
    }

    @Override
    public AgentProcess tick() {
        WorldState worldState = worldStateDeterminer.determineWorldState();
        setLastWorldState(worldState);
        processContext().onProcessEvent(new AgentProcessReadyToPlanEvent(this, worldState));

        GoapPlan plan = plannerFor(worldState).bestValuePlanToAnyGoal(agent().planningSystem());
        if (plan == null) {
            log.info("Process {} found no plan to any goal from {}", id(), worldState.infoString(false));
            setStatus(AgentProcessStatusCode.STUCK);
            return this;
        }

        Goal planGoal = resolveGoal(plan.goal().name());
        commitToGoal(planGoal);

        if (plan.isComplete()) {
            log.info("Process {} achieved goal {}", id(), planGoal.name());
            processContext().onProcessEvent(new GoalAchievedEvent(this, worldState, planGoal));
            setStatus(AgentProcessStatusCode.COMPLETED);
            return this;
        }

        boolean verbosePlan = processOptions().verbosity().showLongPlans();
        log.debug("Process {} formulated {}", id(), plan.infoString(verbosePlan));
        processContext().onProcessEvent(new AgentProcessPlanFormulatedEvent(this, worldState, plan));

        Action action = resolveAction(plan.actions().get(0).name());
        ActionStatus actionStatus = executeAction(action);
        setStatus(switch (actionStatus.status()) {
            case SUCCEEDED -> AgentProcessStatusCode.RUNNING;
            case FAILED -> AgentProcessStatusCode.FAILED;
            case WAITING -> AgentProcessStatusCode.WAITING;
            case PAUSED -> AgentProcessStatusCode.PAUSED;
        });
        return this;
    }

    /**
     * A planner that starts from the state this tick already determined, re-evaluating
     * individual conditions only when the planner asks.
     */
    private Planner plannerFor(WorldState worldState) {
        return new AStarGoapPlanner(new WorldStateDeterminer() {
            @Override
            public WorldState determineWorldState() {
                return worldState;
            }

            @Override
            public ConditionDetermination determineCondition(String condition) {
                return worldStateDeterminer.determineCondition(condition);
            }
        });
    }

    private Goal resolveGoal(String goalName) {
        return agent().goals().stream()
                .filter(goal -> goal.name().equals(goalName))
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("Planned goal " + goalName
                        + " is not a goal of agent " + agent().name()));
    }

    private Action resolveAction(String actionName) {
        List<Action> matches = agent().actions().stream()
                .filter(action -> action.name().equals(actionName))
                .toList();
        if (matches.size() != 1) {
            throw new IllegalStateException("Expected exactly one action named " + actionName
                    + " in agent " + agent().name() + " but found " + matches.size());
        }
        return matches.get(0);
    }
}
