package com.linlay.goapengine.core;

import com.linlay.goapengine.plan.GoapPlanningSystem;
import com.linlay.goapengine.spi.StuckHandler;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * An immutable, deployable agent. Schema types and the planning system are computed once.
 */
public final class Agent implements AgentScope {

    public static final String DEFAULT_VERSION = "0.1.0";

    private final String name;
    private final String provider;
    private final String version;
    private final String description;
    private final Set<Condition> conditions;
    private final List<Action> actions;
    private final Set<Goal> goals;
    private final StuckHandler stuckHandler;
    private final AggregationRegistry aggregations;
    private final List<SchemaType> schemaTypes;
    private final GoapPlanningSystem planningSystem;

    public Agent(
            String name,
            String provider,
            String version,
            String description,
            Collection<? extends Condition> conditions,
            Collection<? extends Action> actions,
            Collection<Goal> goals,
            StuckHandler stuckHandler,
            AggregationRegistry aggregations
    ) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Agent name must not be blank");
        }
        this.name = name;
        this.provider = provider == null ? "" : provider;
        this.version = version == null || version.isBlank() ? DEFAULT_VERSION : version;
        this.description = description == null ? name : description;
        this.conditions = conditions == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(conditions));
        this.actions = actions == null ? List.of() : List.copyOf(actions);
        this.goals = goals == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(goals));
        this.stuckHandler = stuckHandler;
        this.aggregations = aggregations == null ? AggregationRegistry.EMPTY : aggregations;
        this.schemaTypes = AgentScope.inferSchemaTypes(this.actions);
        this.planningSystem = GoapPlanningSystem.of(this.actions, this.goals);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    @Override
    public String name() {
        return name;
    }

    public String provider() {
        return provider;
    }

    public String version() {
        return version;
    }

    @Override
    public String description() {
        return description;
    }

    @Override
    public Set<Condition> conditions() {
        return conditions;
    }

    @Override
    public List<Action> actions() {
        return actions;
    }

    @Override
    public Set<Goal> goals() {
        return goals;
    }

    /**
     * @return the handler, or null when the agent has none
     */
    public StuckHandler stuckHandler() {
        return stuckHandler;
    }

    @Override
    public AggregationRegistry aggregations() {
        return aggregations;
    }

    @Override
    public List<SchemaType> schemaTypes() {
        return schemaTypes;
    }

    @Override
    public GoapPlanningSystem planningSystem() {
        return planningSystem;
    }

    /**
     * A copy of this agent that pursues only the given goal.
     */
    public Agent withSingleGoal(Goal goal) {
        return new Agent(name, provider, version, description, conditions, actions, List.of(goal), stuckHandler, aggregations);
    }

    public Agent withStuckHandler(StuckHandler stuckHandler) {
        return new Agent(name, provider, version, description, conditions, actions, goals, stuckHandler, aggregations);
    }

    public Action findAction(String actionName) {
        return actions.stream()
                .filter(action -> action.name().equals(actionName))
                .findFirst()
                .orElse(null);
    }

    @Override
    public String toString() {
        return "Agent(" + name + ")";
    }

    public static final class Builder {

        private final String name;
        private String provider = "";
        private String version = DEFAULT_VERSION;
        private String description;
        private final List<Condition> conditions = new ArrayList<>();
        private final List<Action> actions = new ArrayList<>();
        private final List<Goal> goals = new ArrayList<>();
        private StuckHandler stuckHandler;
        private AggregationRegistry aggregations = AggregationRegistry.EMPTY;

        private Builder(String name) {
            this.name = name;
        }

        public Builder provider(String provider) {
            this.provider = provider;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder condition(Condition condition) {
            this.conditions.add(condition);
            return this;
        }

        public Builder action(Action action) {
            this.actions.add(action);
            return this;
        }

        public Builder goal(Goal goal) {
            this.goals.add(goal);
            return this;
        }

        public Builder stuckHandler(StuckHandler stuckHandler) {
            this.stuckHandler = stuckHandler;
            return this;
        }

        public <T extends Aggregation> Builder aggregation(Class<T> type, AggregationFactory<T> factory) {
            this.aggregations = aggregations.register(type, factory);
            return this;
        }

        public Agent build() {
            return new Agent(name, provider, version, description, conditions, actions, goals, stuckHandler, aggregations);
        }
    }
}
