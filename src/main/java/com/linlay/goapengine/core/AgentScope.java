package com.linlay.goapengine.core;

import com.linlay.goapengine.plan.GoapPlanningSystem;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A named bundle of actions, goals and conditions. Agents and platforms are both scopes.
 */
public interface AgentScope {

    String name();

    String description();

    List<Action> actions();

    Set<Goal> goals();

    Set<Condition> conditions();

    default AggregationRegistry aggregations() {
        return AggregationRegistry.EMPTY;
    }

    /**
     * Types referenced by action inputs and outputs, merged by name and sorted.
     */
    default List<SchemaType> schemaTypes() {
        return inferSchemaTypes(actions());
    }

    default List<DomainType> domainTypes() {
        List<DomainType> types = new ArrayList<>(schemaTypes());
        aggregations().types().forEach(type -> types.add(new JvmType(type)));
        return types;
    }

    default SchemaType resolveSchemaType(String name) {
        return schemaTypes().stream()
                .filter(type -> type.name().equals(name))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown schema type: " + name + " in " + name()));
    }

    default GoapPlanningSystem planningSystem() {
        return GoapPlanningSystem.of(actions(), goals());
    }

    default String infoString(boolean verbose) {
        if (!verbose) {
            return name() + ": " + actions().size() + " actions, " + goals().size() + " goals";
        }
        return name() + " - " + description()
                + "\n  actions:\n    " + actions().stream().map(Action::infoString).collect(Collectors.joining("\n    "))
                + "\n  goals:\n    " + goals().stream().map(Goal::infoString).collect(Collectors.joining("\n    "))
                + "\n  conditions: " + conditions().stream().map(Condition::name).collect(Collectors.joining(", "))
                + "\n  types: " + schemaTypes().stream().map(SchemaType::name).collect(Collectors.joining(", "));
    }

    static List<SchemaType> inferSchemaTypes(Collection<? extends Action> actions) {
        Map<String, SchemaType> merged = new LinkedHashMap<>();
        for (Action action : actions) {
            for (SchemaType type : action.schemaTypes()) {
                merged.merge(type.name(), type, SchemaType::merge);
            }
        }
        List<SchemaType> sorted = new ArrayList<>(merged.values());
        sorted.sort((a, b) -> a.name().compareTo(b.name()));
        return List.copyOf(sorted);
    }

    static AgentScope of(
            String name,
            String description,
            Collection<? extends Action> actions,
            Collection<Goal> goals,
            Collection<? extends Condition> conditions
    ) {
        return new SimpleAgentScope(name, description, List.copyOf(actions),
                new LinkedHashSet<>(goals), new LinkedHashSet<>(conditions));
    }

    record SimpleAgentScope(
            String name,
            String description,
            List<Action> actions,
            Set<Goal> goals,
            Set<Condition> conditions
    ) implements AgentScope {
    }
}
