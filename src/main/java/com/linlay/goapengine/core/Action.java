package com.linlay.goapengine.core;

import com.linlay.goapengine.plan.GoapAction;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A step an agent can take. Preconditions and effects are derived from the declared inputs,
 * outputs and named conditions so the planner can chain actions together.
 */
public interface Action extends GoapAction {

    String description();

    Set<IoBinding> inputs();

    Set<IoBinding> outputs();

    boolean canRerun();

    ActionQos qos();

    Collection<String> toolGroups();

    /**
     * Runs the action once. Retry is applied by the caller.
     *
     * @param outputTypes schema types of the declared outputs, by type name
     */
    ActionStatus execute(ProcessContext processContext, Map<String, SchemaType> outputTypes);

    /**
     * Properties of the input variable this action reads, merged into the inferred schema type.
     */
    default Set<PropertyDefinition> referencedInputProperties(String variable) {
        return Set.of();
    }

    /**
     * Schema types for every input and output type name, carrying the properties this action references.
     */
    default List<SchemaType> schemaTypes() {
        List<SchemaType> types = new ArrayList<>();
        for (IoBinding input : inputs()) {
            types.add(new SchemaType(input.type(), input.type(),
                    new ArrayList<>(referencedInputProperties(input.name()))));
        }
        for (IoBinding output : outputs()) {
            types.add(new SchemaType(output.type()));
        }
        return types;
    }

    default String infoString() {
        return name() + ": " + inputs().stream().map(IoBinding::value).collect(Collectors.joining(", "))
                + " -> " + outputs().stream().map(IoBinding::value).collect(Collectors.joining(", "))
                + " cost=" + cost() + " value=" + value();
    }
}
