package com.linlay.goapengine.core.support;

import com.linlay.goapengine.core.ActionBody;
import com.linlay.goapengine.core.ActionQos;
import com.linlay.goapengine.core.ActionRunner;
import com.linlay.goapengine.core.ActionStatus;
import com.linlay.goapengine.core.IoBinding;
import com.linlay.goapengine.core.ProcessContext;
import com.linlay.goapengine.core.PropertyDefinition;
import com.linlay.goapengine.core.SchemaType;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * An action whose body is a lambda.
 */
public class FunctionAction extends AbstractAction {

    private final ActionBody body;
    private final Map<String, Set<PropertyDefinition>> inputProperties;

    public FunctionAction(
            String name,
            String description,
            Collection<String> pre,
            Collection<String> post,
            double cost,
            double value,
            Collection<IoBinding> inputs,
            Collection<IoBinding> outputs,
            boolean canRerun,
            ActionQos qos,
            Collection<String> toolGroups,
            Map<String, Set<PropertyDefinition>> inputProperties,
            ActionBody body
    ) {
        super(name, description, pre, post, cost, value, inputs, outputs, canRerun, qos, toolGroups);
        this.body = Objects.requireNonNull(body, "body");
        this.inputProperties = inputProperties == null ? Map.of() : Map.copyOf(inputProperties);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    @Override
    public ActionStatus execute(ProcessContext processContext, Map<String, SchemaType> outputTypes) {
        return ActionRunner.execute(processContext, this, body);
    }

    @Override
    public Set<PropertyDefinition> referencedInputProperties(String variable) {
        return inputProperties.getOrDefault(variable, Set.of());
    }

    public static final class Builder {

        private final String name;
        private String description;
        private final List<String> pre = new ArrayList<>();
        private final List<String> post = new ArrayList<>();
        private double cost;
        private double value;
        private final List<IoBinding> inputs = new ArrayList<>();
        private final List<IoBinding> outputs = new ArrayList<>();
        private boolean canRerun;
        private ActionQos qos = ActionQos.DEFAULT;
        private final List<String> toolGroups = new ArrayList<>();
        private final Map<String, Set<PropertyDefinition>> inputProperties = new LinkedHashMap<>();
        private ActionBody body;

        private Builder(String name) {
            this.name = name;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder pre(String... conditions) {
            this.pre.addAll(List.of(conditions));
            return this;
        }

        public Builder post(String... conditions) {
            this.post.addAll(List.of(conditions));
            return this;
        }

        public Builder cost(double cost) {
            this.cost = cost;
            return this;
        }

        public Builder value(double value) {
            this.value = value;
            return this;
        }

        public Builder input(Class<?> type) {
            this.inputs.add(IoBinding.of(type));
            return this;
        }

        public Builder input(IoBinding binding) {
            this.inputs.add(binding);
            return this;
        }

        public Builder output(Class<?> type) {
            this.outputs.add(IoBinding.of(type));
            return this;
        }

        public Builder output(IoBinding binding) {
            this.outputs.add(binding);
            return this;
        }

        public Builder canRerun(boolean canRerun) {
            this.canRerun = canRerun;
            return this;
        }

        public Builder qos(ActionQos qos) {
            this.qos = qos;
            return this;
        }

        public Builder toolGroup(String role) {
            this.toolGroups.add(role);
            return this;
        }

        public Builder inputProperty(String variable, PropertyDefinition property) {
            this.inputProperties.computeIfAbsent(variable, key -> new LinkedHashSet<>()).add(property);
            return this;
        }

        public Builder body(ActionBody body) {
            this.body = body;
            return this;
        }

        public FunctionAction build() {
            return new FunctionAction(name, description, pre, post, cost, value, inputs, outputs,
                    canRerun, qos, toolGroups, inputProperties, body);
        }
    }
}
