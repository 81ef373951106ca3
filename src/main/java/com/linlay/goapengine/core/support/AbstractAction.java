package com.linlay.goapengine.core.support;

import com.linlay.goapengine.core.Action;
import com.linlay.goapengine.core.ActionQos;
import com.linlay.goapengine.core.IoBinding;
import com.linlay.goapengine.plan.ConditionDetermination;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Derives planning preconditions and effects from an action's declared bindings and
 * condition names. Both maps are computed once at construction.
 */
public abstract class AbstractAction implements Action {

    public static final String HAS_RUN_CONDITION_PREFIX = "hasRun_";

    private final String name;
    private final String description;
    private final List<String> pre;
    private final List<String> post;
    private final double cost;
    private final double value;
    private final Set<IoBinding> inputs;
    private final Set<IoBinding> outputs;
    private final boolean canRerun;
    private final ActionQos qos;
    private final Set<String> toolGroups;
    private final Map<String, ConditionDetermination> preconditions;
    private final Map<String, ConditionDetermination> effects;

    protected AbstractAction(
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
            Collection<String> toolGroups
    ) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Action name must not be blank");
        }
        this.name = name;
        this.description = description == null ? name : description;
        this.pre = pre == null ? List.of() : List.copyOf(pre);
        this.post = post == null ? List.of() : List.copyOf(post);
        this.cost = cost;
        this.value = value;
        this.inputs = inputs == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(inputs));
        this.outputs = outputs == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(outputs));
        this.canRerun = canRerun;
        this.qos = qos == null ? ActionQos.DEFAULT : qos;
        this.toolGroups = toolGroups == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(toolGroups));
        this.preconditions = derivePreconditions();
        this.effects = deriveEffects();
    }

    public static String hasRunCondition(String actionName) {
        return HAS_RUN_CONDITION_PREFIX + actionName;
    }

    private Map<String, ConditionDetermination> derivePreconditions() {
        Map<String, ConditionDetermination> conditions = new LinkedHashMap<>();
        pre.forEach(condition -> conditions.put(condition, ConditionDetermination.TRUE));
        inputs.forEach(input -> conditions.put(input.value(), ConditionDetermination.TRUE));
        if (!canRerun) {
            // Outputs already present mean the work is done; rerunnable actions skip this guard.
            for (IoBinding output : outputs) {
                if (!inputs.contains(output)) {
                    conditions.put(output.value(), ConditionDetermination.FALSE);
                }
            }
            conditions.put(hasRunCondition(name), ConditionDetermination.FALSE);
        }
        return Collections.unmodifiableMap(conditions);
    }

    private Map<String, ConditionDetermination> deriveEffects() {
        Map<String, ConditionDetermination> conditions = new LinkedHashMap<>();
        post.forEach(condition -> conditions.put(condition, ConditionDetermination.TRUE));
        outputs.forEach(output -> conditions.put(output.value(), ConditionDetermination.TRUE));
        conditions.put(hasRunCondition(name), ConditionDetermination.TRUE);
        return Collections.unmodifiableMap(conditions);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String description() {
        return description;
    }

    public List<String> pre() {
        return pre;
    }

    public List<String> post() {
        return post;
    }

    @Override
    public double cost() {
        return cost;
    }

    @Override
    public double value() {
        return value;
    }

    @Override
    public Set<IoBinding> inputs() {
        return inputs;
    }

    @Override
    public Set<IoBinding> outputs() {
        return outputs;
    }

    @Override
    public boolean canRerun() {
        return canRerun;
    }

    @Override
    public ActionQos qos() {
        return qos;
    }

    @Override
    public Collection<String> toolGroups() {
        return toolGroups;
    }

    @Override
    public Map<String, ConditionDetermination> preconditions() {
        return preconditions;
    }

    @Override
    public Map<String, ConditionDetermination> effects() {
        return effects;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + name + ")";
    }
}
