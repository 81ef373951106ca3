package com.linlay.goapengine.core;

import com.linlay.goapengine.plan.ConditionDetermination;
import com.linlay.goapengine.plan.GoapGoal;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Something an agent can achieve. Preconditions are the named conditions plus the input bindings,
 * each required TRUE.
 */
public final class Goal implements GoapGoal {

    private final String name;
    private final String description;
    private final Set<String> pre;
    private final Set<IoBinding> inputs;
    private final Class<?> outputClass;
    private final double value;
    private final Export export;
    private final Map<String, ConditionDetermination> preconditions;

    public Goal(
            String name,
            String description,
            Collection<String> pre,
            Collection<IoBinding> inputs,
            Class<?> outputClass,
            double value,
            Export export
    ) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Goal name must not be blank");
        }
        this.name = name;
        this.description = description == null ? name : description;
        this.pre = pre == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(pre));
        this.inputs = inputs == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(inputs));
        this.outputClass = outputClass;
        this.value = value;
        this.export = export == null ? Export.DEFAULT : export;

        Map<String, ConditionDetermination> conditions = new LinkedHashMap<>();
        this.pre.forEach(condition -> conditions.put(condition, ConditionDetermination.TRUE));
        this.inputs.forEach(input -> conditions.put(input.value(), ConditionDetermination.TRUE));
        this.preconditions = Collections.unmodifiableMap(conditions);
    }

    public Goal(String name, String description, Collection<String> pre) {
        this(name, description, pre, Set.of(), null, 0.0, Export.DEFAULT);
    }

    /**
     * A goal satisfied once an instance of the class is available on the blackboard.
     */
    public static Goal createInstance(String description, Class<?> type) {
        return createInstance(description, type, 0.0);
    }

    public static Goal createInstance(String description, Class<?> type, double value) {
        return new Goal("create-" + type.getSimpleName(), description, Set.of(),
                Set.of(IoBinding.of(type)), type, value, Export.DEFAULT);
    }

    @Override
    public String name() {
        return name;
    }

    public String description() {
        return description;
    }

    public Set<String> pre() {
        return pre;
    }

    public Set<IoBinding> inputs() {
        return inputs;
    }

    public Class<?> outputClass() {
        return outputClass;
    }

    @Override
    public double value() {
        return value;
    }

    public Export export() {
        return export;
    }

    @Override
    public Map<String, ConditionDetermination> preconditions() {
        return preconditions;
    }

    public Goal withPrecondition(String condition) {
        Set<String> next = new LinkedHashSet<>(pre);
        next.add(condition);
        return new Goal(name, description, next, inputs, outputClass, value, export);
    }

    public Goal withValue(double value) {
        return new Goal(name, description, pre, inputs, outputClass, value, export);
    }

    public Goal withExport(Export export) {
        return new Goal(name, description, pre, inputs, outputClass, value, export);
    }

    public String infoString() {
        return name + " - " + description + " pre=" + preconditions.keySet() + " value=" + value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Goal other)) {
            return false;
        }
        return Double.compare(value, other.value) == 0
                && name.equals(other.name)
                && description.equals(other.description)
                && pre.equals(other.pre)
                && inputs.equals(other.inputs)
                && Objects.equals(outputClass, other.outputClass)
                && export.equals(other.export);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, description, pre, inputs, outputClass, value, export);
    }

    @Override
    public String toString() {
        return "Goal(" + name + ")";
    }

    /**
     * Publication metadata for a goal.
     *
     * @param startingInputTypes types a caller may supply to start a process for this goal
     */
    public record Export(
            String name,
            boolean remote,
            Set<Class<?>> startingInputTypes
    ) {
        public static final Export DEFAULT = new Export(null, false, Set.of());

        public Export {
            startingInputTypes = startingInputTypes == null ? Set.of() : Set.copyOf(startingInputTypes);
        }
    }
}
