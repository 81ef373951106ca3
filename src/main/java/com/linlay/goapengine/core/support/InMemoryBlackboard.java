package com.linlay.goapengine.core.support;

import com.linlay.goapengine.core.AggregationRegistry;
import com.linlay.goapengine.core.Blackboard;
import com.linlay.goapengine.core.IoBinding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Blackboard held in memory. Not synchronized: a process writes to its own blackboard
 * from one thread at a time.
 */
public class InMemoryBlackboard implements Blackboard {

    private static final Logger log = LoggerFactory.getLogger(InMemoryBlackboard.class);

    private final String blackboardId;
    private final Map<String, Object> bindings;
    private final List<Object> entries;
    private final Map<String, Boolean> conditions;

    public InMemoryBlackboard() {
        this(UUID.randomUUID().toString(), new LinkedHashMap<>(), new ArrayList<>(), new HashMap<>());
    }

    private InMemoryBlackboard(
            String blackboardId,
            Map<String, Object> bindings,
            List<Object> entries,
            Map<String, Boolean> conditions
    ) {
        this.blackboardId = blackboardId;
        this.bindings = bindings;
        this.entries = entries;
        this.conditions = conditions;
    }

    @Override
    public String blackboardId() {
        return blackboardId;
    }

    @Override
    public Object get(String name) {
        return bindings.get(name);
    }

    @Override
    public Blackboard bind(String name, Object value) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
        bindings.put(name, value);
        entries.add(value);
        return this;
    }

    @Override
    public Blackboard addObject(Object value) {
        Objects.requireNonNull(value, "value");
        entries.add(value);
        return this;
    }

    @Override
    public List<Object> objects() {
        return Collections.unmodifiableList(entries);
    }

    @Override
    public Object getValue(String variable, String type, AggregationRegistry aggregations) {
        Object bound = bindings.get(variable);
        if (bound != null && Blackboard.satisfiesType(bound, type)) {
            return bound;
        }

        if (aggregations != null) {
            Optional<Object> aggregated = aggregations.synthesize(type, this);
            if (aggregated.isPresent()) {
                Object value = aggregated.get();
                if (!entries.contains(value)) {
                    log.debug("Synthesized aggregation {} on blackboard {}", type, blackboardId);
                    entries.add(value);
                }
            }
        }

        // named bindings must match precisely
        if (!IoBinding.DEFAULT_BINDING.equals(variable)) {
            return null;
        }
        for (int i = entries.size() - 1; i >= 0; i--) {
            Object candidate = entries.get(i);
            if (Blackboard.satisfiesType(candidate, type)) {
                return candidate;
            }
        }
        return null;
    }

    @Override
    public Blackboard spawn() {
        return new InMemoryBlackboard(
                UUID.randomUUID().toString(),
                new LinkedHashMap<>(bindings),
                new ArrayList<>(entries),
                new HashMap<>(conditions)
        );
    }

    @Override
    public Blackboard setCondition(String key, boolean value) {
        conditions.put(key, value);
        return this;
    }

    @Override
    public Boolean getCondition(String key) {
        return conditions.get(key);
    }

    @Override
    public Map<String, Object> expressionEvaluationModel() {
        return Collections.unmodifiableMap(bindings);
    }

    @Override
    public String infoString(boolean verbose) {
        if (!verbose) {
            return "InMemoryBlackboard(" + blackboardId + "): " + bindings.size() + " bindings, "
                    + entries.size() + " objects";
        }
        String boundText = bindings.entrySet().stream()
                .map(entry -> entry.getKey() + "=" + entry.getValue())
                .collect(Collectors.joining("\n    "));
        String objectText = entries.stream()
                .map(String::valueOf)
                .collect(Collectors.joining("\n    "));
        return "InMemoryBlackboard(" + blackboardId + ")"
                + "\n  bindings:\n    " + (boundText.isEmpty() ? "none" : boundText)
                + "\n  objects:\n    " + (objectText.isEmpty() ? "none" : objectText)
                + "\n  conditions: " + conditions;
    }

    @Override
    public String toString() {
        return infoString(false);
    }
}
