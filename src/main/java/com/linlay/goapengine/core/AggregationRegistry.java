package com.linlay.goapengine.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable map from aggregation type name (simple or fully qualified) to its factory.
 */
public final class AggregationRegistry {

    public static final AggregationRegistry EMPTY = new AggregationRegistry(Map.of());

    private final Map<Class<? extends Aggregation>, AggregationFactory<?>> factories;

    private AggregationRegistry(Map<Class<? extends Aggregation>, AggregationFactory<?>> factories) {
        this.factories = Collections.unmodifiableMap(new LinkedHashMap<>(factories));
    }

    public <T extends Aggregation> AggregationRegistry register(Class<T> type, AggregationFactory<T> factory) {
        if (type == null || factory == null) {
            throw new IllegalArgumentException("Aggregation type and factory are required");
        }
        Map<Class<? extends Aggregation>, AggregationFactory<?>> next = new LinkedHashMap<>(factories);
        next.put(type, factory);
        return new AggregationRegistry(next);
    }

    public AggregationRegistry merge(AggregationRegistry other) {
        if (other == null || other.factories.isEmpty()) {
            return this;
        }
        Map<Class<? extends Aggregation>, AggregationFactory<?>> next = new LinkedHashMap<>(factories);
        next.putAll(other.factories);
        return new AggregationRegistry(next);
    }

    public boolean supports(String typeName) {
        return resolve(typeName) != null;
    }

    /**
     * Runs the factory registered for the type name against the lookup.
     */
    public Optional<Object> synthesize(String typeName, TypedLookup lookup) {
        AggregationFactory<?> factory = resolve(typeName);
        if (factory == null) {
            return Optional.empty();
        }
        return factory.create(lookup).map(Object.class::cast);
    }

    public List<Class<? extends Aggregation>> types() {
        return new ArrayList<>(factories.keySet());
    }

    public boolean isEmpty() {
        return factories.isEmpty();
    }

    private AggregationFactory<?> resolve(String typeName) {
        if (typeName == null) {
            return null;
        }
        for (Map.Entry<Class<? extends Aggregation>, AggregationFactory<?>> entry : factories.entrySet()) {
            Class<?> type = entry.getKey();
            if (typeName.equals(type.getSimpleName()) || typeName.equals(type.getName())) {
                return entry.getValue();
            }
        }
        return null;
    }
}
