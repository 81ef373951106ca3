package com.linlay.goapengine.core;

import org.springframework.util.ClassUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Shared memory of an agent process: a map of named bindings plus an append-only list of
 * every object added or bound. Objects are never removed.
 */
public interface Blackboard extends TypedLookup {

    String blackboardId();

    /**
     * Raw lookup of a named binding.
     */
    Object get(String name);

    /**
     * Binds the name to the value and appends the value to {@link #objects()}.
     */
    Blackboard bind(String name, Object value);

    default void set(String name, Object value) {
        bind(name, value);
    }

    /**
     * Appends the value to {@link #objects()} without naming it.
     */
    Blackboard addObject(Object value);

    default Blackboard bindAll(Map<String, ?> bindings) {
        if (bindings != null) {
            bindings.forEach(this::bind);
        }
        return this;
    }

    default Blackboard addAll(Collection<?> values) {
        if (values != null) {
            values.forEach(this::addObject);
        }
        return this;
    }

    /**
     * Everything ever added or bound, in insertion order.
     */
    List<Object> objects();

    /**
     * Resolves a binding by variable name and type name.
     * <ol>
     *     <li>a bound value satisfying the type</li>
     *     <li>an aggregation synthesized from current objects, which is then added</li>
     *     <li>for the default variable only, the last object satisfying the type</li>
     * </ol>
     */
    Object getValue(String variable, String type, AggregationRegistry aggregations);

    @Override
    default <T> T last(Class<T> type) {
        List<Object> objects = objects();
        for (int i = objects.size() - 1; i >= 0; i--) {
            Object candidate = objects.get(i);
            if (type.isInstance(candidate)) {
                return type.cast(candidate);
            }
        }
        return null;
    }

    default <T> T lastMatching(Class<T> type, Predicate<? super T> predicate) {
        List<T> all = all(type);
        for (int i = all.size() - 1; i >= 0; i--) {
            if (predicate.test(all.get(i))) {
                return all.get(i);
            }
        }
        return null;
    }

    default <T> List<T> all(Class<T> type) {
        List<T> matches = new ArrayList<>();
        for (Object candidate : objects()) {
            if (type.isInstance(candidate)) {
                matches.add(type.cast(candidate));
            }
        }
        return matches;
    }

    default int count(Class<?> type) {
        return all(type).size();
    }

    default Object lastResult() {
        List<Object> objects = objects();
        return objects.isEmpty() ? null : objects.get(objects.size() - 1);
    }

    /**
     * A new blackboard with its own id holding copies of this one's bindings, objects and
     * conditions. Later writes on either side are not visible to the other.
     */
    Blackboard spawn();

    Blackboard setCondition(String key, boolean value);

    /**
     * @return the explicit condition value, or null when never set
     */
    Boolean getCondition(String key);

    /**
     * Read-only view of the named bindings.
     */
    Map<String, Object> expressionEvaluationModel();

    String infoString(boolean verbose);

    /**
     * True when the simple or fully qualified name of the value's class, or of any of its
     * superclasses or interfaces, equals the type name.
     */
    static boolean satisfiesType(Object value, String type) {
        if (value == null || type == null) {
            return false;
        }
        for (Class<?> current = value.getClass(); current != null; current = current.getSuperclass()) {
            if (matches(current, type)) {
                return true;
            }
        }
        for (Class<?> iface : ClassUtils.getAllInterfacesForClassAsSet(value.getClass())) {
            if (matches(iface, type)) {
                return true;
            }
        }
        return false;
    }

    private static boolean matches(Class<?> clazz, String type) {
        return type.equals(clazz.getSimpleName()) || type.equals(clazz.getName());
    }
}
