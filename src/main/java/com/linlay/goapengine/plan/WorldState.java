package com.linlay.goapengine.plan;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Snapshot of every known planning condition. Immutable; all mutators return a copy.
 */
public record WorldState(Map<String, ConditionDetermination> state) {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public WorldState {
        state = state == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(state));
    }

    public static WorldState empty() {
        return new WorldState(Map.of());
    }

    public ConditionDetermination get(String condition) {
        return state.get(condition);
    }

    public List<String> unknownConditions() {
        List<String> unknown = new ArrayList<>();
        state.forEach((key, value) -> {
            if (value == ConditionDetermination.UNKNOWN) {
                unknown.add(key);
            }
        });
        return unknown;
    }

    public WorldState with(String condition, ConditionDetermination value) {
        Map<String, ConditionDetermination> next = new LinkedHashMap<>(state);
        next.put(condition, value);
        return new WorldState(next);
    }

    public WorldState withAll(Map<String, ConditionDetermination> changes) {
        Map<String, ConditionDetermination> next = new LinkedHashMap<>(state);
        next.putAll(changes);
        return new WorldState(next);
    }

    /**
     * The two definite variants of this state for a condition currently UNKNOWN.
     */
    public List<WorldState> variants(String unknownCondition) {
        return List.of(
                with(unknownCondition, ConditionDetermination.TRUE),
                with(unknownCondition, ConditionDetermination.FALSE)
        );
    }

    public String infoString(boolean verbose) {
        if (!verbose) {
            return state.toString();
        }
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(state);
        } catch (JsonProcessingException ex) {
            return state.toString();
        }
    }
}
