package com.linlay.goapengine.plan;

import java.util.Map;

public interface WorldStateDeterminer {

    /**
     * Determine the current world state. Implementations may leave expensive conditions UNKNOWN.
     */
    WorldState determineWorldState();

    /**
     * Determine a single condition without caching.
     */
    ConditionDetermination determineCondition(String condition);

    static WorldStateDeterminer fromMap(Map<String, ConditionDetermination> state) {
        WorldState worldState = new WorldState(state);
        return new WorldStateDeterminer() {
            @Override
            public WorldState determineWorldState() {
                return worldState;
            }

            @Override
            public ConditionDetermination determineCondition(String condition) {
                ConditionDetermination value = worldState.get(condition);
                return value == null ? ConditionDetermination.UNKNOWN : value;
            }
        };
    }
}
