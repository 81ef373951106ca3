package com.linlay.goapengine.core;

/**
 * Marker for types assembled from other blackboard objects rather than produced by an action.
 * Factories are registered in an {@link AggregationRegistry}.
 */
public interface Aggregation {
}
