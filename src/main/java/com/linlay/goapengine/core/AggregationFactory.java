package com.linlay.goapengine.core;

import java.util.Optional;

/**
 * Builds an aggregation from the objects currently available.
 * Returns empty when a component is missing; never throws for absence.
 */
@FunctionalInterface
public interface AggregationFactory<T extends Aggregation> {

    Optional<T> create(TypedLookup lookup);
}
