package com.linlay.goapengine.core;

import java.util.Optional;

/**
 * Read-only access to objects by JVM type.
 */
public interface TypedLookup {

    /**
     * @return the most recently added instance of the type, or null
     */
    <T> T last(Class<T> type);

    default <T> Optional<T> find(Class<T> type) {
        return Optional.ofNullable(last(type));
    }
}
