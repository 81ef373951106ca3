package com.linlay.goapengine.core.hitl;

import com.linlay.goapengine.core.Blackboard;

/**
 * Something an action waits on before it can finish, typically a human decision.
 * The awaitable is added to the blackboard while the process is WAITING; the response is
 * applied with {@link #onResponse(Object, Blackboard)} before the process is run again.
 *
 * @param <P> payload shown to whoever responds
 * @param <R> response type
 */
public interface Awaitable<P, R> {

    String id();

    P payload();

    ResponseImpact onResponse(R response, Blackboard blackboard);

    default String infoString() {
        return getClass().getSimpleName() + "(" + id() + ")";
    }
}
