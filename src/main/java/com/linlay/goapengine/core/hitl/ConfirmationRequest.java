package com.linlay.goapengine.core.hitl;

import com.linlay.goapengine.core.Blackboard;

import java.util.UUID;

/**
 * Asks for a yes or no on a payload. The response is always recorded on the blackboard;
 * an accepted payload is added as well.
 */
public record ConfirmationRequest<P>(
        String id,
        P payload,
        String message
) implements Awaitable<P, ConfirmationResponse> {

    public ConfirmationRequest {
        id = id == null || id.isBlank() ? UUID.randomUUID().toString() : id;
        if (payload == null) {
            throw new IllegalArgumentException("Confirmation payload is required");
        }
        message = message == null ? "" : message;
    }

    public ConfirmationRequest(P payload, String message) {
        this(null, payload, message);
    }

    @Override
    public ResponseImpact onResponse(ConfirmationResponse response, Blackboard blackboard) {
        if (!id.equals(response.awaitableId())) {
            throw new IllegalArgumentException("Response for " + response.awaitableId() + " does not match awaitable " + id);
        }
        blackboard.addObject(response);
        if (!response.accepted()) {
            return ResponseImpact.UNCHANGED;
        }
        blackboard.addObject(payload);
        return ResponseImpact.UPDATED;
    }
}
