package com.linlay.goapengine.core.hitl;

public record ConfirmationResponse(
        String awaitableId,
        boolean accepted
) {
}
