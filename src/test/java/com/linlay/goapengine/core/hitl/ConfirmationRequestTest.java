package com.linlay.goapengine.core.hitl;

import com.linlay.goapengine.core.Blackboard;
import com.linlay.goapengine.core.support.InMemoryBlackboard;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfirmationRequestTest {

    @Test
    void shouldAddPayloadWhenAccepted() {
        Blackboard blackboard = new InMemoryBlackboard();
        ConfirmationRequest<String> request = new ConfirmationRequest<>("ship it", "Ship?");

        ResponseImpact impact = request.onResponse(new ConfirmationResponse(request.id(), true), blackboard);

        assertThat(impact).isEqualTo(ResponseImpact.UPDATED);
        assertThat(blackboard.last(String.class)).isEqualTo("ship it");
        assertThat(blackboard.last(ConfirmationResponse.class).accepted()).isTrue();
    }

    @Test
    void shouldRecordRejectionWithoutPayload() {
        Blackboard blackboard = new InMemoryBlackboard();
        ConfirmationRequest<String> request = new ConfirmationRequest<>("ship it", "Ship?");

        ResponseImpact impact = request.onResponse(new ConfirmationResponse(request.id(), false), blackboard);

        assertThat(impact).isEqualTo(ResponseImpact.UNCHANGED);
        assertThat(blackboard.last(String.class)).isNull();
        assertThat(blackboard.count(ConfirmationResponse.class)).isEqualTo(1);
    }

    @Test
    void shouldRejectResponseForAnotherAwaitable() {
        ConfirmationRequest<String> request = new ConfirmationRequest<>("ship it", "Ship?");

        assertThatThrownBy(() -> request.onResponse(new ConfirmationResponse("other", true), new InMemoryBlackboard()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldGenerateIdAndRequirePayload() {
        assertThat(new ConfirmationRequest<>("x", null).id()).isNotBlank();
        assertThat(new ConfirmationRequest<>("x", null).message()).isEmpty();
        assertThatThrownBy(() -> new ConfirmationRequest<String>(null, "Ship?"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
