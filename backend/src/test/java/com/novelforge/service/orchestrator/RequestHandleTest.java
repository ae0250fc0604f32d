package com.novelforge.service.orchestrator;

import com.novelforge.model.GenerationRequest;
import com.novelforge.model.RequestState;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RequestHandleTest {

    private final RequestHandle handle = new RequestHandle("req-1",
        GenerationRequest.builder().projectId("p").instruction("写").build());

    @Test
    void followsTheHappyPath() {
        handle.transition(RequestState.CONTEXT_BUILT);
        handle.transition(RequestState.GENERATED, b -> b.text("正文").attempts(1));
        handle.transition(RequestState.CHECKED);
        handle.transition(RequestState.ACCEPTED);
        handle.transition(RequestState.COMMITTED, b -> b.graphVersion(3L));

        assertThat(handle.state()).isEqualTo(RequestState.COMMITTED);
        assertThat(handle.snapshot().getText()).isEqualTo("正文");
        assertThat(handle.snapshot().getGraphVersion()).isEqualTo(3L);
    }

    @Test
    void retryLoopsBackToGenerated() {
        handle.transition(RequestState.CONTEXT_BUILT);
        handle.transition(RequestState.GENERATED);
        handle.transition(RequestState.CHECKED);
        handle.transition(RequestState.RETRYING);
        handle.transition(RequestState.GENERATED);

        assertThat(handle.state()).isEqualTo(RequestState.GENERATED);
    }

    @Test
    void illegalTransitionIsRejected() {
        assertThatThrownBy(() -> handle.transition(RequestState.COMMITTED))
            .isInstanceOf(IllegalStateException.class);
        assertThat(handle.state()).isEqualTo(RequestState.PENDING);
    }

    @Test
    void failIfActiveLeavesTerminalStatesAlone() {
        handle.transition(RequestState.CONTEXT_BUILT);
        handle.transition(RequestState.GENERATED);
        handle.transition(RequestState.CHECKED);
        handle.transition(RequestState.BLOCKED);

        assertThat(handle.failIfActive("late failure")).isFalse();
        assertThat(handle.state()).isEqualTo(RequestState.BLOCKED);
    }

    @Test
    void failIfActiveRecordsTheReason() {
        assertThat(handle.failIfActive("请求已取消")).isTrue();
        assertThat(handle.state()).isEqualTo(RequestState.FAILED);
        assertThat(handle.snapshot().getFailureReason()).isEqualTo("请求已取消");
    }
}
