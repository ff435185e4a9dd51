package com.neuronplatform.common.trace;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class TraceContextUtilTest {

    @Test
    @DisplayName("trace id written at assembly end is visible upstream")
    void contextPropagation() {
        Mono<String> pipeline = Mono.deferContextual(ctx -> Mono.just(TraceContextUtil.getTraceId(ctx)));

        StepVerifier.create(TraceContextUtil.withTraceId(pipeline, "turn-123"))
            .expectNext("turn-123")
            .verifyComplete();
    }

    @Test
    @DisplayName("missing trace id reads as 'unknown'")
    void missingTraceId() {
        StepVerifier.create(Mono.deferContextual(ctx -> Mono.just(TraceContextUtil.getTraceId(ctx))))
            .expectNext("unknown")
            .verifyComplete();
    }

    @Test
    @DisplayName("MDC carries the id only while the log action runs")
    void mdcBridge() {
        AtomicReference<String> seen = new AtomicReference<>();
        TraceContextUtil.withMdc("turn-9", () -> seen.set(MDC.get(TraceContextUtil.TRACE_ID_KEY)));

        assertEquals("turn-9", seen.get());
        assertNull(MDC.get(TraceContextUtil.TRACE_ID_KEY));
    }

    @Test
    @DisplayName("turn number joins the trace id in MDC once assigned")
    void turnIdInMdc() {
        AtomicReference<String> turn = new AtomicReference<>();
        TraceContextUtil.withMdc("turn-9", 4, () -> turn.set(MDC.get(TraceContextUtil.TURN_ID_KEY)));
        assertEquals("4", turn.get());
        assertNull(MDC.get(TraceContextUtil.TURN_ID_KEY));

        TraceContextUtil.withMdc("turn-9", TraceContextUtil.NO_TURN,
            () -> turn.set(MDC.get(TraceContextUtil.TURN_ID_KEY)));
        assertNull(turn.get());
    }

    @Test
    @DisplayName("a nested log call restores the outer ids")
    void nestedRestoresOuter() {
        AtomicReference<String> afterInner = new AtomicReference<>();
        TraceContextUtil.withMdc("outer", 1, () -> {
            TraceContextUtil.withMdc("inner", 2, () -> { });
            afterInner.set(MDC.get(TraceContextUtil.TRACE_ID_KEY) + "/" + MDC.get(TraceContextUtil.TURN_ID_KEY));
        });

        assertEquals("outer/1", afterInner.get());
        assertNull(MDC.get(TraceContextUtil.TRACE_ID_KEY));
    }

    @Test
    @DisplayName("MDC is cleared even when the log action throws")
    void mdcClearedOnFailure() {
        assertThrows(IllegalStateException.class, () -> TraceContextUtil.withMdc("turn-10", () -> {
            throw new IllegalStateException("boom");
        }));
        assertNull(MDC.get(TraceContextUtil.TRACE_ID_KEY));
    }

    @Test
    @DisplayName("fresh ids are distinct")
    void newIds() {
        assertNotEquals(TraceContextUtil.newTraceId(), TraceContextUtil.newTraceId());
    }
}
