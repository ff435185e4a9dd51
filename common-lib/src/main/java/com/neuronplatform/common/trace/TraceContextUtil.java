package com.neuronplatform.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.util.UUID;

/**
 * Trace id and turn number of a conversation turn, for log correlation.
 *
 * <p>Inside reactive pipelines the trace id lives in the Reactor Context; the turn number
 * is only known once the session has accepted the turn, so it is passed explicitly.
 * Both are written to MDC for one log call and the previous MDC values restored after,
 * so a log call nested inside another keeps the outer ids.
 *
 * <pre>
 *     return TraceContextUtil.withTraceId(pipeline, traceId);
 *     ...
 *     TraceContextUtil.withMdc(traceId, turnId, () -> log.info(...));
 * </pre>
 */
public final class TraceContextUtil {

    public static final String TRACE_ID_KEY = "traceId";
    public static final String TURN_ID_KEY  = "turnId";

    /** Turn number meaning "not assigned yet"; {@code turnId} is left out of MDC. */
    public static final int NO_TURN = 0;

    static final String UNKNOWN_TRACE = "unknown";

    private TraceContextUtil() {}

    /** Fresh id for a turn that did not arrive with one. */
    public static String newTraceId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Stores {@code traceId} in the Reactor Context of {@code mono}. Call at the end of
     * pipeline assembly: {@code contextWrite} propagates upstream.
     */
    public static <T> Mono<T> withTraceId(Mono<T> mono, String traceId) {
        return mono.contextWrite(ctx -> ctx.put(TRACE_ID_KEY, traceId));
    }

    /** Trace id from the context, or {@code "unknown"}; never {@code null}. */
    public static String getTraceId(ContextView ctx) {
        return ctx.getOrDefault(TRACE_ID_KEY, UNKNOWN_TRACE);
    }

    public static void withMdc(String traceId, Runnable logAction) {
        withMdc(traceId, NO_TURN, logAction);
    }

    /**
     * Runs {@code logAction} with {@code traceId} and, when assigned, {@code turnId} in MDC.
     */
    public static void withMdc(String traceId, int turnId, Runnable logAction) {
        String outerTrace = MDC.get(TRACE_ID_KEY);
        String outerTurn  = MDC.get(TURN_ID_KEY);

        MDC.put(TRACE_ID_KEY, traceId == null ? UNKNOWN_TRACE : traceId);
        if (turnId > NO_TURN) {
            MDC.put(TURN_ID_KEY, Integer.toString(turnId));
        }
        try {
            logAction.run();
        } finally {
            restore(TRACE_ID_KEY, outerTrace);
            restore(TURN_ID_KEY, outerTurn);
        }
    }

    private static void restore(String key, String outer) {
        if (outer == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, outer);
        }
    }
}
