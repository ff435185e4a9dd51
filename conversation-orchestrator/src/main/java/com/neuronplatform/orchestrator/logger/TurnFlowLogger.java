package com.neuronplatform.orchestrator.logger;

import com.neuronplatform.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Stage logger for the conversation turn. Pure side effects: nothing here changes what a
 * turn computes.
 *
 * <p>Stages (in order):
 * <ol>
 *   <li>{@link #TURN_RECEIVED}      — input accepted by the controller or shell</li>
 *   <li>{@link #INPUT_PERCEIVED}    — lexicon mapped the text to concept weights</li>
 *   <li>{@link #MEMORY_RECALLED}    — episodic boost merged into the injections</li>
 *   <li>{@link #DYNAMICS_SETTLED}   — fixed-step simulation finished</li>
 *   <li>{@link #GOAL_SELECTED}      — arbitration chose the turn's intent</li>
 *   <li>{@link #RESPONSE_GENERATED} — motor walk produced the utterance</li>
 *   <li>{@link #TURN_COMPLETED}     — memory and modulators updated</li>
 *   <li>{@link #RESPONSE_SENT}      — controller mapped the result to its HTTP response</li>
 * </ol>
 *
 * <p>Inside a reactive pipeline the trace id comes from the Reactor Context:
 * <pre>
 *     .doOnEach(turnFlowLogger.stage(TurnFlowLogger.RESPONSE_SENT))
 * </pre>
 * Inside the synchronous turn body it is passed explicitly to {@link #log}.
 */
@Component
public class TurnFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(TurnFlowLogger.class);

    public static final String TURN_RECEIVED      = "TURN_RECEIVED";
    public static final String INPUT_PERCEIVED    = "INPUT_PERCEIVED";
    public static final String MEMORY_RECALLED    = "MEMORY_RECALLED";
    public static final String DYNAMICS_SETTLED   = "DYNAMICS_SETTLED";
    public static final String GOAL_SELECTED      = "GOAL_SELECTED";
    public static final String RESPONSE_GENERATED = "RESPONSE_GENERATED";
    public static final String TURN_COMPLETED     = "TURN_COMPLETED";
    public static final String RESPONSE_SENT      = "RESPONSE_SENT";

    /**
     * {@code doOnEach} consumer logging {@code stageName} on {@code onNext} only. The trace
     * id is read from the signal's context and bridged into MDC for the log call.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String traceId = TraceContextUtil.getTraceId(signal.getContextView());
            TraceContextUtil.withMdc(traceId, () ->
                log.info("[TurnFlow] stage={} traceId={}", stageName, traceId)
            );
        };
    }

    /**
     * Logs a stage with extra {@code key=value} detail already rendered by the caller.
     */
    public void log(String stageName, String traceId, int turnId, String detail) {
        TraceContextUtil.withMdc(traceId, turnId, () ->
            log.info("[TurnFlow] stage={} turnId={} {} traceId={}", stageName, turnId, detail, traceId)
        );
    }

    public void logFailure(String traceId, int turnId, Throwable error) {
        TraceContextUtil.withMdc(traceId, turnId, () ->
            log.error("[TurnFlow] stage=TURN_FAILED turnId={} error={} traceId={}",
                turnId, error.getMessage(), traceId, error)
        );
    }
}
