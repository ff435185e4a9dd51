package com.neuronplatform.orchestrator.service;

import com.neuronplatform.orchestrator.trace.ThoughtTrace;

/**
 * Outcome of one conversation turn.
 *
 * @param turnId        1-based turn number within the session
 * @param elapsedMillis wall time spent inside the turn
 */
public record TurnResult(
    int          turnId,
    String       response,
    ThoughtTrace trace,
    double       elapsedMillis
) {}
