package com.neuronplatform.orchestrator.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.neuronplatform.orchestrator.service.TurnResult;
import com.neuronplatform.orchestrator.trace.TraceFormatter;

import java.util.List;

public record TurnResponse(
    @JsonProperty("traceId")       String       traceId,
    @JsonProperty("turnId")        int          turnId,
    @JsonProperty("response")      String       response,
    @JsonProperty("goal")          String       goal,
    @JsonProperty("words")         List<String> words,
    @JsonProperty("trace")         String       trace,
    @JsonProperty("elapsedMillis") double       elapsedMillis
) {
    static TurnResponse from(TurnResult result, String traceId) {
        return new TurnResponse(
            traceId,
            result.turnId(),
            result.response(),
            result.trace().selectedGoal(),
            result.trace().finalWords(),
            TraceFormatter.compact(result.trace()),
            result.elapsedMillis());
    }
}
