package com.neuronplatform.common.dynamics;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Observability snapshot of one simulation step: the top firing nodes after clamping,
 * activation descending, ties in node insertion order. Never read back by the engine.
 */
public record StepRecord(
    @JsonProperty("step") int step,
    @JsonProperty("topFiring") List<NodeActivation> topFiring
) {
    public StepRecord {
        topFiring = List.copyOf(topFiring);
    }
}
