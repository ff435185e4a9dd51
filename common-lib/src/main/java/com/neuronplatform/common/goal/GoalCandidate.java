package com.neuronplatform.common.goal;

import com.fasterxml.jackson.annotation.JsonProperty;

public record GoalCandidate(
    @JsonProperty("goalId") String goalId,
    @JsonProperty("activation") double activation
) {}
