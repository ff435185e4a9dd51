package com.neuronplatform.common.dynamics;

import com.fasterxml.jackson.annotation.JsonProperty;

public record NodeActivation(
    @JsonProperty("nodeId") String nodeId,
    @JsonProperty("activation") double activation
) {}
