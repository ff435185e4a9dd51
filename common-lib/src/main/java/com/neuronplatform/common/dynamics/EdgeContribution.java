package com.neuronplatform.common.dynamics;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.neuronplatform.common.graph.EdgeType;

/** One row of the post-run explanation: how much activation an edge pushed in total. */
public record EdgeContribution(
    @JsonProperty("sourceId") String sourceId,
    @JsonProperty("targetId") String targetId,
    @JsonProperty("type") EdgeType type,
    @JsonProperty("contribution") double contribution
) {}
