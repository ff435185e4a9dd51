package com.neuronplatform.orchestrator.memory;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record Episode(
    @JsonProperty("turnId")     int          turnId,
    @JsonProperty("userText")   String       userText,
    @JsonProperty("systemText") String       systemText,
    @JsonProperty("concepts")   List<String> concepts,
    @JsonProperty("goal")       String       goal
) {
    public Episode {
        concepts = List.copyOf(concepts);
    }
}
