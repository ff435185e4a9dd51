package com.neuronplatform.orchestrator.perception;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** One recognised token or phrase and the nodes it activated. */
public record ConceptMatch(
    @JsonProperty("text")       String       text,
    @JsonProperty("conceptIds") List<String> conceptIds
) {
    public ConceptMatch {
        conceptIds = List.copyOf(conceptIds);
    }

    @Override
    public String toString() {
        return "'" + text + "' → " + conceptIds;
    }
}
