package com.neuronplatform.orchestrator.lexicon;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.neuronplatform.common.motor.PartOfSpeech;

import java.util.List;

/** A word or multi-word phrase with the nodes it names and its part of speech. */
public record LexiconEntry(
    @JsonProperty("id")         String       id,
    @JsonProperty("text")       String       text,
    @JsonProperty("conceptIds") List<String> conceptIds,
    @JsonProperty("pos")        PartOfSpeech pos
) {
    public LexiconEntry {
        conceptIds = List.copyOf(conceptIds);
    }
}
