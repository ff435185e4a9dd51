package com.neuronplatform.orchestrator.perception;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * What one input line meant to the lexicon.
 *
 * @param activatedConcepts node id → injection weight, each capped at 1.0, in first-seen order
 */
public record PerceptionResult(
    @JsonProperty("rawInput")          String                 rawInput,
    @JsonProperty("tokens")            List<String>           tokens,
    @JsonProperty("matchedPhrases")    List<ConceptMatch>     matchedPhrases,
    @JsonProperty("matchedWords")      List<ConceptMatch>     matchedWords,
    @JsonProperty("activatedConcepts") Map<String, Double>    activatedConcepts,
    @JsonProperty("synonymMappings")   Map<String, String>    synonymMappings,
    @JsonProperty("removedStopwords")  List<String>           removedStopwords
) {
    /** Question detection reads the raw line: punctuation is gone from the tokens. */
    @JsonIgnore
    public boolean isQuestion() {
        return rawInput.indexOf('?') >= 0;
    }
}
