package com.neuronplatform.orchestrator.trace;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.neuronplatform.common.dynamics.EdgeContribution;
import com.neuronplatform.common.dynamics.StepRecord;
import com.neuronplatform.common.goal.GoalCandidate;
import com.neuronplatform.common.motor.WordCandidate;
import com.neuronplatform.orchestrator.perception.ConceptMatch;

import java.util.List;
import java.util.Map;

/**
 * Everything one turn thought, in pipeline order. Immutable once built.
 *
 * @param initialActivations  perception weights before memory boost
 * @param modulators          session modulators the dynamics ran with
 * @param languageCandidates  first {@value #MAX_LANGUAGE_CANDIDATES} candidates by score
 */
public record ThoughtTrace(
    @JsonProperty("inputMapping")       List<ConceptMatch>     inputMapping,
    @JsonProperty("initialActivations") Map<String, Double>    initialActivations,
    @JsonProperty("modulators")         Map<String, Double>    modulators,
    @JsonProperty("steps")              List<StepRecord>       steps,
    @JsonProperty("topEdges")           List<EdgeContribution> topEdges,
    @JsonProperty("memoryEffects")      Map<String, Double>    memoryEffects,
    @JsonProperty("selectedGoal")       String                 selectedGoal,
    @JsonProperty("goalCandidates")     List<GoalCandidate>    goalCandidates,
    @JsonProperty("languageCandidates") List<WordCandidate>    languageCandidates,
    @JsonProperty("selectedWords")      List<WordCandidate>    selectedWords,
    @JsonProperty("finalWords")         List<String>           finalWords
) {
    public static final int MAX_LANGUAGE_CANDIDATES = 15;

    public ThoughtTrace {
        inputMapping       = List.copyOf(inputMapping);
        steps              = List.copyOf(steps);
        topEdges           = List.copyOf(topEdges);
        goalCandidates     = List.copyOf(goalCandidates);
        languageCandidates = List.copyOf(languageCandidates.subList(0,
                                 Math.min(MAX_LANGUAGE_CANDIDATES, languageCandidates.size())));
        selectedWords      = List.copyOf(selectedWords);
        finalWords         = List.copyOf(finalWords);
    }
}
