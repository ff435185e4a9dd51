package com.neuronplatform.common.motor;

import java.util.List;

/**
 * Generation trace.
 *
 * @param candidatesConsidered every candidate built, ordered by initial score descending
 * @param selectedWords        chosen candidates in utterance order
 * @param finalText            selected forms joined by single spaces, or
 *                             {@value #FALLBACK_TEXT} when nothing could be said
 */
public record MotorResult(
    List<WordCandidate> candidatesConsidered,
    List<WordCandidate> selectedWords,
    String              finalText
) {
    public static final String FALLBACK_TEXT = "i am processing";

    static MotorResult fallback(List<WordCandidate> considered) {
        return new MotorResult(List.copyOf(considered), List.of(), FALLBACK_TEXT);
    }

    public List<String> words() {
        return selectedWords.stream().map(WordCandidate::getWord).toList();
    }
}
