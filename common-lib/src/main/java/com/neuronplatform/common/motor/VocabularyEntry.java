package com.neuronplatform.common.motor;

import java.util.List;

/** What the vocabulary knows about one surface form. */
public record VocabularyEntry(List<String> conceptIds, PartOfSpeech pos) {

    public VocabularyEntry {
        conceptIds = List.copyOf(conceptIds);
    }
}
