package com.neuronplatform.common.motor;

import java.util.List;
import java.util.Optional;

/**
 * Vocabulary capability consumed by {@link MotorGenerator}. Implemented outside the
 * core (the orchestrator's lexicon); the generator never sees the record syntax the
 * vocabulary was loaded from.
 */
public interface VocabularyLookup {

    /** Surface forms (words and phrases) associated with a node id, declaration order. */
    List<String> wordsForConcept(String conceptId);

    /** Entry for a single word or multi-word phrase, empty when unknown. */
    Optional<VocabularyEntry> lookup(String form);
}
