package com.neuronplatform.common.motor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** In-memory {@link VocabularyLookup} for generator tests. */
final class MapVocabulary implements VocabularyLookup {

    private final Map<String, VocabularyEntry> entries   = new HashMap<>();
    private final Map<String, List<String>>    byConcept = new LinkedHashMap<>();

    MapVocabulary word(String form, PartOfSpeech pos, String... conceptIds) {
        entries.put(form, new VocabularyEntry(Arrays.asList(conceptIds), pos));
        for (String id : conceptIds) {
            byConcept.computeIfAbsent(id, k -> new ArrayList<>()).add(form);
        }
        return this;
    }

    @Override
    public List<String> wordsForConcept(String conceptId) {
        return byConcept.getOrDefault(conceptId, List.of());
    }

    @Override
    public Optional<VocabularyEntry> lookup(String form) {
        return Optional.ofNullable(entries.get(form));
    }
}
