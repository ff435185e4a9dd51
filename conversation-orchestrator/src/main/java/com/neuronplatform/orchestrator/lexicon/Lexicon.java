package com.neuronplatform.orchestrator.lexicon;

import com.neuronplatform.common.motor.VocabularyEntry;
import com.neuronplatform.common.motor.VocabularyLookup;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Words, phrases, synonyms and stopwords loaded from a lexicon file.
 *
 * <p>Serves perception (phrase matching, synonym resolution, stopwords) and, through
 * {@link VocabularyLookup}, the motor generator. Forms per node keep declaration order;
 * a later record with the same text replaces the earlier entry but both forms stay
 * listed under their nodes.
 *
 * <p>Filled once by the loader, read-only afterwards.
 */
public class Lexicon implements VocabularyLookup {

    private final Map<String, LexiconEntry> words     = new LinkedHashMap<>();
    private final Map<String, LexiconEntry> phrases   = new LinkedHashMap<>();
    private final Map<String, String>       synonyms  = new HashMap<>();
    private final Set<String>               stopwords = new HashSet<>();
    private final Map<String, List<String>> formsByConcept = new HashMap<>();

    public void addWord(LexiconEntry entry) {
        words.put(entry.text(), entry);
        index(entry);
    }

    public void addPhrase(LexiconEntry entry) {
        phrases.put(entry.text(), entry);
        index(entry);
    }

    public void addSynonym(String synonym, String canonical) {
        synonyms.put(synonym, canonical);
    }

    public void addStopword(String word) {
        stopwords.add(word);
    }

    private void index(LexiconEntry entry) {
        for (String conceptId : entry.conceptIds()) {
            formsByConcept.computeIfAbsent(conceptId, k -> new ArrayList<>()).add(entry.text());
        }
    }

    /** Canonical form of {@code word}, or the word itself when it is no synonym. */
    public String resolve(String word) {
        return synonyms.getOrDefault(word, word);
    }

    public boolean isStopword(String word) {
        return stopwords.contains(word);
    }

    public Optional<LexiconEntry> lookupWord(String word) {
        return Optional.ofNullable(words.get(word));
    }

    public Optional<LexiconEntry> lookupPhrase(String phrase) {
        return Optional.ofNullable(phrases.get(phrase));
    }

    /** Phrase texts, longest first; equal lengths keep declaration order. */
    public List<String> sortedPhrases() {
        List<String> sorted = new ArrayList<>(phrases.keySet());
        sorted.sort(Comparator.comparingInt(String::length).reversed());
        return sorted;
    }

    @Override
    public List<String> wordsForConcept(String conceptId) {
        List<String> forms = formsByConcept.get(conceptId);
        return forms == null ? List.of() : Collections.unmodifiableList(forms);
    }

    @Override
    public Optional<VocabularyEntry> lookup(String form) {
        LexiconEntry entry = words.get(form);
        if (entry == null) entry = phrases.get(form);
        return entry == null
            ? Optional.empty()
            : Optional.of(new VocabularyEntry(entry.conceptIds(), entry.pos()));
    }

    public int wordCount() {
        return words.size();
    }

    public int phraseCount() {
        return phrases.size();
    }

    public int synonymCount() {
        return synonyms.size();
    }

    public int stopwordCount() {
        return stopwords.size();
    }

    public String summary() {
        return (words.size() + phrases.size()) + " entries";
    }
}
