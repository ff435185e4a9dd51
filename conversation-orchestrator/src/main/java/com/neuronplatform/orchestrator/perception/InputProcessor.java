package com.neuronplatform.orchestrator.perception;

import com.neuronplatform.orchestrator.lexicon.Lexicon;
import com.neuronplatform.orchestrator.lexicon.LexiconEntry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Maps raw text onto concept injection weights.
 *
 * <ol>
 *   <li>lower-case, trim, drop every character that is neither a word character nor whitespace</li>
 *   <li>phrases, longest first: each one present adds {@value #PHRASE_WEIGHT} to its nodes
 *       and is blanked out of the text</li>
 *   <li>remaining tokens: synonym → canonical, stopwords dropped, known words add
 *       {@value #WORD_WEIGHT} to their nodes</li>
 *   <li>every weight capped at 1.0</li>
 * </ol>
 */
public class InputProcessor {

    static final double PHRASE_WEIGHT = 0.8;
    static final double WORD_WEIGHT   = 0.7;

    private static final Pattern PUNCTUATION = Pattern.compile("[^\\w\\s]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WHITESPACE  = Pattern.compile("\\s+");

    private final Lexicon      lexicon;
    private final List<String> sortedPhrases;

    public InputProcessor(Lexicon lexicon) {
        this.lexicon       = lexicon;
        this.sortedPhrases = lexicon.sortedPhrases();
    }

    public PerceptionResult process(String rawInput) {
        String remaining = PUNCTUATION.matcher(rawInput.toLowerCase(Locale.ROOT).strip()).replaceAll("");

        Map<String, Double> activated = new LinkedHashMap<>();
        List<ConceptMatch> phrases = new ArrayList<>();
        for (String phrase : sortedPhrases) {
            if (!remaining.contains(phrase)) continue;
            Optional<LexiconEntry> entry = lexicon.lookupPhrase(phrase);
            if (entry.isEmpty()) continue;

            phrases.add(new ConceptMatch(phrase, entry.get().conceptIds()));
            add(activated, entry.get().conceptIds(), PHRASE_WEIGHT);
            remaining = remaining.replace(phrase, " ");
        }

        List<String> tokens = new ArrayList<>();
        List<ConceptMatch> words = new ArrayList<>();
        Map<String, String> synonyms = new LinkedHashMap<>();
        List<String> stopwords = new ArrayList<>();
        for (String raw : WHITESPACE.split(remaining.strip())) {
            if (raw.isEmpty()) continue;

            String token = lexicon.resolve(raw);
            if (!token.equals(raw)) synonyms.put(raw, token);

            if (lexicon.isStopword(token)) {
                stopwords.add(token);
                continue;
            }
            tokens.add(token);

            lexicon.lookupWord(token).ifPresent(entry -> {
                words.add(new ConceptMatch(token, entry.conceptIds()));
                add(activated, entry.conceptIds(), WORD_WEIGHT);
            });
        }

        activated.replaceAll((id, weight) -> Math.min(1.0, weight));

        return new PerceptionResult(
            rawInput,
            Collections.unmodifiableList(tokens),
            Collections.unmodifiableList(phrases),
            Collections.unmodifiableList(words),
            Collections.unmodifiableMap(activated),
            Collections.unmodifiableMap(synonyms),
            Collections.unmodifiableList(stopwords));
    }

    private static void add(Map<String, Double> activated, List<String> conceptIds, double weight) {
        for (String id : conceptIds) {
            activated.merge(id, weight, Double::sum);
        }
    }
}
