package com.neuronplatform.common.motor;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static com.neuronplatform.common.motor.PartOfSpeech.*;

/**
 * Light syntax for the motor walk: which tags may follow the current one.
 *
 * <pre>
 *   START        → noun adj det pronoun interjection verb adverb
 *   det          → noun adj
 *   adj          → noun adj conjunction
 *   noun         → verb conjunction prep noun adj END
 *   pronoun      → verb adverb
 *   verb         → noun adj det adverb prep pronoun END
 *   adverb       → verb adj adverb END
 *   prep         → noun det adj pronoun
 *   conjunction  → noun det adj verb pronoun
 *   interjection → noun det pronoun verb END
 * </pre>
 *
 * Any state missing from the table (only {@code END} today) permits noun, verb, adj.
 */
public final class PosTransitionTable {

    private static final Set<PartOfSpeech> FALLBACK = Collections.unmodifiableSet(EnumSet.of(NOUN, VERB, ADJ));

    private static final Map<PartOfSpeech, Set<PartOfSpeech>> TRANSITIONS = new EnumMap<>(PartOfSpeech.class);

    static {
        put(START,        NOUN, ADJ, DET, PRONOUN, INTERJECTION, VERB, ADVERB);
        put(DET,          NOUN, ADJ);
        put(ADJ,          NOUN, ADJ, CONJUNCTION);
        put(NOUN,         VERB, CONJUNCTION, PREP, NOUN, ADJ, END);
        put(PRONOUN,      VERB, ADVERB);
        put(VERB,         NOUN, ADJ, DET, ADVERB, PREP, PRONOUN, END);
        put(ADVERB,       VERB, ADJ, ADVERB, END);
        put(PREP,         NOUN, DET, ADJ, PRONOUN);
        put(CONJUNCTION,  NOUN, DET, ADJ, VERB, PRONOUN);
        put(INTERJECTION, NOUN, DET, PRONOUN, VERB, END);
    }

    private PosTransitionTable() {}

    private static void put(PartOfSpeech from, PartOfSpeech first, PartOfSpeech... rest) {
        TRANSITIONS.put(from, Collections.unmodifiableSet(EnumSet.of(first, rest)));
    }

    public static Set<PartOfSpeech> allowedAfter(PartOfSpeech current) {
        return TRANSITIONS.getOrDefault(current, FALLBACK);
    }

    public static boolean permits(PartOfSpeech current, PartOfSpeech next) {
        return allowedAfter(current).contains(next);
    }
}
