package com.neuronplatform.common.motor;

import java.util.Locale;

/**
 * Part-of-speech tags understood by the motor grammar, plus the synthetic
 * {@link #START} and {@link #END} states of the transition walk.
 */
public enum PartOfSpeech {
    START,
    DET,
    ADJ,
    NOUN,
    PRONOUN,
    VERB,
    ADVERB,
    PREP,
    CONJUNCTION,
    INTERJECTION,
    END;

    public String tag() {
        return this == START || this == END ? name() : name().toLowerCase(Locale.ROOT);
    }

    /** Case-insensitive lookup by tag, e.g. {@code "noun"} or {@code "END"}. */
    public static PartOfSpeech fromTag(String tag) {
        if (tag != null) {
            String wanted = tag.trim().toUpperCase(Locale.ROOT);
            for (PartOfSpeech p : values()) {
                if (p.name().equals(wanted)) return p;
            }
        }
        throw new IllegalArgumentException("Unknown part of speech '" + tag + "'");
    }
}
