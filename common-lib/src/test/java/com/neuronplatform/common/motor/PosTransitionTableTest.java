package com.neuronplatform.common.motor;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;

import static com.neuronplatform.common.motor.PartOfSpeech.*;
import static org.junit.jupiter.api.Assertions.*;

class PosTransitionTableTest {

    @Test
    @DisplayName("START opens with anything but connectives and END")
    void start() {
        assertEquals(EnumSet.of(NOUN, ADJ, DET, PRONOUN, INTERJECTION, VERB, ADVERB),
            PosTransitionTable.allowedAfter(START));
        assertFalse(PosTransitionTable.permits(START, END));
        assertFalse(PosTransitionTable.permits(START, PREP));
    }

    @Test
    @DisplayName("only noun, verb, adverb and interjection may close an utterance")
    void closers() {
        for (PartOfSpeech p : PartOfSpeech.values()) {
            boolean expected = p == NOUN || p == VERB || p == ADVERB || p == INTERJECTION;
            assertEquals(expected, PosTransitionTable.permits(p, END), p.tag());
        }
    }

    @Test
    @DisplayName("determiner is followed by a noun or adjective")
    void determiner() {
        assertEquals(EnumSet.of(NOUN, ADJ), PosTransitionTable.allowedAfter(DET));
    }

    @Test
    @DisplayName("states without a row fall back to noun, verb, adj")
    void fallbackRow() {
        assertEquals(EnumSet.of(NOUN, VERB, ADJ), PosTransitionTable.allowedAfter(END));
    }

    @Test
    @DisplayName("rows are read-only")
    void immutable() {
        assertThrows(UnsupportedOperationException.class,
            () -> PosTransitionTable.allowedAfter(NOUN).add(DET));
    }

    @Test
    @DisplayName("tags parse case-insensitively and render lower case except START/END")
    void tags() {
        assertEquals(NOUN, PartOfSpeech.fromTag(" Noun "));
        assertEquals(END, PartOfSpeech.fromTag("end"));
        assertEquals("interjection", INTERJECTION.tag());
        assertEquals("END", END.tag());
        assertThrows(IllegalArgumentException.class, () -> PartOfSpeech.fromTag("gerund"));
        assertThrows(IllegalArgumentException.class, () -> PartOfSpeech.fromTag(null));
    }
}
