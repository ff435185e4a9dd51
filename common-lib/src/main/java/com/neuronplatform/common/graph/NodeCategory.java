package com.neuronplatform.common.graph;

import java.util.Locale;

/**
 * Closed set of node categories.
 *
 * <ul>
 *   <li>{@link #CONCEPT}, {@link #TOPIC}, {@link #EMOTION} — carry meaning; feed word candidates</li>
 *   <li>{@link #GOAL}   — candidate conversational intents, arbitrated after every run</li>
 *   <li>{@link #MOTOR}, {@link #LEXEME} — directly speech-triggering units</li>
 * </ul>
 *
 * <p>Declaration order is the iteration order used by category competition.
 */
public enum NodeCategory {
    CONCEPT,
    TOPIC,
    EMOTION,
    GOAL,
    MOTOR,
    LEXEME;

    /** Lower-case tag as written in graph files. */
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** True for the categories whose firing nodes seed conceptual word candidates. */
    public boolean isConceptual() {
        return this == CONCEPT || this == TOPIC || this == EMOTION;
    }

    /** True for the categories whose firing nodes seed direct speech candidates. */
    public boolean isSpeechUnit() {
        return this == MOTOR || this == LEXEME;
    }

    public static NodeCategory fromTag(String tag) {
        if (tag != null) {
            for (NodeCategory c : values()) {
                if (c.tag().equals(tag.trim().toLowerCase(Locale.ROOT))) return c;
            }
        }
        throw new IllegalArgumentException("Invalid node category '" + tag + "'");
    }
}
