package com.neuronplatform.common.graph;

import java.util.Locale;

/**
 * Closed set of edge types. Each type transforms spread differently during dynamics.
 */
public enum EdgeType {
    EXCITATORY,
    INHIBITORY,
    ASSOCIATIVE,
    CAUSAL;

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static EdgeType fromTag(String tag) {
        if (tag != null) {
            for (EdgeType t : values()) {
                if (t.tag().equals(tag.trim().toLowerCase(Locale.ROOT))) return t;
            }
        }
        throw new IllegalArgumentException("Invalid edge type '" + tag + "'");
    }
}
