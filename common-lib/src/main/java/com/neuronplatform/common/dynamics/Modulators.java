package com.neuronplatform.common.dynamics;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable set of named behavioural modulators, nominal range [0, 1].
 *
 * <p>Only {@link #CURIOSITY} changes dynamics today (it scales associative spread);
 * the others are carried for the orchestrator's turn-to-turn adjustments and for trace
 * output. Updates return a new instance, so one run can never observe another's edits.
 */
public record Modulators(Map<String, Double> values) {

    public static final String CURIOSITY = "curiosity";
    public static final String CALM      = "calm";
    public static final String URGENCY   = "urgency";

    /** Value used for curiosity when a mapping does not carry it. */
    public static final double DEFAULT_CURIOSITY = 0.5;

    public Modulators {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /** Fallback mapping used when a caller has no session state of its own. */
    public static Modulators defaults() {
        return of(DEFAULT_CURIOSITY, 0.5, 0.3);
    }

    public static Modulators of(double curiosity, double calm, double urgency) {
        Map<String, Double> m = new LinkedHashMap<>();
        m.put(CURIOSITY, curiosity);
        m.put(CALM, calm);
        m.put(URGENCY, urgency);
        return new Modulators(m);
    }

    public double get(String name, double fallback) {
        Double v = values.get(name);
        return v != null ? v : fallback;
    }

    public double curiosity() {
        return get(CURIOSITY, DEFAULT_CURIOSITY);
    }

    public Modulators with(String name, double value) {
        Map<String, Double> m = new LinkedHashMap<>(values);
        m.put(name, value);
        return new Modulators(m);
    }

    @JsonValue
    public Map<String, Double> asMap() {
        return values;
    }
}
