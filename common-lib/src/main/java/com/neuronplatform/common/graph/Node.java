package com.neuronplatform.common.graph;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single unit of the brain graph.
 *
 * <p>Only {@code activation} changes after construction. It is forced into [0, 1]
 * by {@link #clamp()} at the end of each simulation step but may leave that range
 * while a step is in progress.
 *
 * <p>{@link #metadata()} is an opaque attachment; no algorithm reads it.
 */
public class Node {

    public static final double DEFAULT_BASELINE  = 0.0;
    public static final double DEFAULT_DECAY     = 0.05;
    public static final double DEFAULT_THRESHOLD = 0.3;

    private final String       id;
    private final NodeCategory category;
    private final String       label;
    private final double       baseline;
    private final double       decay;
    private final double       threshold;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private double activation;

    public Node(String id, NodeCategory category, String label) {
        this(id, category, label, DEFAULT_BASELINE, DEFAULT_DECAY, DEFAULT_THRESHOLD);
    }

    public Node(String id, NodeCategory category, String label,
                double baseline, double decay, double threshold) {
        if (decay < 0.0 || decay > 1.0 || Double.isNaN(decay)) {
            throw new IllegalArgumentException("Decay " + decay + " out of range [0, 1]");
        }
        this.id        = Objects.requireNonNull(id, "id");
        this.category  = Objects.requireNonNull(category, "category");
        this.label     = label;
        this.baseline  = baseline;
        this.decay     = decay;
        this.threshold = threshold;
        this.activation = baseline;
    }

    public void reset() {
        activation = baseline;
    }

    public void clamp() {
        activation = Math.max(0.0, Math.min(1.0, activation));
    }

    /** Firing means activation at or above threshold. */
    public boolean isFiring() {
        return activation >= threshold;
    }

    public String       getId()         { return id; }
    public NodeCategory getCategory()   { return category; }
    public String       getLabel()      { return label; }
    public double       getBaseline()   { return baseline; }
    public double       getDecay()      { return decay; }
    public double       getThreshold()  { return threshold; }
    public double       getActivation() { return activation; }

    public void setActivation(double activation) {
        this.activation = activation;
    }

    public Map<String, String> metadata() {
        return metadata;
    }

    @Override
    public String toString() {
        return String.format("Node(%s, %s, act=%.3f)", id, category.tag(), activation);
    }
}
