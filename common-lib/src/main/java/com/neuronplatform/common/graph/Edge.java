package com.neuronplatform.common.graph;

import java.util.Objects;

/**
 * Directed, typed, weighted link between two nodes.
 *
 * <p>{@code contribution} is the running total of absolute spread pushed through
 * this edge during the current simulation run. Reset by
 * {@link BrainGraph#resetContributions()}.
 */
public class Edge {

    public static final double DEFAULT_WEIGHT = 0.5;

    private final String   sourceId;
    private final String   targetId;
    private final EdgeType type;
    private final double   weight;

    private double contribution;

    public Edge(String sourceId, String targetId, EdgeType type) {
        this(sourceId, targetId, type, DEFAULT_WEIGHT);
    }

    public Edge(String sourceId, String targetId, EdgeType type, double weight) {
        if (weight < -1.0 || weight > 1.0 || Double.isNaN(weight)) {
            throw new IllegalArgumentException("Weight " + weight + " out of range [-1, 1]");
        }
        this.sourceId = Objects.requireNonNull(sourceId, "sourceId");
        this.targetId = Objects.requireNonNull(targetId, "targetId");
        this.type     = Objects.requireNonNull(type, "type");
        this.weight   = weight;
    }

    public String   getSourceId()     { return sourceId; }
    public String   getTargetId()     { return targetId; }
    public EdgeType getType()         { return type; }
    public double   getWeight()       { return weight; }
    public double   getContribution() { return contribution; }

    /** Adds the magnitude of one step's spread; callers pass non-negative amounts. */
    public void addContribution(double amount) {
        contribution += amount;
    }

    void resetContribution() {
        contribution = 0.0;
    }

    @Override
    public String toString() {
        return String.format("Edge(%s->%s, %s, w=%.3f)", sourceId, targetId, type.tag(), weight);
    }
}
