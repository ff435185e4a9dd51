package com.neuronplatform.common.dynamics;

/**
 * Run parameters for {@link DynamicsEngine}.
 *
 * @param steps                     number of discrete steps per run
 * @param inhibitionStrength        scale of rank-based suppression inside a category
 * @param competitionWithinCategory whether the competition pass runs at all
 */
public record DynamicsConfig(
    int     steps,
    double  inhibitionStrength,
    boolean competitionWithinCategory
) {
    public static final int    DEFAULT_STEPS               = 20;
    public static final double DEFAULT_INHIBITION_STRENGTH = 0.15;

    public DynamicsConfig {
        if (steps < 0) {
            throw new IllegalArgumentException("steps must be >= 0, got " + steps);
        }
    }

    public static DynamicsConfig defaults() {
        return new DynamicsConfig(DEFAULT_STEPS, DEFAULT_INHIBITION_STRENGTH, true);
    }
}
