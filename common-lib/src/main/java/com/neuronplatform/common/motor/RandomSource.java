package com.neuronplatform.common.motor;

/**
 * Caller-owned, seedable sequence of pseudo-random choices. Passed by reference into
 * generation so identical seeds replay identical tie-breaks.
 */
public interface RandomSource {

    /** Uniform integer in {@code [lowInclusive, highInclusive]}. */
    int nextIntInclusive(int lowInclusive, int highInclusive);
}
