package com.neuronplatform.common.motor;

import java.util.Random;

/**
 * {@link RandomSource} over {@link java.util.Random}. Not thread-safe by contract:
 * one session, one logical thread.
 */
public final class SeededRandomSource implements RandomSource {

    private final long   seed;
    private final Random random;

    public SeededRandomSource(long seed) {
        this.seed   = seed;
        this.random = new Random(seed);
    }

    @Override
    public int nextIntInclusive(int lowInclusive, int highInclusive) {
        if (highInclusive < lowInclusive) {
            throw new IllegalArgumentException(
                "empty range [" + lowInclusive + ", " + highInclusive + "]");
        }
        return lowInclusive + random.nextInt(highInclusive - lowInclusive + 1);
    }

    public long seed() {
        return seed;
    }
}
