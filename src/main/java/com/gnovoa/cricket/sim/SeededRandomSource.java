package com.gnovoa.cricket.sim;

import java.util.SplittableRandom;

/** Reproducible {@link RandomSource}; not thread-safe, one instance per match. */
public final class SeededRandomSource implements RandomSource {

    private final long seed;
    private final SplittableRandom random;

    public SeededRandomSource(long seed) {
        this.seed = seed;
        this.random = new SplittableRandom(seed);
    }

    public long seed() { return seed; }

    @Override public int nextIntInclusive(int fromInclusive, int toInclusive) {
        if (toInclusive < fromInclusive) {
            throw new IllegalArgumentException("Empty range [" + fromInclusive + ", " + toInclusive + "]");
        }
        return random.nextInt(fromInclusive, toInclusive + 1);
    }

    @Override public double nextDouble() {
        return random.nextDouble();
    }
}
