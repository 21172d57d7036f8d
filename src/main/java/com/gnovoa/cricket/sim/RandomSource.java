package com.gnovoa.cricket.sim;

/**
 * Single source of randomness for one match. Every sampling step (ball outcome, wicket kind,
 * fielder, random conditions) draws from the same instance so a seed replays a whole match.
 */
public interface RandomSource {

    /** @return uniformly distributed int in {@code [fromInclusive, toInclusive]} */
    int nextIntInclusive(int fromInclusive, int toInclusive);

    /** @return uniformly distributed double in {@code [0, 1)} */
    double nextDouble();
}
