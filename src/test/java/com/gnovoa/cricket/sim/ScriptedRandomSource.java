package com.gnovoa.cricket.sim;

import java.util.ArrayDeque;
import java.util.Deque;

/** Replays fixed draws; once the script runs out it returns 0 and the lower bound. */
final class ScriptedRandomSource implements RandomSource {

    private final Deque<Double> doubles = new ArrayDeque<>();
    private final Deque<Integer> ints = new ArrayDeque<>();

    ScriptedRandomSource doubles(double... values) {
        for (double v : values) doubles.add(v);
        return this;
    }

    ScriptedRandomSource ints(int... values) {
        for (int v : values) ints.add(v);
        return this;
    }

    @Override
    public int nextIntInclusive(int fromInclusive, int toInclusive) {
        Integer v = ints.poll();
        return v == null ? fromInclusive : Math.max(fromInclusive, Math.min(toInclusive, v));
    }

    @Override
    public double nextDouble() {
        Double v = doubles.poll();
        return v == null ? 0 : v;
    }
}
