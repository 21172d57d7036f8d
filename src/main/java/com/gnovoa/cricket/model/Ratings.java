package com.gnovoa.cricket.model;

/** Range checks shared by the rating records. Every rating is on a 1-100 scale. */
final class Ratings {

    static final int MIN = 1;
    static final int MAX = 100;

    private Ratings() {}

    static int require(String name, int value) {
        if (value < MIN || value > MAX) {
            throw new IllegalArgumentException(name + " must be between " + MIN + " and " + MAX + " but was " + value);
        }
        return value;
    }

    static int mean(int... values) {
        int sum = 0;
        for (int v : values) sum += v;
        return (int) Math.round(sum / (double) values.length);
    }
}
