package com.gnovoa.cricket.core;

/** Immutable scorecard row for a bowler. */
public record BowlingLine(
        String bowler,
        String overs,
        int maidens,
        int runs,
        int wickets,
        int wides,
        int noBalls,
        double economy
) {}
