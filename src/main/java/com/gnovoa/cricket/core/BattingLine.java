package com.gnovoa.cricket.core;

/** Immutable scorecard row for a batter. */
public record BattingLine(
        String batter,
        String dismissal,
        int runs,
        int balls,
        int fours,
        int sixes,
        double strikeRate
) {}
