package com.gnovoa.cricket.core;

import java.util.Comparator;
import java.util.List;

/**
 * Archived, immutable record of one innings.
 *
 * @param number 1-4
 * @param followOn true when this innings was batted after the follow-on was enforced
 */
public record InningsSummary(
        int number,
        String battingTeam,
        String bowlingTeam,
        int score,
        int wickets,
        String overs,
        int wides,
        int noBalls,
        boolean declared,
        boolean followOn,
        List<BattingLine> batting,
        List<BowlingLine> bowling,
        List<FallOfWicket> fallOfWickets,
        List<Partnership> partnerships
) {

    public InningsSummary {
        batting = List.copyOf(batting);
        bowling = List.copyOf(bowling);
        fallOfWickets = List.copyOf(fallOfWickets);
        partnerships = List.copyOf(partnerships);
    }

    public int extras() { return wides + noBalls; }

    /** @return e.g. "245/6d", "180", "212/8" */
    public String scoreLine() {
        String s = wickets >= 10 ? String.valueOf(score) : score + "/" + wickets;
        return declared ? s + "d" : s;
    }

    /** Highest run-scorers, fewer balls first on equal runs. */
    public List<BattingLine> topBatters(int n) {
        return batting.stream()
                .sorted(Comparator.comparingInt(BattingLine::runs).reversed()
                        .thenComparingInt(BattingLine::balls))
                .limit(n)
                .toList();
    }

    /** Most wickets, fewest runs conceded first on equal wickets. */
    public List<BowlingLine> topBowlers(int n) {
        return bowling.stream()
                .sorted(Comparator.comparingInt(BowlingLine::wickets).reversed()
                        .thenComparingInt(BowlingLine::runs))
                .limit(n)
                .toList();
    }
}
