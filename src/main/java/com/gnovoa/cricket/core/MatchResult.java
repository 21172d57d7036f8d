package com.gnovoa.cricket.core;

/**
 * Final outcome of a match.
 *
 * @param winner winning team name; {@code null} for a tie or draw
 * @param margin runs or wickets; 0 for a tie or draw
 * @param marginType {@code null} for a tie or draw
 */
public record MatchResult(ResultType type, String winner, int margin, MarginType marginType, String description) {

    public enum ResultType { WIN, TIE, DRAW }

    public enum MarginType { RUNS, WICKETS, INNINGS_AND_RUNS }

    public static MatchResult byRuns(String winner, int runs) {
        return new MatchResult(ResultType.WIN, winner, runs, MarginType.RUNS,
                winner + " won by " + plural(runs, "run"));
    }

    public static MatchResult byWickets(String winner, int wickets) {
        return new MatchResult(ResultType.WIN, winner, wickets, MarginType.WICKETS,
                winner + " won by " + plural(wickets, "wicket"));
    }

    public static MatchResult byInningsAndRuns(String winner, int runs) {
        return new MatchResult(ResultType.WIN, winner, runs, MarginType.INNINGS_AND_RUNS,
                winner + " won by an innings and " + plural(runs, "run"));
    }

    public static MatchResult tie() {
        return new MatchResult(ResultType.TIE, null, 0, null, "Match tied");
    }

    public static MatchResult draw() {
        return new MatchResult(ResultType.DRAW, null, 0, null, "Match drawn");
    }

    private static String plural(int n, String unit) {
        return n + " " + unit + (n == 1 ? "" : "s");
    }
}
