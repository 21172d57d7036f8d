package com.gnovoa.cricket.core;

import java.util.List;

/**
 * A live match hosted by the service: the engine plus its ticker. Every operation is atomic with
 * respect to the others, so an "advance N balls" call is never observed half-done.
 */
public interface MatchRuntime {
    String matchId();
    MatchFormat format();
    String battingFirst();
    String bowlingFirst();
    long seed();
    String conditions();

    MatchSnapshot snapshot();
    Scorecard scorecard();

    /** @return deliveries bowled */
    int advance(int balls);
    int advanceOver();
    int advanceToBreak();
    boolean declare();

    boolean isFinished();
    boolean isLive();

    void start();
    void pause();
    void stop();
    void onFinished(Runnable callback);

    /** Full scorecard; sessions and days are empty for limited-overs matches. */
    record Scorecard(
            String matchId,
            List<InningsSummary> innings,
            List<SessionSummary> sessions,
            List<DaySummary> days,
            MatchResult result
    ) {}
}
