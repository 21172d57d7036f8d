package com.gnovoa.cricket.core;

import com.gnovoa.cricket.conditions.MatchConditions;
import com.gnovoa.cricket.config.SimProperties;
import com.gnovoa.cricket.model.Team;

import java.util.List;
import java.util.Optional;

/**
 * In-memory state of one cricket match, advanced one delivery at a time by {@link MatchEngine}.
 *
 * <p>Implementations share ball application through a composed {@link InningsState} and differ in
 * how innings end and how the result is decided:
 * <ul>
 *   <li>{@link LimitedOversMatchState}: two innings, over limit, chase target</li>
 *   <li>{@link TestMatchState}: four innings over days and sessions, follow-on, declarations, draws</li>
 * </ul>
 *
 * <p>Invalid late transitions (switching past the last innings, declaring outside the window,
 * enforcing an unavailable follow-on) return {@code false} and change nothing. Ball operations
 * on a state that cannot take a ball throw {@link IllegalStateException}.
 *
 * <p>Not thread-safe; callers serialize access (see {@link MatchRuntime}).
 */
public interface MatchState {

    /**
     * Opens the first innings of a new match in the state machine that fits {@code format}.
     *
     * @throws IllegalArgumentException if both sides are the same team
     */
    static MatchState create(
            String matchId,
            MatchFormat format,
            MatchConditions conditions,
            Team teamBattingFirst,
            Team teamBowlingFirst,
            SimProperties props) {
        return switch (format.kind()) {
            case LIMITED_OVERS -> new LimitedOversMatchState(
                    matchId, format, conditions, teamBattingFirst, teamBowlingFirst, props);
            case MULTI_DAY -> new TestMatchState(
                    matchId, format, conditions, teamBattingFirst, teamBowlingFirst, props);
        };
    }

    String matchId();
    MatchFormat format();
    MatchConditions conditions();

    /** @return side that batted in the first innings */
    Team teamBattingFirst();

    /** @return side that bowled in the first innings */
    Team teamBowlingFirst();

    /** @return innings in progress, or the last one played once the match is over */
    InningsState innings();

    /** @return 1-based innings number; one past the last innings once all are archived */
    int inningsNumber();

    default Team battingTeam() { return innings().battingTeam(); }
    default Team bowlingTeam() { return innings().bowlingTeam(); }

    /** @return day of play; always 1 for limited overs */
    default int day() { return 1; }

    /** @return session within the day; always 1 for limited overs */
    default int session() { return 1; }

    /**
     * Applies one delivery to the current innings, rotating strike at the end of an over while
     * the innings is still alive.
     *
     * @return true when the ball completed an over
     * @throws IllegalStateException if striker or bowler is unset, or the innings/match is already over
     */
    boolean applyBall(BallOutcome outcome);

    void rotateStrike();

    boolean isInningsComplete();

    boolean isMatchComplete();

    /**
     * Archives the completed innings and opens the next one.
     *
     * @return false, with no change, when the current innings is still in progress or no innings remains
     */
    boolean switchInnings();

    /** @return result once the match is complete */
    Optional<MatchResult> determineMatchResult();

    /** @return runs needed to win in the final innings; {@code null} outside a chase */
    Integer target();

    /** @return archived innings in the order they were played */
    List<InningsSummary> completedInnings();

    /** @return archived innings plus the innings in progress, for full scorecards */
    List<InningsSummary> scorecard();

    /** @return one-line status, e.g. "Australia need 42 runs from 30 balls" */
    String statusText();

    MatchSnapshot snapshot();

    default boolean canDeclare() { return false; }

    /** @return false for formats without declarations or outside the declaration window */
    default boolean declareInnings() { return false; }

    default boolean checkFollowOn() { return false; }

    /**
     * Sends the side batting second back in, switching innings without swapping roles.
     *
     * @return false when the follow-on is not available
     */
    default boolean enforceFollowOn() { return false; }
}
