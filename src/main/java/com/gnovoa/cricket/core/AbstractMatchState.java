package com.gnovoa.cricket.core;

import com.gnovoa.cricket.conditions.MatchConditions;
import com.gnovoa.cricket.config.SimProperties;
import com.gnovoa.cricket.model.Player;
import com.gnovoa.cricket.model.Team;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/** Innings history, ball application and snapshotting shared by both formats. */
abstract class AbstractMatchState implements MatchState {

    protected final String matchId;
    protected final MatchFormat format;
    protected final MatchConditions conditions;
    protected final SimProperties.Feedback feedback;
    protected final Team teamBattingFirst;
    protected final Team teamBowlingFirst;

    /** Every innings opened so far; the last one is current. */
    protected final List<InningsState> history = new ArrayList<>();

    /** Append-only. */
    protected final List<InningsSummary> summaries = new ArrayList<>();

    protected int inningsNumber = 1;

    AbstractMatchState(
            String matchId,
            MatchFormat format,
            MatchConditions conditions,
            Team teamBattingFirst,
            Team teamBowlingFirst,
            SimProperties.Feedback feedback) {
        this.matchId = Objects.requireNonNull(matchId, "matchId");
        this.format = Objects.requireNonNull(format, "format");
        this.conditions = Objects.requireNonNull(conditions, "conditions");
        this.teamBattingFirst = Objects.requireNonNull(teamBattingFirst, "teamBattingFirst");
        this.teamBowlingFirst = Objects.requireNonNull(teamBowlingFirst, "teamBowlingFirst");
        this.feedback = Objects.requireNonNull(feedback, "feedback");
        if (teamBattingFirst.teamId().equals(teamBowlingFirst.teamId())) {
            throw new IllegalArgumentException("A team cannot play itself: " + teamBattingFirst.teamId());
        }
        history.add(new InningsState(1, teamBattingFirst, teamBowlingFirst, feedback, staminaDrain()));
    }

    @Override public String matchId() { return matchId; }
    @Override public MatchFormat format() { return format; }
    @Override public MatchConditions conditions() { return conditions; }
    @Override public Team teamBattingFirst() { return teamBattingFirst; }
    @Override public Team teamBowlingFirst() { return teamBowlingFirst; }
    @Override public InningsState innings() { return history.get(history.size() - 1); }
    @Override public int inningsNumber() { return inningsNumber; }

    @Override public List<InningsSummary> completedInnings() { return Collections.unmodifiableList(summaries); }

    @Override
    public List<InningsSummary> scorecard() {
        List<InningsSummary> all = new ArrayList<>(summaries);
        if (history.size() > summaries.size()) {
            InningsState current = innings();
            all.add(current.summary(isFollowOnInnings(current)));
        }
        return all;
    }

    /** @return true when {@code inn} was batted after the follow-on was enforced */
    protected boolean isFollowOnInnings(InningsState inn) {
        return false;
    }

    @Override
    public boolean applyBall(BallOutcome outcome) {
        if (isMatchComplete()) throw new IllegalStateException("Match " + matchId + " is complete");
        if (isInningsComplete()) throw new IllegalStateException("Innings " + inningsNumber + " is complete");

        InningsState inn = innings();
        int before = inn.score();
        boolean overComplete = inn.applyBall(outcome);
        afterBall(outcome, inn.score() - before);

        if (overComplete && !isInningsComplete()) inn.rotateStrike();
        return overComplete;
    }

    /** Hook for per-session bookkeeping; called after every delivery. */
    protected void afterBall(BallOutcome outcome, int runs) {
    }

    @Override
    public void rotateStrike() {
        innings().rotateStrike();
    }

    protected void open(Team batting, Team bowling) {
        history.add(new InningsState(inningsNumber, batting, bowling, feedback, staminaDrain()));
    }

    private double staminaDrain() {
        return conditions.weatherModifiers().staminaDrain();
    }

    /** @return runs scored by {@code team} across the first {@code inningsCount} innings */
    protected int aggregate(Team team, int inningsCount) {
        int total = 0;
        for (int i = 0; i < Math.min(inningsCount, history.size()); i++) {
            InningsState inn = history.get(i);
            if (inn.battingTeam().equals(team)) total += inn.score();
        }
        return total;
    }

    protected int aggregate(Team team) {
        return aggregate(team, history.size());
    }

    protected Double requiredRunRate() { return null; }
    protected Integer projectedScore() { return null; }
    protected Integer winProbability() { return null; }

    @Override
    public MatchSnapshot snapshot() {
        InningsState inn = innings();
        return new MatchSnapshot(
                matchId,
                format.kind(),
                inningsNumber,
                inn.battingTeam().name(),
                inn.bowlingTeam().name(),
                inn.score(),
                inn.wickets(),
                inn.overs(),
                nameOf(inn.striker()),
                nameOf(inn.nonStriker()),
                nameOf(inn.bowler()),
                target(),
                inn.runRate(),
                requiredRunRate(),
                projectedScore(),
                winProbability(),
                day(),
                session(),
                statusText(),
                isMatchComplete(),
                determineMatchResult().orElse(null),
                List.copyOf(summaries)
        );
    }

    private static String nameOf(Player p) {
        return p == null ? null : p.name();
    }
}
