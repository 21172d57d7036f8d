package com.gnovoa.cricket.core;

import com.gnovoa.cricket.conditions.MatchConditions;
import com.gnovoa.cricket.config.SimProperties;
import com.gnovoa.cricket.model.Team;

import java.util.Optional;

/**
 * Two-innings match with an over limit (T20, ODI or any other length).
 *
 * <p>An innings ends when the side is all out, the overs run out, or, in the second innings, on
 * the exact ball the target is reached. Target is the first-innings total plus one.
 */
public final class LimitedOversMatchState extends AbstractMatchState {

    public LimitedOversMatchState(
            String matchId,
            MatchFormat format,
            MatchConditions conditions,
            Team teamBattingFirst,
            Team teamBowlingFirst,
            SimProperties props) {
        super(matchId, requireLimited(format), conditions, teamBattingFirst, teamBowlingFirst, props.feedback());
    }

    private static MatchFormat requireLimited(MatchFormat format) {
        if (format == null || !format.isLimitedOvers()) {
            throw new IllegalArgumentException("Limited-overs state needs a limited-overs format, got " + format);
        }
        return format;
    }

    public int maxBalls() { return format.overs() * 6; }

    public int ballsRemaining() { return Math.max(0, maxBalls() - innings().balls()); }

    @Override
    public Integer target() {
        return history.size() >= 2 ? history.get(0).score() + 1 : null;
    }

    @Override
    public boolean isInningsComplete() {
        InningsState inn = innings();
        if (inn.isAllOut() || inn.balls() >= maxBalls()) return true;
        return inn.number() == 2 && inn.score() >= target();
    }

    @Override
    public boolean isMatchComplete() {
        return inningsNumber > 2 || (inningsNumber == 2 && isInningsComplete());
    }

    @Override
    public boolean switchInnings() {
        if (inningsNumber > 2 || !isInningsComplete()) return false;

        InningsState done = innings();
        summaries.add(done.summary(false));
        inningsNumber++;
        if (inningsNumber == 2) open(done.bowlingTeam(), done.battingTeam());
        return true;
    }

    @Override
    public Optional<MatchResult> determineMatchResult() {
        if (!isMatchComplete()) return Optional.empty();

        InningsState first = history.get(0);
        InningsState second = history.get(1);
        if (second.score() > first.score()) {
            return Optional.of(MatchResult.byWickets(second.battingTeam().name(), 10 - second.wickets()));
        }
        if (second.score() == first.score()) return Optional.of(MatchResult.tie());
        return Optional.of(MatchResult.byRuns(first.battingTeam().name(), first.score() - second.score()));
    }

    @Override
    protected Double requiredRunRate() {
        Integer target = target();
        if (target == null || isMatchComplete()) return null;
        int need = target - innings().score();
        int left = ballsRemaining();
        if (need <= 0 || left <= 0) return null;
        return need * 6.0 / left;
    }

    /** Current run rate carried over the remaining overs. */
    @Override
    protected Integer projectedScore() {
        InningsState inn = innings();
        if (inn.balls() == 0) return null;
        return (int) Math.round(inn.score() + inn.runRate() * ballsRemaining() / 6.0);
    }

    /** Chasing side's chance of winning; even until the chase starts. */
    @Override
    protected Integer winProbability() {
        if (history.size() < 2) return 50;
        InningsState chase = history.get(1);
        return winProbability(target(), chase.score(), chase.wickets(), chase.balls(), maxBalls());
    }

    /**
     * Rough chase estimate, 0-100: 100 once the target is reached, 0 when all out or out of balls,
     * otherwise 5-95 from the required rate, scaled by wickets in hand and nudged by whether the
     * side is scoring faster than it needs to.
     */
    static int winProbability(int target, int score, int wickets, int ballsBowled, int maxBalls) {
        if (score >= target) return 100;
        int ballsLeft = maxBalls - ballsBowled;
        int wicketsLeft = 10 - wickets;
        if (wicketsLeft <= 0 || ballsLeft <= 0) return 0;

        double required = (target - score) * 6.0 / ballsLeft;
        double current = ballsBowled == 0 ? 0 : score * 6.0 / ballsBowled;

        double p;
        if (required <= 4) p = 85;
        else if (required <= 6) p = 70;
        else if (required <= 8) p = 55;
        else if (required <= 10) p = 35;
        else if (required <= 12) p = 20;
        else p = 10;

        p *= 0.5 + wicketsLeft / 10.0 * 0.5;
        if (current > required) p += 10;
        else if (current < required * 0.7) p -= 10;

        return (int) Math.max(5, Math.min(95, Math.round(p)));
    }

    @Override
    public String statusText() {
        Optional<MatchResult> result = determineMatchResult();
        if (result.isPresent()) return result.get().description();

        InningsState inn = innings();
        String bat = inn.battingTeam().name();
        if (inn.number() == 1) {
            return bat + " " + inn.score() + "/" + inn.wickets() + " (" + inn.overs() + " ov)";
        }
        if (isInningsComplete()) return bat + " innings complete";
        int need = target() - inn.score();
        return bat + " need " + need + (need == 1 ? " run" : " runs") + " from " + ballsRemaining() + " balls";
    }
}
