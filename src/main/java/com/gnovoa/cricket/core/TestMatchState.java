package com.gnovoa.cricket.core;

import com.gnovoa.cricket.conditions.MatchConditions;
import com.gnovoa.cricket.config.SimProperties;
import com.gnovoa.cricket.model.Player;
import com.gnovoa.cricket.model.Team;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Multi-day (Test) match: up to four innings played across days of fixed-length sessions.
 *
 * <p>This class owns:
 * <ul>
 *   <li>The day/session clock, counted in legal balls, and its session and day summaries</li>
 *   <li>Innings order, including the follow-on (same side bats again in innings 3)</li>
 *   <li>Declarations and the result: win by runs, wickets or an innings, tie, or a draw when time runs out</li>
 * </ul>
 *
 * <p>Innings number runs 1-4 and becomes 5 once the last innings has been archived (or an
 * innings victory makes the fourth innings unnecessary).
 */
public final class TestMatchState extends AbstractMatchState {

    private final SimProperties.TestRules rules;

    private int day = 1;
    private int session = 1;

    /** Legal balls bowled in the current session / day. */
    private int ballsInSession = 0;
    private int ballsToday = 0;

    private int sessionRuns = 0;
    private int sessionWickets = 0;
    private int dayRuns = 0;
    private int dayWickets = 0;

    private boolean followOnEnforced = false;

    private final List<SessionSummary> sessions = new ArrayList<>();
    private final List<DaySummary> days = new ArrayList<>();

    public TestMatchState(
            String matchId,
            MatchFormat format,
            MatchConditions conditions,
            Team teamBattingFirst,
            Team teamBowlingFirst,
            SimProperties props) {
        super(matchId, requireMultiDay(format), conditions, teamBattingFirst, teamBowlingFirst, props.feedback());
        this.rules = props.test();
    }

    private static MatchFormat requireMultiDay(MatchFormat format) {
        if (format == null || !format.isMultiDay()) {
            throw new IllegalArgumentException("Test state needs a multi-day format, got " + format);
        }
        return format;
    }

    @Override public int day() { return day; }
    @Override public int session() { return session; }

    public int ballsInSession() { return ballsInSession; }
    public int ballsToday() { return ballsToday; }
    public boolean followOnEnforced() { return followOnEnforced; }
    public List<SessionSummary> sessions() { return Collections.unmodifiableList(sessions); }
    public List<DaySummary> days() { return Collections.unmodifiableList(days); }

    /** @return true once every scheduled day has been played */
    public boolean isOutOfTime() { return day > format.days(); }

    @Override
    protected void afterBall(BallOutcome outcome, int runs) {
        sessionRuns += runs;
        dayRuns += runs;
        if (outcome.legalDelivery()) {
            ballsInSession++;
            ballsToday++;
        }
        if (outcome.isWicket()) {
            sessionWickets++;
            dayWickets++;
        }
    }

    public boolean isSessionComplete() {
        return ballsInSession >= format.oversPerSession() * 6;
    }

    /**
     * Closes the current session, rolling into the next day after the last session.
     *
     * @return false, with no change, once the match is over
     */
    public boolean nextSession() {
        if (isOutOfTime()) return false;
        archiveSession();
        session++;
        if (session > format.sessionsPerDay()) closeDay();
        return true;
    }

    /**
     * Closes the day: archives what was played, recovers every player's fitness overnight and
     * wears the pitch.
     *
     * @return false, with no change, once the match is over
     */
    public boolean nextDay() {
        if (isOutOfTime()) return false;
        if (ballsInSession > 0) archiveSession();
        closeDay();
        return true;
    }

    private void archiveSession() {
        sessions.add(new SessionSummary(
                day, session, sessionRuns, sessionWickets, InningsState.oversNotation(ballsInSession), scoreLine()));
        ballsInSession = 0;
        sessionRuns = 0;
        sessionWickets = 0;
    }

    private void closeDay() {
        days.add(new DaySummary(day, dayRuns, dayWickets, InningsState.oversNotation(ballsToday), scoreLine()));
        day++;
        session = 1;
        ballsToday = 0;
        dayRuns = 0;
        dayWickets = 0;

        int recovery = feedback.overnightRecovery();
        for (Team t : List.of(teamBattingFirst, teamBowlingFirst)) {
            for (Player p : t.players()) p.setFitness(p.fitness() + recovery);
        }
        conditions.addPitchWear(rules.overnightPitchWear());
    }

    private String scoreLine() {
        InningsState inn = innings();
        return inn.battingTeam().name() + " " + inn.score() + "/" + inn.wickets();
    }

    @Override
    public boolean isInningsComplete() {
        InningsState inn = innings();
        if (inn.isAllOut() || inn.isDeclared()) return true;
        return inn.number() == 4 && inn.score() >= target();
    }

    @Override
    public boolean isMatchComplete() {
        if (inningsNumber > 4 || isOutOfTime() || isInningsVictory()) return true;
        return inningsNumber == 4 && isInningsComplete();
    }

    /** Side batting third is all out and still behind on aggregate. */
    private boolean isInningsVictory() {
        if (history.size() < 3) return false;
        InningsState third = history.get(2);
        return third.isAllOut() && aggregate(third.battingTeam(), 3) < aggregate(third.bowlingTeam(), 3);
    }

    @Override
    public Integer target() {
        if (history.size() < 4) return null;
        InningsState fourth = history.get(3);
        return aggregate(fourth.bowlingTeam(), 3) - aggregate(fourth.battingTeam(), 3) + 1;
    }

    @Override
    public boolean switchInnings() {
        if (inningsNumber > 4 || isOutOfTime() || !isInningsComplete()) return false;

        InningsState done = innings();
        summaries.add(done.summary(isFollowOnInnings(done)));
        inningsNumber++;
        if (inningsNumber > 4 || isInningsVictory()) {
            inningsNumber = 5;
            return true;
        }

        Team bat = done.battingTeam();
        Team bowl = done.bowlingTeam();
        if (!(inningsNumber == 3 && followOnEnforced)) {
            Team tmp = bat;
            bat = bowl;
            bowl = tmp;
        }
        open(bat, bowl);
        return true;
    }

    @Override
    protected boolean isFollowOnInnings(InningsState inn) {
        return followOnEnforced && inn.number() == 3;
    }

    @Override
    public boolean checkFollowOn() {
        if (inningsNumber != 2 || followOnEnforced || isOutOfTime() || !isInningsComplete()) return false;
        return history.get(0).score() - history.get(1).score() >= rules.followOnDeficit();
    }

    @Override
    public boolean enforceFollowOn() {
        if (!checkFollowOn()) return false;
        followOnEnforced = true;
        return switchInnings();
    }

    @Override
    public boolean canDeclare() {
        if (inningsNumber != 1 && inningsNumber != 3) return false;
        if (isMatchComplete() || isInningsComplete()) return false;

        InningsState inn = innings();
        if (inn.balls() < rules.declarationMinOvers() * 6) return false;
        if (inningsNumber == 1) return inn.score() >= rules.firstInningsDeclarationScore();
        return lead() >= rules.thirdInningsDeclarationLead();
    }

    @Override
    public boolean declareInnings() {
        if (!canDeclare()) return false;
        innings().declare();
        return true;
    }

    /** @return batting side's aggregate minus the fielding side's; negative when trailing */
    public int lead() {
        InningsState inn = innings();
        return aggregate(inn.battingTeam()) - aggregate(inn.bowlingTeam());
    }

    @Override
    public Optional<MatchResult> determineMatchResult() {
        if (!isMatchComplete()) return Optional.empty();

        if (isInningsVictory()) {
            InningsState third = history.get(2);
            Team winner = third.bowlingTeam();
            int margin = aggregate(winner, 3) - aggregate(third.battingTeam(), 3);
            return Optional.of(MatchResult.byInningsAndRuns(winner.name(), margin));
        }

        if (history.size() == 4) {
            InningsState fourth = history.get(3);
            int target = target();
            if (fourth.score() >= target) {
                return Optional.of(MatchResult.byWickets(fourth.battingTeam().name(), 10 - fourth.wickets()));
            }
            if (fourth.isAllOut()) {
                int chased = aggregate(fourth.battingTeam());
                int set = aggregate(fourth.bowlingTeam());
                if (chased == set) return Optional.of(MatchResult.tie());
                return Optional.of(MatchResult.byRuns(fourth.bowlingTeam().name(), set - chased));
            }
        }
        return Optional.of(MatchResult.draw());
    }

    @Override
    public String statusText() {
        Optional<MatchResult> result = determineMatchResult();
        if (result.isPresent()) return result.get().description();

        InningsState inn = innings();
        String prefix = "Day " + day + ", Session " + session + ": ";
        String bat = inn.battingTeam().name();
        if (inn.number() == 1) {
            return prefix + bat + " " + inn.score() + "/" + inn.wickets();
        }
        if (inn.number() == 4) {
            int need = target() - inn.score();
            return prefix + bat + " need " + need + (need == 1 ? " run" : " runs") + " to win";
        }
        int lead = lead();
        if (lead > 0) return prefix + bat + " lead by " + lead;
        if (lead < 0) return prefix + bat + " trail by " + (-lead);
        return prefix + "scores level";
    }
}
