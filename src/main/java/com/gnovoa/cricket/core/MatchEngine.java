package com.gnovoa.cricket.core;

import com.gnovoa.cricket.config.SimProperties;
import com.gnovoa.cricket.events.CricketEventType;
import com.gnovoa.cricket.events.MatchEvent;
import com.gnovoa.cricket.model.Player;
import com.gnovoa.cricket.out.EventPublisher;
import com.gnovoa.cricket.schedule.BowlerRotationScheduler;
import com.gnovoa.cricket.sim.OutcomeProbabilityEngine;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives one match delivery by delivery: asks the probability engine for an outcome, applies it
 * to the {@link MatchState}, and handles everything that happens between balls (bowler changes,
 * pitch wear and dew, declarations, follow-on, session breaks, innings changes) while publishing
 * the corresponding {@link MatchEvent}s.
 *
 * <p>Single-threaded; {@link MatchRuntime} serializes access.
 */
public final class MatchEngine {

    private static final Logger log = LoggerFactory.getLogger(MatchEngine.class);

    private final MatchState state;
    private final OutcomeProbabilityEngine outcomes;
    private final EventPublisher publisher;
    private final SimProperties props;
    private final EngineOptions options;

    private BowlerRotationScheduler scheduler;
    private Player previousBowler;

    private int runsThisOver = 0;
    private int wicketsThisOver = 0;
    private int ballsSinceSnapshot = 0;

    /** Bumped at every over end, innings end and interval; lets callers run "until the next one". */
    private int overBoundaries = 0;
    private int breaks = 0;

    private boolean completionPublished = false;

    public MatchEngine(
            MatchState state,
            OutcomeProbabilityEngine outcomes,
            EventPublisher publisher,
            SimProperties props,
            EngineOptions options) {
        this.state = Objects.requireNonNull(state, "state");
        this.outcomes = Objects.requireNonNull(outcomes, "outcomes");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.props = Objects.requireNonNull(props, "props");
        this.options = Objects.requireNonNull(options, "options");
    }

    public MatchState state() { return state; }
    public EngineOptions options() { return options; }
    public boolean isFinished() { return state.isMatchComplete(); }

    /**
     * Bowls a single delivery.
     *
     * @return the outcome, or empty once the match is over
     */
    public Optional<BallOutcome> bowlBall() {
        if (state.isMatchComplete()) {
            publishCompletion();
            return Optional.empty();
        }
        ensureBowler();

        InningsState inn = state.innings();
        Player striker = inn.striker();
        Player bowler = inn.bowler();
        int over = inn.completedOvers();

        BallOutcome outcome = outcomes.computeOutcome(striker, bowler, state, state.conditions());
        boolean overComplete = state.applyBall(outcome);

        runsThisOver += outcome.runs();
        if (outcome.isWicket()) wicketsThisOver++;
        publishBall(inn, striker, bowler, outcome);

        if (state.isInningsComplete()) {
            onInningsComplete();
        } else if (overComplete) {
            onOverComplete(bowler, over);
        } else {
            takeBreakIfDue();
        }

        if (++ballsSinceSnapshot >= props.snapshotEveryBalls()) {
            ballsSinceSnapshot = 0;
            publish(CricketEventType.MATCH_SNAPSHOT, Map.of());
        }
        return Optional.of(outcome);
    }

    /**
     * Bowls up to {@code requestedBalls} deliveries, capped by {@code sim.fast-forward-ball-ceiling}.
     * Cancellation is checked before every delivery.
     *
     * @return deliveries actually bowled
     * @throws IllegalArgumentException if {@code requestedBalls} is not positive
     */
    public int advance(int requestedBalls, BooleanSupplier cancelled) {
        if (requestedBalls <= 0) {
            throw new IllegalArgumentException("Requested balls must be positive, was " + requestedBalls);
        }
        int limit = Math.min(requestedBalls, props.fastForwardBallCeiling());
        int bowled = 0;
        while (bowled < limit && !cancelled.getAsBoolean() && bowlBall().isPresent()) {
            bowled++;
        }
        return bowled;
    }

    /** Bowls until the current over (or innings) ends, within the fast-forward ceiling. */
    public int advanceOver(BooleanSupplier cancelled) {
        int mark = overBoundaries;
        return advanceWhile(() -> overBoundaries == mark, cancelled);
    }

    /** Bowls until the next interval or innings end, within the fast-forward ceiling. */
    public int advanceToBreak(BooleanSupplier cancelled) {
        int mark = breaks;
        return advanceWhile(() -> breaks == mark, cancelled);
    }

    private int advanceWhile(BooleanSupplier keepGoing, BooleanSupplier cancelled) {
        int bowled = 0;
        while (bowled < props.fastForwardBallCeiling()
                && keepGoing.getAsBoolean()
                && !cancelled.getAsBoolean()
                && bowlBall().isPresent()) {
            bowled++;
        }
        return bowled;
    }

    /**
     * Declares the batting side's innings closed, if the declaration window is open.
     *
     * @return false when the format or the match situation does not allow it
     */
    public boolean declare() {
        if (!state.declareInnings()) return false;
        publish(CricketEventType.DECLARATION, Map.of(
                "team", state.battingTeam().name(),
                "score", state.innings().score(),
                "wickets", state.innings().wickets()));
        onInningsComplete();
        return true;
    }

    private void ensureBowler() {
        InningsState inn = state.innings();
        if (scheduler == null) {
            int overs = state.format().isLimitedOvers() ? state.format().overs() : 0;
            scheduler = BowlerRotationScheduler.forTeam(inn.bowlingTeam(), props.spells(), overs);
        }
        if (inn.bowler() == null) assignNextBowler();
    }

    private void assignNextBowler() {
        InningsState inn = state.innings();
        Player next = scheduler.selectNextBowler(inn.completedOvers(), inn, previousBowler);
        inn.setBowler(next);
    }

    private void onOverComplete(Player bowler, int over) {
        InningsState inn = state.innings();
        scheduler.updateSpell(bowler, over);
        previousBowler = bowler;
        overBoundaries++;

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("over", over + 1);
        data.put("bowler", bowler.name());
        data.put("runs", runsThisOver);
        data.put("wickets", wicketsThisOver);
        publish(CricketEventType.OVER_COMPLETE, data);
        log.debug("match={} over {} by {}: {} runs, {} wickets, {}/{}",
                state.matchId(), over + 1, bowler.name(), runsThisOver, wicketsThisOver, inn.score(), inn.wickets());
        runsThisOver = 0;
        wicketsThisOver = 0;

        wearConditions(inn);

        if (options.autoDeclare() && state.canDeclare()) {
            declare();
            return;
        }
        if (takeBreakIfDue()) return;

        assignNextBowler();
    }

    private void wearConditions(InningsState inn) {
        SimProperties.Wear wear = props.wear();
        if (state.format().isLimitedOvers()) {
            state.conditions().addPitchWear(wear.limitedOversPerOver());
            if (inn.number() == 2 && inn.completedOvers() > wear.dewStartsAfterOver()) {
                state.conditions().addDew(wear.dewPerOver());
            }
        } else {
            state.conditions().addPitchWear(wear.multiDayPerOver());
        }
    }

    /**
     * Closes the session as soon as its balls are used up, which can be mid-over when an innings
     * changed during the session. An unfinished over is completed by the same bowler after the
     * interval; otherwise the next bowler is left for the first ball after it.
     */
    private boolean takeBreakIfDue() {
        if (!(state instanceof TestMatchState test) || !test.isSessionComplete()) return false;

        int day = test.day();
        int session = test.session();
        test.nextSession();
        breaks++;
        InningsState inn = state.innings();
        if (inn.balls() % 6 == 0) inn.clearBowler();

        if (test.day() != day) {
            if (scheduler != null) scheduler.resetSpellsForEndOfDay();
            previousBowler = null;
            var stumps = test.days().get(test.days().size() - 1);
            publish(CricketEventType.STUMPS, Map.of(
                    "day", day,
                    "runs", stumps.runs(),
                    "wickets", stumps.wickets(),
                    "overs", stumps.overs(),
                    "score", stumps.scoreAtStumps()));
            log.info("match={} stumps on day {}: {}", state.matchId(), day, state.statusText());
        } else {
            if (scheduler != null) scheduler.resetSpellsForSessionBreak();
            var closed = test.sessions().get(test.sessions().size() - 1);
            publish(CricketEventType.SESSION_BREAK, Map.of(
                    "day", day,
                    "session", session,
                    "runs", closed.runs(),
                    "wickets", closed.wickets(),
                    "overs", closed.overs()));
        }

        if (state.isMatchComplete()) publishCompletion();
        return true;
    }

    private void onInningsComplete() {
        InningsState done = state.innings();
        overBoundaries++;
        breaks++;
        runsThisOver = 0;
        wicketsThisOver = 0;

        done.updateForm();
        InningsSummary summary = done.summary(false);
        publish(CricketEventType.INNINGS_COMPLETE, Map.of(
                "innings", done.number(),
                "team", done.battingTeam().name(),
                "score", summary.scoreLine(),
                "overs", summary.overs(),
                "topBatters", summary.topBatters(3),
                "topBowlers", summary.topBowlers(3)));
        log.info("match={} innings {} complete: {} {} ({} ov)",
                state.matchId(), done.number(), done.battingTeam().name(), summary.scoreLine(), summary.overs());

        if (options.autoFollowOn() && state.checkFollowOn()) {
            state.enforceFollowOn();
            publish(CricketEventType.FOLLOW_ON, Map.of(
                    "team", state.battingTeam().name(),
                    "deficit", state.completedInnings().get(0).score() - state.completedInnings().get(1).score()));
        } else {
            state.switchInnings();
        }

        if (state.isMatchComplete()) {
            publishCompletion();
            return;
        }

        scheduler = null;
        previousBowler = null;
        takeBreakIfDue();
    }

    private void publishCompletion() {
        if (completionPublished) return;
        completionPublished = true;

        MatchResult result = state.determineMatchResult().orElseThrow();
        log.info("match={} complete: {}", state.matchId(), result.description());
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("result", result);
        data.put("scorecard", state.scorecard());
        publish(CricketEventType.MATCH_COMPLETE, data);
    }

    private void publishBall(InningsState inn, Player striker, Player bowler, BallOutcome outcome) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("over", inn.overs());
        data.put("batter", striker.name());
        data.put("bowler", bowler.name());
        data.put("outcome", outcome.kind());
        data.put("runs", outcome.runs());
        data.put("legal", outcome.legalDelivery());

        if (outcome.isWicket()) {
            data.put("wicketKind", outcome.wicketKind());
            if (outcome.fielder() != null) data.put("fielder", outcome.fielder());
            inn.batterStatOf(striker).ifPresent(st -> {
                data.put("dismissal", st.dismissal());
                data.put("batterRuns", st.runs());
                data.put("batterBalls", st.balls());
            });
            publish(CricketEventType.WICKET, data);
        } else {
            publish(CricketEventType.BALL, data);
        }
    }

    private void publish(CricketEventType type, Map<String, Object> data) {
        publisher.publish(new MatchEvent(state.matchId(), Instant.now(), state.snapshot(), type, data));
    }
}
