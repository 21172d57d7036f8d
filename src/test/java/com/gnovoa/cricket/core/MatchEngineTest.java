package com.gnovoa.cricket.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.gnovoa.cricket.TestTeams;
import com.gnovoa.cricket.conditions.MatchConditions;
import com.gnovoa.cricket.config.SimProperties;
import com.gnovoa.cricket.events.CricketEventType;
import com.gnovoa.cricket.events.MatchEvent;
import com.gnovoa.cricket.sim.OutcomeProbabilityEngine;
import com.gnovoa.cricket.sim.SeededRandomSource;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class MatchEngineTest {

    private final List<MatchEvent> events = new ArrayList<>();

    private MatchEngine engine(MatchFormat format, long seed, SimProperties props) {
        MatchState state = MatchState.create(
                "m-" + seed, format, MatchConditions.neutral(), TestTeams.home(), TestTeams.away(), props);
        return new MatchEngine(
                state, new OutcomeProbabilityEngine(new SeededRandomSource(seed)), events::add, props, EngineOptions.defaults());
    }

    private MatchEngine engine(MatchFormat format, long seed) {
        return engine(format, seed, SimProperties.defaults());
    }

    private static int playOut(MatchEngine engine, int guard) {
        int balls = 0;
        while (engine.bowlBall().isPresent()) {
            if (++balls > guard) throw new AssertionError("Match did not finish within " + guard + " deliveries");
        }
        return balls;
    }

    private long count(CricketEventType type) {
        return events.stream().filter(e -> e.type() == type).count();
    }

    @Test
    @DisplayName("A T20 plays out to a result with one completion event")
    void t20PlaysToCompletion() {
        MatchEngine engine = engine(MatchFormat.t20(), 42);

        int balls = playOut(engine, 2_000);

        MatchState state = engine.state();
        assertThat(state.isMatchComplete()).isTrue();
        assertThat(state.determineMatchResult()).isPresent();
        assertThat(count(CricketEventType.BALL) + count(CricketEventType.WICKET)).isEqualTo(balls);
        assertThat(count(CricketEventType.MATCH_COMPLETE)).isEqualTo(1);
        assertThat(count(CricketEventType.INNINGS_COMPLETE)).isEqualTo(2);
        assertThat(events.get(events.size() - 1).type()).isIn(
                CricketEventType.MATCH_COMPLETE, CricketEventType.MATCH_SNAPSHOT);
        assertThat(engine.bowlBall()).isEmpty();
        assertThat(count(CricketEventType.MATCH_COMPLETE)).isEqualTo(1);

        List<InningsSummary> card = state.scorecard();
        assertThat(card).hasSize(2);
        assertThat(card.get(0).battingTeam()).isEqualTo("Homeside");
        assertThat(card.get(1).battingTeam()).isEqualTo("Awayside");
        for (InningsSummary inn : card) {
            assertThat(inn.wickets()).isBetween(0, 10);
            assertThat(inn.batting().stream().mapToInt(BattingLine::runs).sum() + inn.extras())
                    .isEqualTo(inn.score());
        }
    }

    @Test
    @DisplayName("No bowler delivers two consecutive overs")
    void noConsecutiveOvers() {
        MatchEngine engine = engine(MatchFormat.odi(), 7);
        playOut(engine, 5_000);

        String previous = null;
        for (MatchEvent e : events) {
            if (e.type() == CricketEventType.INNINGS_COMPLETE) previous = null;
            if (e.type() != CricketEventType.OVER_COMPLETE) continue;
            String bowler = (String) e.data().get("bowler");
            assertThat(bowler).isNotEqualTo(previous);
            previous = bowler;
        }
        assertThat(count(CricketEventType.OVER_COMPLETE)).isPositive();
    }

    @Test
    void sameSeedReplaysTheSameMatch() {
        MatchEngine first = engine(MatchFormat.t20(), 2025);
        playOut(first, 2_000);
        String firstResult = first.state().statusText();
        List<String> firstCard = first.state().scorecard().stream().map(InningsSummary::scoreLine).toList();

        events.clear();
        MatchEngine second = engine(MatchFormat.t20(), 2025);
        playOut(second, 2_000);

        assertThat(second.state().statusText()).isEqualTo(firstResult);
        assertThat(second.state().scorecard().stream().map(InningsSummary::scoreLine).toList()).isEqualTo(firstCard);
    }

    @Test
    @DisplayName("A Test match ends in a result or a draw within its five days")
    void testMatchPlaysToCompletion() {
        MatchEngine engine = engine(MatchFormat.test(), 11);

        playOut(engine, 20_000);

        TestMatchState state = (TestMatchState) engine.state();
        assertThat(state.isMatchComplete()).isTrue();
        assertThat(state.determineMatchResult()).isPresent();
        assertThat(state.days().size()).isLessThanOrEqualTo(5);
        assertThat(count(CricketEventType.STUMPS)).isEqualTo(state.days().size());
        assertThat(count(CricketEventType.SESSION_BREAK) + count(CricketEventType.STUMPS))
                .isEqualTo(state.sessions().size());
        assertThat(count(CricketEventType.MATCH_COMPLETE)).isEqualTo(1);
        assertThat(state.scorecard().size()).isBetween(2, 4);
    }

    @Test
    void fastForwardIsCappedByTheCeiling() {
        SimProperties props = new SimProperties(1000, 30, 10, null, null, null, null, null);
        MatchEngine engine = engine(MatchFormat.t20(), 3, props);

        assertThat(engine.advance(100, () -> false)).isEqualTo(10);
        assertThatThrownBy(() -> engine.advance(0, () -> false)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void cancellationIsCheckedBetweenDeliveries() {
        MatchEngine engine = engine(MatchFormat.t20(), 3);
        AtomicInteger checks = new AtomicInteger();

        int bowled = engine.advance(50, () -> checks.incrementAndGet() > 5);

        assertThat(bowled).isEqualTo(5);
        assertThat(engine.advance(50, () -> true)).isZero();
    }

    @Test
    void advanceOverStopsAtTheEndOfTheOver() {
        MatchEngine engine = engine(MatchFormat.t20(), 5);
        engine.advance(2, () -> false);

        int bowled = engine.advanceOver(() -> false);

        InningsState inn = engine.state().innings();
        assertThat(bowled).isGreaterThanOrEqualTo(4);
        assertThat(inn.balls() % 6 == 0 || inn.isAllOut()).isTrue();
        assertThat(count(CricketEventType.OVER_COMPLETE)).isEqualTo(1);
        assertThat(engine.state().conditions().pitchWear()).isEqualTo(0.5);
    }

    @Test
    void advanceToBreakEndsTheSession() {
        MatchEngine engine = engine(MatchFormat.multiDay(2, 3, 5), 9);

        engine.advanceToBreak(() -> false);

        TestMatchState state = (TestMatchState) engine.state();
        boolean sessionClosed = state.session() == 2 && state.sessions().size() == 1;
        boolean inningsClosed = state.inningsNumber() > 1;
        assertThat(sessionClosed || inningsClosed).isTrue();
        assertThat(count(CricketEventType.SESSION_BREAK) + count(CricketEventType.INNINGS_COMPLETE)).isPositive();
    }

    @Test
    void snapshotsArePublishedPeriodically() {
        SimProperties props = new SimProperties(1000, 6, 180, null, null, null, null, null);
        MatchEngine engine = engine(MatchFormat.t20(), 8, props);

        engine.advance(36, () -> false);

        assertThat(count(CricketEventType.MATCH_SNAPSHOT)).isEqualTo(6);
        MatchEvent last = events.get(events.size() - 1);
        assertThat(last.type()).isEqualTo(CricketEventType.MATCH_SNAPSHOT);
        assertThat(last.match().matchId()).isEqualTo("m-8");
    }

    @Test
    void declaringTooEarlyIsRefused() {
        MatchEngine engine = engine(MatchFormat.test(), 4);
        engine.advance(12, () -> false);

        assertThat(engine.declare()).isFalse();
        assertThat(count(CricketEventType.DECLARATION)).isZero();
    }

    @Test
    void wicketEventsCarryTheDismissal() {
        MatchEngine engine = engine(MatchFormat.t20(), 13);
        playOut(engine, 2_000);

        List<MatchEvent> wickets = events.stream().filter(e -> e.type() == CricketEventType.WICKET).toList();
        assertThat(wickets).isNotEmpty();
        assertThat(wickets).allSatisfy(e -> {
            assertThat(e.data()).containsKeys("wicketKind", "dismissal", "batterRuns", "bowler");
            assertThat(e.match()).isNotNull();
        });
    }

    private static int legalBalls(String overs) {
        String[] parts = overs.split("\\.");
        return Integer.parseInt(parts[0]) * 6 + Integer.parseInt(parts[1]);
    }

    @Test
    @DisplayName("Nobody bowls more than ten overs in an ODI or four in a T20")
    void quotaHoldsAcrossSeeds() {
        for (long seed = 1; seed <= 4; seed++) {
            MatchEngine odi = engine(MatchFormat.odi(), seed);
            playOut(odi, 5_000);
            for (InningsSummary inn : odi.state().scorecard()) {
                assertThat(inn.bowling()).allSatisfy(line -> assertThat(legalBalls(line.overs())).isLessThanOrEqualTo(60));
            }

            MatchEngine t20 = engine(MatchFormat.t20(), seed);
            playOut(t20, 2_000);
            for (InningsSummary inn : t20.state().scorecard()) {
                assertThat(inn.bowling()).allSatisfy(line -> assertThat(legalBalls(line.overs())).isLessThanOrEqualTo(24));
            }
        }
    }

    @Test
    @DisplayName("Every Test session lasts exactly thirty overs, even across an innings change")
    void sessionsAreFixedLength() {
        for (long seed : new long[] {11, 21, 31}) {
            events.clear();
            MatchEngine engine = engine(MatchFormat.test(), seed);
            playOut(engine, 20_000);

            TestMatchState state = (TestMatchState) engine.state();
            assertThat(state.sessions()).isNotEmpty();
            assertThat(state.sessions()).extracting(SessionSummary::overs).containsOnly("30.0");
        }
    }

    @Test
    void inningsEndUpdatesForm() {
        MatchEngine engine = engine(MatchFormat.t20(), 17);
        MatchState state = engine.state();
        int before = state.innings().striker().form();
        var opener = state.innings().striker();

        while (state.inningsNumber() == 1) engine.bowlBall();

        var line = state.completedInnings().get(0).batting().get(0);
        int performance = Math.min(100, line.runs() * 2);
        int expected = before + (int) Math.round((performance - before) * 0.3);
        assertThat(opener.form()).isEqualTo(Math.max(0, Math.min(100, expected)));
    }
}
