package com.gnovoa.cricket.core;

import static org.assertj.core.api.Assertions.assertThat;

import com.gnovoa.cricket.TestTeams;
import com.gnovoa.cricket.conditions.MatchConditions;
import com.gnovoa.cricket.config.SimProperties;
import com.gnovoa.cricket.model.Player;
import com.gnovoa.cricket.model.Team;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TestMatchStateTest {

    private Team home;
    private Team away;

    @BeforeEach
    void setUp() {
        home = TestTeams.home();
        away = TestTeams.away();
    }

    private TestMatchState match(MatchFormat format) {
        return new TestMatchState("m-test", format, MatchConditions.neutral(), home, away, SimProperties.defaults());
    }

    @Test
    @DisplayName("A 199-run deficit does not allow the follow-on")
    void followOnNeedsTwoHundredDeficit() {
        TestMatchState s = match(MatchFormat.test());
        ScriptedBowling play = new ScriptedBowling(s);
        play.runs(300).allOut();
        s.switchInnings();
        play.runs(101).allOut();

        assertThat(s.checkFollowOn()).isFalse();
        assertThat(s.enforceFollowOn()).isFalse();
        assertThat(s.switchInnings()).isTrue();
        assertThat(s.battingTeam()).isEqualTo(home);
    }

    @Test
    void followOnSendsTheSameSideBackIn() {
        TestMatchState s = match(MatchFormat.test());
        ScriptedBowling play = new ScriptedBowling(s);
        play.runs(300).allOut();
        s.switchInnings();
        play.runs(100).allOut();

        assertThat(s.checkFollowOn()).isTrue();
        assertThat(s.enforceFollowOn()).isTrue();

        assertThat(s.followOnEnforced()).isTrue();
        assertThat(s.inningsNumber()).isEqualTo(3);
        assertThat(s.battingTeam()).isEqualTo(away);
        assertThat(s.statusText()).isEqualTo("Day 1, Session 1: Awayside trail by 200");
        assertThat(s.scorecard().get(2).followOn()).isTrue();
        assertThat(s.checkFollowOn()).isFalse();
    }

    @Test
    @DisplayName("Bowled out again while still behind loses by an innings")
    void inningsVictory() {
        TestMatchState s = match(MatchFormat.test());
        ScriptedBowling play = new ScriptedBowling(s);
        play.runs(300).allOut();
        s.switchInnings();
        play.runs(100).allOut();
        s.enforceFollowOn();
        play.runs(50).allOut();

        assertThat(s.isMatchComplete()).isTrue();
        MatchResult result = s.determineMatchResult().orElseThrow();
        assertThat(result.marginType()).isEqualTo(MatchResult.MarginType.INNINGS_AND_RUNS);
        assertThat(result.description()).isEqualTo("Homeside won by an innings and 150 runs");

        assertThat(s.switchInnings()).isTrue();
        assertThat(s.inningsNumber()).isEqualTo(5);
        assertThat(s.completedInnings()).hasSize(3);
        assertThat(s.switchInnings()).isFalse();
    }

    @Test
    void fourthInningsChaseWinsByWickets() {
        TestMatchState s = match(MatchFormat.test());
        ScriptedBowling play = new ScriptedBowling(s);
        play.runs(200).allOut();
        s.switchInnings();
        play.runs(150).allOut();
        s.switchInnings();
        assertThat(s.battingTeam()).isEqualTo(home);
        assertThat(s.lead()).isEqualTo(50);
        play.runs(100).allOut();
        s.switchInnings();

        assertThat(s.target()).isEqualTo(151);
        play.runs(140).wickets(3);
        assertThat(s.statusText()).isEqualTo("Day 1, Session 1: Awayside need 11 runs to win");

        play.runs(11);
        assertThat(s.isMatchComplete()).isTrue();
        assertThat(s.determineMatchResult().orElseThrow().description()).isEqualTo("Awayside won by 7 wickets");
    }

    @Test
    void fourthInningsAllOutLosesByRuns() {
        TestMatchState s = match(MatchFormat.test());
        ScriptedBowling play = new ScriptedBowling(s);
        play.runs(200).allOut();
        s.switchInnings();
        play.runs(150).allOut();
        s.switchInnings();
        play.runs(100).allOut();
        s.switchInnings();
        play.runs(120).allOut();

        assertThat(s.determineMatchResult().orElseThrow().description()).isEqualTo("Homeside won by 30 runs");
    }

    @Test
    @DisplayName("First-innings declaration needs 60 overs and 350 runs")
    void declarationWindow() {
        TestMatchState s = match(MatchFormat.test());
        ScriptedBowling play = new ScriptedBowling(s);

        play.balls(OutcomeKind.SIX, 59 * 6);
        assertThat(s.innings().score()).isGreaterThan(350);
        assertThat(s.canDeclare()).isFalse();

        play.balls(OutcomeKind.DOT, 6);
        assertThat(s.canDeclare()).isTrue();
        assertThat(s.declareInnings()).isTrue();
        assertThat(s.isInningsComplete()).isTrue();
        assertThat(s.scorecard().get(0).scoreLine()).isEqualTo((59 * 36) + "/0d");
        assertThat(s.declareInnings()).isFalse();
    }

    @Test
    void secondInningsCannotDeclare() {
        TestMatchState s = match(MatchFormat.test());
        ScriptedBowling play = new ScriptedBowling(s);
        play.runs(100).allOut();
        s.switchInnings();
        play.balls(OutcomeKind.SIX, 70 * 6);

        assertThat(s.canDeclare()).isFalse();
    }

    @Test
    void thirdInningsDeclarationNeedsAThreeHundredLead() {
        TestMatchState s = match(MatchFormat.test());
        ScriptedBowling play = new ScriptedBowling(s);
        play.runs(200).allOut();
        s.switchInnings();
        play.runs(250).allOut();
        s.switchInnings();

        play.balls(OutcomeKind.SINGLE, 60 * 6 - 1).balls(OutcomeKind.TWO, 1);
        assertThat(s.lead()).isEqualTo(311);
        assertThat(s.canDeclare()).isTrue();

        TestMatchState short3 = match(MatchFormat.test());
        ScriptedBowling p2 = new ScriptedBowling(short3);
        p2.runs(200).allOut();
        short3.switchInnings();
        p2.runs(250).allOut();
        short3.switchInnings();
        p2.balls(OutcomeKind.DOT, 60 * 6).runs(349);
        assertThat(short3.lead()).isEqualTo(299);
        assertThat(short3.canDeclare()).isFalse();
    }

    @Test
    @DisplayName("Sessions roll into days, with overnight recovery and wear")
    void sessionAndDayWrap() {
        TestMatchState s = match(MatchFormat.multiDay(3, 3, 1));
        ScriptedBowling play = new ScriptedBowling(s);
        Player bowler = away.bowlers().get(0);
        bowler.setFitness(60);

        play.runs(6).balls(OutcomeKind.DOT, 5);
        assertThat(s.isSessionComplete()).isTrue();
        assertThat(s.nextSession()).isTrue();
        assertThat(s.session()).isEqualTo(2);
        assertThat(s.sessions()).hasSize(1);
        assertThat(s.sessions().get(0).runs()).isEqualTo(6);
        assertThat(s.sessions().get(0).overs()).isEqualTo("1.0");

        play.balls(OutcomeKind.DOT, 6);
        s.nextSession();
        play.ball(BallOutcome.wicket(WicketKind.BOWLED)).balls(OutcomeKind.DOT, 5);
        s.nextSession();

        assertThat(s.day()).isEqualTo(2);
        assertThat(s.session()).isEqualTo(1);
        assertThat(s.ballsToday()).isZero();
        assertThat(s.days()).hasSize(1);
        DaySummary day1 = s.days().get(0);
        assertThat(day1.runs()).isEqualTo(6);
        assertThat(day1.wickets()).isEqualTo(1);
        assertThat(day1.overs()).isEqualTo("3.0");
        assertThat(day1.scoreAtStumps()).isEqualTo("Homeside 6/1");
        assertThat(bowler.fitness()).isLessThanOrEqualTo(75).isGreaterThan(60);
        assertThat(s.conditions().pitchWear()).isEqualTo(10.0);
        assertThat(s.snapshot().day()).isEqualTo(2);
    }

    @Test
    @DisplayName("Running out of days ends the match as a draw")
    void drawWhenTimeRunsOut() {
        TestMatchState s = match(MatchFormat.multiDay(1, 1, 1));
        ScriptedBowling play = new ScriptedBowling(s);
        play.runs(30);
        play.balls(OutcomeKind.DOT, 1);

        assertThat(s.isSessionComplete()).isTrue();
        assertThat(s.isMatchComplete()).isFalse();
        assertThat(s.nextSession()).isTrue();

        assertThat(s.isOutOfTime()).isTrue();
        assertThat(s.isMatchComplete()).isTrue();
        assertThat(s.determineMatchResult()).contains(MatchResult.draw());
        assertThat(s.statusText()).isEqualTo("Match drawn");
        assertThat(s.nextSession()).isFalse();
        assertThat(s.nextDay()).isFalse();
        assertThat(s.switchInnings()).isFalse();
    }

    @Test
    void nextDaySkipsTheRestOfTheDay() {
        TestMatchState s = match(MatchFormat.multiDay(2, 3, 30));
        new ScriptedBowling(s).runs(12);

        assertThat(s.nextDay()).isTrue();

        assertThat(s.day()).isEqualTo(2);
        assertThat(s.session()).isEqualTo(1);
        assertThat(s.sessions()).hasSize(1);
        assertThat(s.days()).extracting(DaySummary::runs).containsExactly(12);
    }

    @Test
    @DisplayName("Five days of three 30-over sessions run out during the third innings: draw")
    void fullTestRunsOutOfTimeInTheThirdInnings() {
        TestMatchState s = match(MatchFormat.test());
        ScriptedBowling play = new ScriptedBowling(s);
        play.runs(300).allOut();
        s.switchInnings();
        play.runs(150).allOut();
        assertThat(s.checkFollowOn()).isFalse();
        s.switchInnings();

        while (!s.isMatchComplete()) {
            play.balls(OutcomeKind.DOT, 1);
            if (s.isSessionComplete()) s.nextSession();
        }

        assertThat(s.isOutOfTime()).isTrue();
        assertThat(s.inningsNumber()).isEqualTo(3);
        assertThat(s.completedInnings()).hasSize(2);
        assertThat(s.sessions()).hasSize(15).extracting(SessionSummary::overs).containsOnly("30.0");
        assertThat(s.days()).hasSize(5).extracting(DaySummary::overs).containsOnly("90.0");
        assertThat(s.innings().balls()).isEqualTo(15 * 180 - 95);
        assertThat(s.determineMatchResult()).contains(MatchResult.draw());
        assertThat(s.scorecard()).hasSize(3);
    }
}
