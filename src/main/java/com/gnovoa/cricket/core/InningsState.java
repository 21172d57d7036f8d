package com.gnovoa.cricket.core;

import com.gnovoa.cricket.config.SimProperties;
import com.gnovoa.cricket.model.Player;
import com.gnovoa.cricket.model.Team;
import com.gnovoa.cricket.schedule.BowlingFigures;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Ball-by-ball state of one innings, shared by every match format.
 *
 * <p>This class owns:
 * <ul>
 *   <li>Score, wickets and legal-ball count (score never decreases, balls only move on legal deliveries)</li>
 *   <li>Who is on strike, who is off strike and who is bowling</li>
 *   <li>Batting and bowling figures, fall of wickets and partnerships</li>
 *   <li>The per-ball confidence/fitness feedback written back to the {@link Player}s involved</li>
 * </ul>
 *
 * <p>It does not decide when the innings ends; that depends on the format and is answered by the
 * owning {@link MatchState}.
 */
public final class InningsState implements BowlingFigures {

    private static final int[] MILESTONES = {50, 100, 150, 200};

    private final int number;
    private final Team battingTeam;
    private final Team bowlingTeam;
    private final SimProperties.Feedback feedback;

    /** Weather multiplier on the bowler's fitness drain; 1.0 in neutral conditions. */
    private final double staminaDrain;

    private int score = 0;
    private int wickets = 0;
    private int balls = 0;
    private int wides = 0;
    private int noBalls = 0;
    private boolean declared = false;

    private Player striker;
    private Player nonStriker;
    private Player bowler;

    /** Index into the batting order of the next batter in. */
    private int nextBatterIndex;

    private int partnershipRuns = 0;
    private int partnershipBalls = 0;

    /** Runs conceded in the over in progress, extras included. */
    private int runsThisOver = 0;

    private final List<FallOfWicket> fallOfWickets = new ArrayList<>();
    private final List<Partnership> partnerships = new ArrayList<>();
    private final Map<String, BatterStat> batting = new LinkedHashMap<>();
    private final Map<String, BowlerStat> bowling = new LinkedHashMap<>();

    /**
     * Opens an innings with the first two players of the batting order at the crease.
     *
     * @param number innings number within the match (1-4)
     * @param battingTeam side batting; its player order is the batting order
     * @param bowlingTeam side fielding
     * @param feedback confidence and fitness tunables
     * @throws IllegalArgumentException if the batting side cannot field two openers
     */
    public InningsState(int number, Team battingTeam, Team bowlingTeam, SimProperties.Feedback feedback) {
        this(number, battingTeam, bowlingTeam, feedback, 1.0);
    }

    /**
     * @param staminaDrain multiplier on {@code feedback.fitnessDrain()}, e.g. 1.4 in humid weather
     * @throws IllegalArgumentException if the batting side cannot field two openers or the
     *     multiplier is negative
     */
    public InningsState(
            int number, Team battingTeam, Team bowlingTeam, SimProperties.Feedback feedback, double staminaDrain) {
        if (staminaDrain < 0) throw new IllegalArgumentException("staminaDrain must not be negative, was " + staminaDrain);
        this.staminaDrain = staminaDrain;
        this.number = number;
        this.battingTeam = Objects.requireNonNull(battingTeam, "battingTeam");
        this.bowlingTeam = Objects.requireNonNull(bowlingTeam, "bowlingTeam");
        this.feedback = Objects.requireNonNull(feedback, "feedback");
        if (battingTeam.players().size() < 2) {
            throw new IllegalArgumentException(battingTeam.name() + " needs at least two batters");
        }
        this.striker = battingTeam.players().get(0);
        this.nonStriker = battingTeam.players().get(1);
        this.nextBatterIndex = 2;
        batterStat(striker);
        batterStat(nonStriker);
    }

    public int number() { return number; }
    public Team battingTeam() { return battingTeam; }
    public Team bowlingTeam() { return bowlingTeam; }

    public int score() { return score; }
    public int wickets() { return wickets; }
    public int balls() { return balls; }
    public int completedOvers() { return balls / 6; }
    public String overs() { return oversNotation(balls); }

    public int wides() { return wides; }
    public int noBalls() { return noBalls; }
    public int extras() { return wides + noBalls; }

    public boolean isDeclared() { return declared; }
    public boolean isAllOut() { return wickets >= 10; }

    /** @return batter on strike; {@code null} once all out */
    public Player striker() { return striker; }
    public Player nonStriker() { return nonStriker; }

    /** @return current bowler; {@code null} before the first over is assigned */
    public Player bowler() { return bowler; }

    public List<FallOfWicket> fallOfWickets() { return Collections.unmodifiableList(fallOfWickets); }
    public List<Partnership> partnerships() { return Collections.unmodifiableList(partnerships); }

    /** @return the unbroken stand at the crease; {@code null} once all out */
    public Partnership currentPartnership() {
        if (striker == null) return null;
        return new Partnership(striker.name(), nonStriker.name(), partnershipRuns, partnershipBalls);
    }

    /** @return runs per over; 0 before the first legal ball */
    public double runRate() {
        return balls == 0 ? 0 : score * 6.0 / balls;
    }

    public int ballsFaced(Player batter) {
        BatterStat st = batting.get(batter.id());
        return st == null ? 0 : st.balls();
    }

    public Optional<BatterStat> batterStatOf(Player batter) {
        return Optional.ofNullable(batting.get(batter.id()));
    }

    public List<BatterStat> batterStats() { return List.copyOf(batting.values()); }
    public List<BowlerStat> bowlerStats() { return List.copyOf(bowling.values()); }

    @Override
    public Figures figuresOf(Player player) {
        BowlerStat st = bowling.get(player.id());
        if (st == null) return Figures.NONE;
        return new Figures(st.legalBalls(), st.runsConceded(), st.wickets());
    }

    /**
     * Hands the ball to a new bowler.
     *
     * @throws IllegalArgumentException if the player is not in the fielding side or is one of the batters
     */
    public void setBowler(Player player) {
        Objects.requireNonNull(player, "bowler");
        if (!bowlingTeam.contains(player)) {
            throw new IllegalArgumentException(player.name() + " is not in the fielding side " + bowlingTeam.name());
        }
        if (player == striker || player == nonStriker) {
            throw new IllegalArgumentException(player.name() + " is batting and cannot bowl");
        }
        this.bowler = player;
    }

    /** Nobody is bowling until the next {@link #setBowler}; used across intervals. */
    void clearBowler() {
        this.bowler = null;
    }

    public void rotateStrike() {
        Player tmp = striker;
        striker = nonStriker;
        nonStriker = tmp;
    }

    void declare() {
        declared = true;
    }

    /**
     * Applies one delivery.
     *
     * @param outcome what happened
     * @return true when this ball was the sixth legal delivery of an over
     * @throws IllegalStateException if no striker or bowler is set, or the line-up is exhausted
     *     before ten wickets have fallen
     */
    public boolean applyBall(BallOutcome outcome) {
        Objects.requireNonNull(outcome, "outcome");
        if (striker == null || bowler == null) {
            throw new IllegalStateException("Striker and bowler must be set before a ball is bowled");
        }

        BowlerStat figures = bowling.computeIfAbsent(bowler.id(), id -> new BowlerStat(bowler));
        figures.delivered(outcome);
        score += outcome.runs();
        runsThisOver += outcome.runs();

        if (!outcome.legalDelivery()) {
            if (outcome.kind() == OutcomeKind.WIDE) wides++;
            else noBalls++;
            return false;
        }

        balls++;
        if (outcome.isWicket()) {
            wicket(outcome);
        } else {
            runs(outcome);
        }
        drainBowler(figures);

        if (balls % 6 == 0) {
            if (runsThisOver == 0) figures.maiden();
            runsThisOver = 0;
            return true;
        }
        return false;
    }

    private void runs(BallOutcome outcome) {
        BatterStat st = batterStat(striker);
        int before = st.runs();
        st.scored(outcome.runs());
        partnershipRuns += outcome.runs();
        partnershipBalls++;

        if (outcome.isBoundary()) {
            striker.setConfidence(striker.confidence() + feedback.boundaryConfidenceGain());
        }
        for (int m : MILESTONES) {
            if (before < m && st.runs() >= m) {
                striker.setConfidence(striker.confidence() + feedback.milestoneConfidenceGain());
            }
        }

        if (outcome.runs() % 2 == 1) rotateStrike();
    }

    private void wicket(BallOutcome outcome) {
        wickets++;
        partnershipBalls++;

        Player out = striker;
        batterStat(out).dismissed(dismissalText(outcome));
        fallOfWickets.add(new FallOfWicket(out.name(), score, wickets, overs()));
        if (partnershipRuns >= 1) {
            partnerships.add(new Partnership(out.name(), nonStriker.name(), partnershipRuns, partnershipBalls));
        }
        partnershipRuns = 0;
        partnershipBalls = 0;

        int floor = feedback.confidenceFloor();
        if (out.confidence() > floor) {
            out.setConfidence(Math.max(floor, out.confidence() - feedback.wicketConfidenceLoss()));
        }
        if (outcome.wicketKind().creditedToBowler()) {
            bowler.setConfidence(bowler.confidence() + feedback.wicketConfidenceGain());
        }

        if (isAllOut()) {
            striker = null;
            return;
        }
        if (nextBatterIndex >= battingTeam.players().size()) {
            throw new IllegalStateException(
                    battingTeam.name() + " has no batter left with " + wickets + " wickets down");
        }
        striker = battingTeam.players().get(nextBatterIndex++);
        batterStat(striker);
    }

    private void drainBowler(BowlerStat figures) {
        if (figures.legalBalls() % feedback.fitnessDrainEveryBalls() != 0) return;
        int floor = feedback.fitnessFloor();
        int drain = (int) Math.round(feedback.fitnessDrain() * staminaDrain);
        if (bowler.fitness() > floor) {
            bowler.setFitness(Math.max(floor, bowler.fitness() - drain));
        }
    }

    /**
     * Moves every batter's and bowler's form towards how they did in this innings. Batters who
     * never faced a ball and bowlers with less than an over are left alone.
     */
    void updateForm() {
        for (BatterStat st : batting.values()) {
            if (st.balls() == 0 && !st.isOut()) continue;
            st.player().updateForm(Math.min(100, st.runs() * 2));
        }
        for (BowlerStat st : bowling.values()) {
            if (st.legalBalls() < 6) continue;
            double performance = 50 + 15 * st.wickets() - 5 * (st.economy() - 5);
            st.player().updateForm((int) Math.round(performance));
        }
    }

    private String dismissalText(BallOutcome outcome) {
        String b = bowler.name();
        String fielder = outcome.fielder();
        return switch (outcome.wicketKind()) {
            case BOWLED -> "b " + b;
            case CAUGHT -> fielder == null || fielder.equals(b) ? "c & b " + b : "c " + fielder + " b " + b;
            case LBW -> "lbw b " + b;
            case STUMPED -> "st " + (fielder == null ? keeperName() : fielder) + " b " + b;
            case RUN_OUT -> fielder == null ? "run out" : "run out (" + fielder + ")";
            case HIT_WICKET -> "hit wicket b " + b;
        };
    }

    private String keeperName() {
        return bowlingTeam.wicketKeeper()
                .or(() -> bowlingTeam.players().stream().filter(p -> p != bowler).findFirst())
                .map(Player::name)
                .orElse(bowler.name());
    }

    private BatterStat batterStat(Player player) {
        return batting.computeIfAbsent(player.id(), id -> new BatterStat(player));
    }

    /**
     * Archives the innings as it stands.
     *
     * @param followOn whether this innings was batted after the follow-on
     */
    public InningsSummary summary(boolean followOn) {
        return new InningsSummary(
                number,
                battingTeam.name(),
                bowlingTeam.name(),
                score,
                wickets,
                overs(),
                wides,
                noBalls,
                declared,
                followOn,
                batting.values().stream().map(BatterStat::line).toList(),
                bowling.values().stream().map(BowlerStat::line).toList(),
                fallOfWickets,
                partnerships
        );
    }

    static String oversNotation(int legalBalls) {
        return legalBalls / 6 + "." + legalBalls % 6;
    }
}
