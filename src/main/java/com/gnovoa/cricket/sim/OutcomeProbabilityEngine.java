package com.gnovoa.cricket.sim;

import com.gnovoa.cricket.conditions.GroundModifiers;
import com.gnovoa.cricket.conditions.MatchConditions;
import com.gnovoa.cricket.conditions.PitchModifiers;
import com.gnovoa.cricket.core.BallOutcome;
import com.gnovoa.cricket.core.InningsState;
import com.gnovoa.cricket.core.MatchFormat;
import com.gnovoa.cricket.core.MatchState;
import com.gnovoa.cricket.core.OutcomeKind;
import com.gnovoa.cricket.core.WicketKind;
import com.gnovoa.cricket.model.BattingStyle;
import com.gnovoa.cricket.model.BowlingStyle;
import com.gnovoa.cricket.model.Player;
import com.gnovoa.cricket.model.Team;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns a batter/bowler match-up, the match situation and the conditions into one ball outcome.
 *
 * <p>Starts from a per-format base table (percentages), applies multiplicative adjustments for
 * skill, batting style, psychology, conditions, situation and fatigue, renormalizes to 100 and
 * samples with a single draw from the {@link RandomSource}. Given the same source, the same
 * inputs always produce the same outcome.
 */
public final class OutcomeProbabilityEngine {

    private static final Map<OutcomeKind, Double> LIMITED_OVERS_BASE = outcomeBase(30, 25, 15, 5, 15, 5, 3, 1.5, 0.5);
    private static final Map<OutcomeKind, Double> MULTI_DAY_BASE = outcomeBase(60, 20, 8, 2, 7, 1, 4, 1.5, 0.5);

    private static final Map<WicketKind, Double> LIMITED_OVERS_WICKETS = wicketBase(25, 50, 15, 5, 3, 2);
    private static final Map<WicketKind, Double> MULTI_DAY_WICKETS = wicketBase(28, 55, 12, 2, 2, 1);

    private final RandomSource rnd;

    public OutcomeProbabilityEngine(RandomSource rnd) {
        this.rnd = Objects.requireNonNull(rnd, "rnd");
    }

    /**
     * Bowls one ball.
     *
     * @throws NullPointerException if batter or bowler is missing
     */
    public BallOutcome computeOutcome(Player batter, Player bowler, MatchState state, MatchConditions conditions) {
        Map<OutcomeKind, Double> table = adjustedTable(batter, bowler, state, conditions);
        OutcomeKind kind = sample(table, OutcomeKind.DOT);

        if (kind != OutcomeKind.WICKET) return BallOutcome.of(kind);

        WicketKind how = sample(wicketTable(bowler.bowlingStyle(), state.format()), WicketKind.CAUGHT);
        return BallOutcome.wicket(how, fielderFor(how, bowler, state.bowlingTeam()));
    }

    /**
     * Outcome percentages for this delivery, normalized to sum to 100 with no negative entries.
     * Exposed so the weighting can be inspected without sampling.
     */
    public Map<OutcomeKind, Double> adjustedTable(
            Player batter, Player bowler, MatchState state, MatchConditions conditions) {
        Objects.requireNonNull(batter, "batter");
        Objects.requireNonNull(bowler, "bowler");
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(conditions, "conditions");

        boolean multiDay = state.format().isMultiDay();
        Map<OutcomeKind, Double> t = new EnumMap<>(multiDay ? MULTI_DAY_BASE : LIMITED_OVERS_BASE);

        double skill = clamp((batter.battingRating() - bowler.bowlingRating()) / 100.0, -0.5, 0.5);
        if (multiDay) {
            scale(t, OutcomeKind.DOT, 1 - skill * 0.2);
            scale(t, OutcomeKind.FOUR, 1 + skill * 0.3);
            scale(t, OutcomeKind.SIX, 1 + skill * 0.4);
            scale(t, OutcomeKind.WICKET, 1 - skill * 0.3);
        } else {
            scale(t, OutcomeKind.DOT, 1 - skill * 0.3);
            scale(t, OutcomeKind.FOUR, 1 + skill * 0.5);
            scale(t, OutcomeKind.SIX, 1 + skill * 0.6);
            scale(t, OutcomeKind.WICKET, 1 - skill * 0.4);
        }

        applyBattingStyle(t, batter.battingStyle(), multiDay);
        applyPsychology(t, batter, multiDay);
        applyConditions(t, bowler.bowlingStyle(), conditions);
        if (multiDay) applyMultiDaySituation(t, bowler.bowlingStyle(), state);
        else applyLimitedOversPhase(t, state);
        applyFatigue(t, batter, bowler, state, multiDay);

        return normalize(t);
    }

    private static void applyBattingStyle(Map<OutcomeKind, Double> t, BattingStyle style, boolean multiDay) {
        if (style == BattingStyle.AGGRESSIVE) {
            if (multiDay) multiply(t, 0.85, 0.95, 1.2, 1.4, 1.15);
            else multiply(t, 0.7, 0.8, 1.3, 1.5, 1.2);
        } else if (style == BattingStyle.DEFENSIVE) {
            if (multiDay) multiply(t, 1.2, 1.15, 0.8, 0.6, 0.85);
            else multiply(t, 1.4, 1.2, 0.7, 0.5, 0.8);
        }
    }

    private static void applyPsychology(Map<OutcomeKind, Double> t, Player batter, boolean multiDay) {
        if (multiDay) {
            double patience = batter.profile().batting().temperament() / 100.0;
            scale(t, OutcomeKind.DOT, 0.9 + patience * 0.2);
            scale(t, OutcomeKind.WICKET, 1.1 - patience * 0.2);

            double concentration = batter.profile().mental().concentration() / 100.0;
            scale(t, OutcomeKind.WICKET, 1.15 - concentration * 0.3);
        }

        double form = (batter.form() - 50) / 100.0;
        if (multiDay) {
            scale(t, OutcomeKind.DOT, 1 - form * 0.1);
            scale(t, OutcomeKind.FOUR, 1 + form * 0.2);
            scale(t, OutcomeKind.SIX, 1 + form * 0.25);
        } else {
            scale(t, OutcomeKind.DOT, 1 - form * 0.2);
            scale(t, OutcomeKind.FOUR, 1 + form * 0.3);
            scale(t, OutcomeKind.SIX, 1 + form * 0.4);
        }

        double confidence = (batter.confidence() - 50) / 100.0;
        scale(t, OutcomeKind.WICKET, 1 - confidence * 0.2);
        scale(t, OutcomeKind.FOUR, 1 + confidence * 0.15);
    }

    private static void applyConditions(Map<OutcomeKind, Double> t, BowlingStyle style, MatchConditions conditions) {
        PitchModifiers pitch = conditions.pitchModifiers();
        GroundModifiers ground = conditions.groundModifiers();

        scale(t, OutcomeKind.DOT, pitch.dot());
        scale(t, OutcomeKind.SINGLE, pitch.single());
        scale(t, OutcomeKind.WICKET, pitch.wickets());
        scale(t, OutcomeKind.FOUR, pitch.boundaries() * ground.four());
        scale(t, OutcomeKind.SIX, pitch.boundaries() * ground.six());
        scale(t, OutcomeKind.TWO, ground.twoRuns());
        scale(t, OutcomeKind.THREE, ground.threeRuns());

        double e = conditions.bowlingEffectiveness(style);
        double boundaryDamping = Math.max(0.1, 2 - e);
        scale(t, OutcomeKind.WICKET, e);
        scale(t, OutcomeKind.DOT, e);
        scale(t, OutcomeKind.FOUR, boundaryDamping);
        scale(t, OutcomeKind.SIX, boundaryDamping);
    }

    /** Powerplay is the first 30% of the allotted overs, the death the last 25%. */
    private static void applyLimitedOversPhase(Map<OutcomeKind, Double> t, MatchState state) {
        int over = state.innings().completedOvers();
        int allotted = state.format().overs();

        if (over < allotted * 0.3) {
            scale(t, OutcomeKind.DOT, 0.9);
            scale(t, OutcomeKind.FOUR, 1.15);
            scale(t, OutcomeKind.SIX, 1.1);
            scale(t, OutcomeKind.WICKET, 1.05);
        } else if (over >= allotted * 0.75) {
            scale(t, OutcomeKind.DOT, 0.7);
            scale(t, OutcomeKind.SINGLE, 1.1);
            scale(t, OutcomeKind.FOUR, 1.2);
            scale(t, OutcomeKind.SIX, 1.3);
            scale(t, OutcomeKind.WICKET, 1.3);
        }
    }

    private static void applyMultiDaySituation(Map<OutcomeKind, Double> t, BowlingStyle style, MatchState state) {
        boolean pace = style != null && style.isPace();
        boolean spin = style != null && style.isSpin();

        // morning freshness, tiring evening
        if (state.session() == 1) {
            scale(t, OutcomeKind.WICKET, 1.15);
            scale(t, OutcomeKind.DOT, 1.1);
            scale(t, OutcomeKind.FOUR, 0.95);
        } else if (state.session() == 3) {
            scale(t, OutcomeKind.WICKET, 0.95);
            scale(t, OutcomeKind.DOT, 0.95);
            scale(t, OutcomeKind.FOUR, 1.05);
        }

        if (state.day() == 1 && pace) scale(t, OutcomeKind.WICKET, 1.05);
        if (state.day() >= 4 && spin) {
            scale(t, OutcomeKind.WICKET, 1.2);
            scale(t, OutcomeKind.DOT, 1.1);
        }
        if (state.inningsNumber() >= 3) scale(t, OutcomeKind.WICKET, 1.05);

        // new ball every 80 overs
        int ballAge = state.innings().completedOvers() % 80;
        if (ballAge < 10) {
            if (pace) {
                scale(t, OutcomeKind.WICKET, 1.2);
                scale(t, OutcomeKind.DOT, 1.1);
                scale(t, OutcomeKind.FOUR, 0.95);
            }
        } else if (ballAge > 50) {
            if (spin) {
                scale(t, OutcomeKind.WICKET, 1.1);
            } else {
                scale(t, OutcomeKind.WICKET, 0.9);
                scale(t, OutcomeKind.FOUR, 1.05);
            }
        }
    }

    private static void applyFatigue(
            Map<OutcomeKind, Double> t, Player batter, Player bowler, MatchState state, boolean multiDay) {
        if (bowler.fitness() < 70) {
            double d = (100 - bowler.fitness()) / 100.0;
            scale(t, OutcomeKind.FOUR, 1 + d * 0.2);
            scale(t, OutcomeKind.SIX, 1 + d * 0.2);
            scale(t, OutcomeKind.WICKET, 1 - d * 0.15);
        }

        if (multiDay) {
            InningsState inn = state.innings();
            int faced = inn.ballsFaced(batter);
            if (faced > 150) {
                double l = Math.min((faced - 150) / 150.0, 0.5);
                scale(t, OutcomeKind.WICKET, 1 + l * 0.3);
                scale(t, OutcomeKind.DOT, 1 + l * 0.1);
            }
        }
    }

    /** Wicket-kind percentages for a bowler's style, normalized to 100. */
    public Map<WicketKind, Double> wicketTable(BowlingStyle style, MatchFormat format) {
        Map<WicketKind, Double> t = new EnumMap<>(format.isMultiDay() ? MULTI_DAY_WICKETS : LIMITED_OVERS_WICKETS);
        if (style != null && style.isPace()) {
            scale(t, WicketKind.BOWLED, 1.2);
            scale(t, WicketKind.CAUGHT, 1.1);
            scale(t, WicketKind.LBW, 1.2);
            scale(t, WicketKind.STUMPED, 0.3);
        } else if (style != null && style.isSpin()) {
            scale(t, WicketKind.STUMPED, 2.5);
            scale(t, WicketKind.CAUGHT, 1.2);
            scale(t, WicketKind.BOWLED, 0.9);
            scale(t, WicketKind.LBW, 1.4);
        }
        return normalize(t);
    }

    /** Catches and run-outs go to any fielder but the bowler; stumpings to the keeper. */
    private String fielderFor(WicketKind how, Player bowler, Team fielding) {
        switch (how) {
            case CAUGHT, RUN_OUT -> {
                List<Player> others = fielding.players().stream().filter(p -> p != bowler).toList();
                if (others.isEmpty()) return bowler.name();
                return others.get(rnd.nextIntInclusive(0, others.size() - 1)).name();
            }
            case STUMPED -> {
                return fielding.wicketKeeper()
                        .or(() -> fielding.players().stream().filter(p -> p != bowler).findFirst())
                        .map(Player::name)
                        .orElse(bowler.name());
            }
            default -> {
                return null;
            }
        }
    }

    private <K extends Enum<K>> K sample(Map<K, Double> table, K fallback) {
        double draw = rnd.nextDouble() * 100;
        double cumulative = 0;
        for (var e : table.entrySet()) {
            cumulative += e.getValue();
            if (draw < cumulative) return e.getKey();
        }
        return fallback;
    }

    /** Rescales to sum to 100; negative entries are floored at 0 first. */
    static <K extends Enum<K>> Map<K, Double> normalize(Map<K, Double> table) {
        table.replaceAll((k, v) -> Math.max(0, v));
        double total = table.values().stream().mapToDouble(Double::doubleValue).sum();
        if (total <= 0) throw new IllegalStateException("Probability table has no positive weight: " + table);
        table.replaceAll((k, v) -> v / total * 100);
        return Collections.unmodifiableMap(table);
    }

    private static <K extends Enum<K>> void scale(Map<K, Double> t, K key, double factor) {
        t.computeIfPresent(key, (k, v) -> v * factor);
    }

    /** dot, single, four, six, wicket in that order. */
    private static void multiply(Map<OutcomeKind, Double> t, double dot, double single, double four, double six, double wicket) {
        scale(t, OutcomeKind.DOT, dot);
        scale(t, OutcomeKind.SINGLE, single);
        scale(t, OutcomeKind.FOUR, four);
        scale(t, OutcomeKind.SIX, six);
        scale(t, OutcomeKind.WICKET, wicket);
    }

    private static double clamp(double v, double lo, double hi) {
        return Math.max(lo, Math.min(hi, v));
    }

    private static Map<OutcomeKind, Double> outcomeBase(
            double dot, double single, double two, double three, double four, double six,
            double wicket, double wide, double noBall) {
        Map<OutcomeKind, Double> t = new EnumMap<>(OutcomeKind.class);
        t.put(OutcomeKind.DOT, dot);
        t.put(OutcomeKind.SINGLE, single);
        t.put(OutcomeKind.TWO, two);
        t.put(OutcomeKind.THREE, three);
        t.put(OutcomeKind.FOUR, four);
        t.put(OutcomeKind.SIX, six);
        t.put(OutcomeKind.WICKET, wicket);
        t.put(OutcomeKind.WIDE, wide);
        t.put(OutcomeKind.NO_BALL, noBall);
        return Collections.unmodifiableMap(t);
    }

    private static Map<WicketKind, Double> wicketBase(
            double bowled, double caught, double lbw, double runOut, double stumped, double hitWicket) {
        Map<WicketKind, Double> t = new EnumMap<>(WicketKind.class);
        t.put(WicketKind.BOWLED, bowled);
        t.put(WicketKind.CAUGHT, caught);
        t.put(WicketKind.LBW, lbw);
        t.put(WicketKind.RUN_OUT, runOut);
        t.put(WicketKind.STUMPED, stumped);
        t.put(WicketKind.HIT_WICKET, hitWicket);
        return Collections.unmodifiableMap(t);
    }
}
