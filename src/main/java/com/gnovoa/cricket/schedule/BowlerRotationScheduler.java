package com.gnovoa.cricket.schedule;

import com.gnovoa.cricket.config.SimProperties;
import com.gnovoa.cricket.model.Player;
import com.gnovoa.cricket.model.Team;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Picks the bowler for each over of one innings.
 *
 * <p>Provides:
 * <ul>
 *   <li>Two ends that alternate on every call; the bowler of the previous over is never returned</li>
 *   <li>Spell limits (pace 8 overs, spin 12) extendable while the bowler is taking wickets or
 *       bowling tightly, and a forced change when fitness drops below the floor or the bowler
 *       has gone for too many after six overs</li>
 *   <li>Rest periods before a rested bowler may return (pace 10 overs, spin 5)</li>
 *   <li>Phase-based replacement order: openers early, first change in the middle overs, spin later</li>
 *   <li>A per-bowler over quota in limited-overs matches, rationed so that the remaining overs
 *       can always be shared out without anyone bowling two in a row or going over it</li>
 * </ul>
 *
 * <p>All limits come from {@code sim.spells.*}. Over numbers are 0-based completed overs of the
 * innings. Not thread-safe; one instance per innings.
 */
public final class BowlerRotationScheduler {

    /** Mutable spell record for one bowler. */
    static final class Spell {
        int spellOvers;
        int restStartOver = -1;
        int oversToday;
        int totalOvers;
        BowlingFigures.Figures spellStart;
    }

    private final List<Player> all;
    private final List<Player> openers;
    private final List<Player> firstChange;
    private final List<Player> spinners;

    private final SimProperties.Spells rules;

    /** Maximum overs per bowler; 0 means unlimited. */
    private final int quota;

    /** Overs in the innings; only read when there is a quota. */
    private final int inningsOvers;

    private final Map<String, Spell> spells = new HashMap<>();

    private Player endA;
    private Player endB;
    private boolean nextFromA = true;

    /**
     * @param bowlers every player allowed to bowl
     * @param rules spell and rest limits
     * @param quota maximum overs per bowler, 0 for none
     * @param inningsOvers overs in the innings, 0 for no limit
     * @throws IllegalArgumentException with fewer than two bowlers
     */
    public BowlerRotationScheduler(List<Player> bowlers, SimProperties.Spells rules, int quota, int inningsOvers) {
        if (bowlers == null || bowlers.size() < 2) {
            throw new IllegalArgumentException("At least two bowlers are needed, got "
                    + (bowlers == null ? 0 : bowlers.size()));
        }
        this.rules = rules;
        this.quota = quota;
        this.inningsOvers = inningsOvers;
        this.all = bowlers.stream()
                .sorted(Comparator.comparingInt(Player::bowlingRating).reversed())
                .toList();

        List<Player> seam = all.stream().filter(p -> !isSpinner(p)).toList();
        this.openers = seam.subList(0, Math.min(2, seam.size()));
        this.firstChange = seam.subList(openers.size(), Math.min(openers.size() + 3, seam.size()));
        this.spinners = all.stream().filter(BowlerRotationScheduler::isSpinner).toList();

        for (Player p : all) spells.put(p.id(), new Spell());
    }

    /**
     * Scheduler for the fielding side's bowlers and all-rounders. When they cannot cover the
     * innings between them within the quota, the whole side is available.
     *
     * @param overs overs per innings in a limited-overs match (a fifth of them is each bowler's
     *     quota); 0 for a multi-day match
     */
    public static BowlerRotationScheduler forTeam(Team fielding, SimProperties.Spells rules, int overs) {
        int quota = overs > 0 ? Math.max(1, (overs + 4) / 5) : 0;
        List<Player> bowlers = fielding.bowlers();
        if (bowlers.size() < 2 || bowlers.size() * quota < overs) bowlers = fielding.players();
        return new BowlerRotationScheduler(bowlers, rules, quota, overs);
    }

    public List<Player> openers() { return openers; }
    public List<Player> firstChange() { return firstChange; }
    public List<Player> spinners() { return spinners; }

    public int spellOvers(Player p) { return spell(p).spellOvers; }
    public int oversToday(Player p) { return spell(p).oversToday; }
    public int totalOvers(Player p) { return spell(p).totalOvers; }
    public boolean isResting(Player p) { return spell(p).restStartOver >= 0; }

    /**
     * Chooses who bowls over {@code currentOver}, alternating ends.
     *
     * <p>The bowler who last bowled from this end keeps going until forced off, at which point
     * they are rested and replaced.
     *
     * @param currentOver 0-based over about to be bowled
     * @param figures live figures of the innings, for spell performance
     * @param previousBowler bowler of the over just completed; may be {@code null} at the start
     * @return the next bowler, never {@code previousBowler}
     */
    public Player selectNextBowler(int currentOver, BowlingFigures figures, Player previousBowler) {
        boolean fromA = nextFromA;
        nextFromA = !nextFromA;

        Player current = fromA ? endA : endB;
        Player otherEnd = fromA ? endB : endA;

        if (current != null
                && current != previousBowler
                && !mustChange(current, figures)
                && keepsQuotaPlayable(current, currentOver)) {
            startSpellIfNeeded(current, figures);
            return current;
        }
        if (current != null && current != previousBowler) restBowler(current, currentOver);

        Player chosen = chooseReplacement(currentOver, previousBowler, otherEnd);
        if (chosen == otherEnd) {
            if (fromA) endB = null;
            else endA = null;
        }
        if (fromA) endA = chosen;
        else endB = chosen;
        startSpellIfNeeded(chosen, figures);
        return chosen;
    }

    /** Records that {@code bowler} completed over {@code over}. */
    public void updateSpell(Player bowler, int over) {
        Spell s = spell(bowler);
        s.spellOvers++;
        s.oversToday++;
        s.totalOvers++;
    }

    /** @return true when the bowler is not resting, or has rested long enough by {@code currentOver} */
    public boolean canBowlAgain(Player bowler, int currentOver) {
        Spell s = spell(bowler);
        if (s.restStartOver < 0) return true;
        int needed = isSpinner(bowler) ? rules.spinRestOvers() : rules.paceRestOvers();
        return currentOver - s.restStartOver >= needed;
    }

    /** Ends the bowler's spell and starts the rest clock at {@code currentOver}. */
    public void restBowler(Player bowler, int currentOver) {
        Spell s = spell(bowler);
        s.spellOvers = 0;
        s.spellStart = null;
        s.restStartOver = currentOver;
        if (endA == bowler) endA = null;
        if (endB == bowler) endB = null;
    }

    /** Interval: spells restart, the same bowlers keep their ends. */
    public void resetSpellsForSessionBreak() {
        for (Spell s : spells.values()) {
            s.spellOvers = 0;
            s.spellStart = null;
        }
    }

    /** Overnight: spells, rest clocks, ends and daily over counts all start fresh. */
    public void resetSpellsForEndOfDay() {
        for (Spell s : spells.values()) {
            s.spellOvers = 0;
            s.spellStart = null;
            s.restStartOver = -1;
            s.oversToday = 0;
        }
        endA = null;
        endB = null;
        nextFromA = true;
    }

    private boolean mustChange(Player p, BowlingFigures figures) {
        if (p.fitness() < rules.fitnessFloor()) return true;
        if (quotaReached(p)) return true;
        if (expensive(p, figures)) return true;

        Spell s = spell(p);
        boolean spin = isSpinner(p);
        int limit = spin ? rules.spinSpellLimit() : rules.paceSpellLimit();
        int max = spin ? rules.spinSpellMax() : rules.paceSpellMax();
        if (s.spellOvers < limit) return false;
        if (s.spellOvers >= max) return true;
        return !performing(p, s, figures);
    }

    /** Innings economy above the threshold once the bowler has enough overs behind them. */
    private boolean expensive(Player p, BowlingFigures figures) {
        BowlingFigures.Figures f = figures.figuresOf(p);
        if (f.legalBalls() < rules.expensiveAfterOvers() * 6) return false;
        return f.runsConceded() * 6.0 / f.legalBalls() > rules.expensiveEconomy();
    }

    /** Wickets in the spell, or a tight spell economy, earn an extension. */
    private boolean performing(Player p, Spell s, BowlingFigures figures) {
        if (s.spellStart == null) return false;
        BowlingFigures.Figures now = figures.figuresOf(p);
        int wickets = now.wickets() - s.spellStart.wickets();
        if (wickets >= rules.wicketsToExtend()) return true;

        int balls = now.legalBalls() - s.spellStart.legalBalls();
        if (balls == 0) return false;
        double economy = (now.runsConceded() - s.spellStart.runsConceded()) * 6.0 / balls;
        return economy < rules.economyToExtend();
    }

    private Player chooseReplacement(int over, Player previous, Player otherEnd) {
        Set<Player> excluded = new HashSet<>();
        if (previous != null) excluded.add(previous);
        if (otherEnd != null) excluded.add(otherEnd);

        List<Player> ranked;
        if (over < rules.openingPhaseEnd()) {
            ranked = openers;
        } else if (over < rules.firstChangePhaseEnd()) {
            ranked = Stream.concat(byTotalOvers(firstChange).stream(), openers.stream()).toList();
        } else {
            ranked = new ArrayList<>();
            ranked.addAll(byTotalOvers(spinners));
            ranked.addAll(byTotalOvers(openers));
            ranked.addAll(byTotalOvers(firstChange));
        }

        Optional<Player> pick = ranked.stream().filter(p -> available(p, over, excluded)).findFirst();
        if (pick.isEmpty()) {
            pick = byTotalOvers(all).stream().filter(p -> available(p, over, excluded)).findFirst();
        }
        if (pick.isEmpty()) {
            // spell, rest and fitness limits ignored; the quota still holds
            pick = byRemainingQuota(all).stream()
                    .filter(p -> p != previous && !quotaReached(p) && keepsQuotaPlayable(p, over))
                    .findFirst();
        }
        if (pick.isEmpty()) {
            // attack cannot cover the innings: anyone but the previous bowler
            pick = byTotalOvers(all).stream().filter(p -> p != previous).findFirst();
        }
        return pick.orElseThrow(() -> new IllegalStateException("No bowler available for over " + (over + 1)));
    }

    private boolean available(Player p, int over, Set<Player> excluded) {
        return !excluded.contains(p)
                && canBowlAgain(p, over)
                && p.fitness() >= rules.fitnessFloor()
                && !quotaReached(p)
                && keepsQuotaPlayable(p, over);
    }

    private boolean quotaReached(Player p) {
        return quota > 0 && spell(p).totalOvers >= quota;
    }

    private int remainingQuota(Player p) {
        return Math.max(0, quota - spell(p).totalOvers);
    }

    /**
     * Whether the overs left after {@code p} bowls {@code over} can still be shared out within the
     * quota with nobody bowling consecutive overs. Over a stretch of {@code left} overs a bowler
     * can bowl at most every other one, and {@code p}, having just bowled, one fewer.
     */
    private boolean keepsQuotaPlayable(Player p, int over) {
        if (quota <= 0 || inningsOvers <= 0) return true;
        int left = inningsOvers - over - 1;
        if (left <= 0) return true;

        int coverable = 0;
        for (Player b : all) {
            int remaining = remainingQuota(b) - (b == p ? 1 : 0);
            int cap = b == p ? left / 2 : (left + 1) / 2;
            coverable += Math.min(remaining, cap);
        }
        return coverable >= left;
    }

    private void startSpellIfNeeded(Player p, BowlingFigures figures) {
        Spell s = spell(p);
        s.restStartOver = -1;
        if (s.spellStart == null) s.spellStart = figures.figuresOf(p);
    }

    private List<Player> byTotalOvers(List<Player> players) {
        return players.stream()
                .sorted(Comparator.comparingInt((Player p) -> spell(p).totalOvers)
                        .thenComparing(Comparator.comparingInt(Player::bowlingRating).reversed()))
                .toList();
    }

    private List<Player> byRemainingQuota(List<Player> players) {
        return players.stream()
                .sorted(Comparator.comparingInt(this::remainingQuota).reversed()
                        .thenComparing(Comparator.comparingInt(Player::bowlingRating).reversed()))
                .toList();
    }

    private Spell spell(Player p) {
        Spell s = spells.get(p.id());
        if (s == null) throw new IllegalArgumentException(p.name() + " is not in this bowling attack");
        return s;
    }

    private static boolean isSpinner(Player p) {
        return p.bowlingStyle() != null && p.bowlingStyle().isSpin();
    }
}
