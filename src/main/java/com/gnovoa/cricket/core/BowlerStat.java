package com.gnovoa.cricket.core;

import com.gnovoa.cricket.model.Player;

/** Running bowling figures for one player in one innings. Written only by {@link InningsState}. */
public final class BowlerStat {

    private final Player player;

    private int legalBalls;
    private int runsConceded;
    private int wickets;
    private int maidens;
    private int wides;
    private int noBalls;

    BowlerStat(Player player) {
        this.player = player;
    }

    public Player player() { return player; }
    public int legalBalls() { return legalBalls; }
    public int runsConceded() { return runsConceded; }
    public int wickets() { return wickets; }
    public int maidens() { return maidens; }
    public int wides() { return wides; }
    public int noBalls() { return noBalls; }

    /** @return overs in cricket notation, e.g. "7.3" */
    public String overs() {
        return InningsState.oversNotation(legalBalls);
    }

    /** @return runs per six legal balls; 0 before the first legal ball */
    public double economy() {
        return legalBalls == 0 ? 0 : runsConceded * 6.0 / legalBalls;
    }

    void delivered(BallOutcome outcome) {
        runsConceded += outcome.runs();
        if (outcome.legalDelivery()) {
            legalBalls++;
        } else if (outcome.kind() == OutcomeKind.WIDE) {
            wides++;
        } else {
            noBalls++;
        }
        if (outcome.isWicket() && outcome.wicketKind().creditedToBowler()) wickets++;
    }

    void maiden() {
        maidens++;
    }

    BowlingLine line() {
        return new BowlingLine(player.name(), overs(), maidens, runsConceded, wickets, wides, noBalls, economy());
    }
}
