package com.gnovoa.cricket.core;

import com.gnovoa.cricket.model.Player;

/** Running batting figures for one player in one innings. Written only by {@link InningsState}. */
public final class BatterStat {

    private final Player player;

    private int runs;
    private int balls;
    private int fours;
    private int sixes;
    private boolean out;
    private String dismissal;

    BatterStat(Player player) {
        this.player = player;
    }

    public Player player() { return player; }
    public int runs() { return runs; }
    public int balls() { return balls; }
    public int fours() { return fours; }
    public int sixes() { return sixes; }
    public boolean isOut() { return out; }

    /** @return dismissal text, or "not out" */
    public String dismissal() { return out ? dismissal : "not out"; }

    /** @return runs per 100 balls; 0 before the first ball faced */
    public double strikeRate() {
        return balls == 0 ? 0 : runs * 100.0 / balls;
    }

    void scored(int r) {
        runs += r;
        balls++;
        if (r == 4) fours++;
        if (r == 6) sixes++;
    }

    void dismissed(String text) {
        balls++;
        out = true;
        dismissal = text;
    }

    BattingLine line() {
        return new BattingLine(player.name(), dismissal(), runs, balls, fours, sixes, strikeRate());
    }
}
