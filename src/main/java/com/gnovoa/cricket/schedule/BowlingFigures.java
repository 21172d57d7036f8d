package com.gnovoa.cricket.schedule;

import com.gnovoa.cricket.model.Player;

/** Read-only view of the live bowling figures of the innings in progress. */
@FunctionalInterface
public interface BowlingFigures {

    /** @return figures so far; all zero for a bowler who has not bowled yet */
    Figures figuresOf(Player bowler);

    record Figures(int legalBalls, int runsConceded, int wickets) {
        public static final Figures NONE = new Figures(0, 0, 0);
    }
}
