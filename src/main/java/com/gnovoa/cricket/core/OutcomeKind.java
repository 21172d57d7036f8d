package com.gnovoa.cricket.core;

/** What happened on one delivery. Extras always carry one run and are not legal balls. */
public enum OutcomeKind {
    DOT(0, true),
    SINGLE(1, true),
    TWO(2, true),
    THREE(3, true),
    FOUR(4, true),
    SIX(6, true),
    WICKET(0, true),
    WIDE(1, false),
    NO_BALL(1, false);

    private final int runs;
    private final boolean legal;

    OutcomeKind(int runs, boolean legal) {
        this.runs = runs;
        this.legal = legal;
    }

    public int runs() { return runs; }
    public boolean legal() { return legal; }

    public boolean isBoundary() { return this == FOUR || this == SIX; }
}
