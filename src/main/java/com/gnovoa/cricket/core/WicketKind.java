package com.gnovoa.cricket.core;

public enum WicketKind {
    BOWLED,
    CAUGHT,
    LBW,
    RUN_OUT,
    STUMPED,
    HIT_WICKET;

    /** Run-outs are not credited to the bowler. */
    public boolean creditedToBowler() {
        return this != RUN_OUT;
    }
}
