package com.gnovoa.cricket.model;

public enum PlayerRole {
    BATSMAN,
    BOWLER,
    ALL_ROUNDER,
    WICKET_KEEPER;

    /** @return true for roles that are expected to bowl. */
    public boolean bowls() {
        return this == BOWLER || this == ALL_ROUNDER;
    }
}
