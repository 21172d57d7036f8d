package com.gnovoa.cricket.model;

public enum BowlingStyle {
    FAST,
    FAST_MEDIUM,
    MEDIUM,
    OFF_SPIN,
    LEG_SPIN,
    LEFT_ARM_SPIN;

    public boolean isSpin() {
        return this == OFF_SPIN || this == LEG_SPIN || this == LEFT_ARM_SPIN;
    }

    /** Seam bowling that benefits from a new ball; medium pace is neither pace nor spin here. */
    public boolean isPace() {
        return this == FAST || this == FAST_MEDIUM;
    }
}
