package com.gnovoa.cricket.conditions;

public enum PitchType {
    /** Flat and hard. */
    BATTING,
    /** Green and seaming. */
    BOWLING,
    BALANCED,
    /** Dry and dusty. */
    TURNING,
    /** Low and slow. */
    SLOW,
    BOUNCY
}
