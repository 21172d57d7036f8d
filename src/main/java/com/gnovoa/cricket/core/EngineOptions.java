package com.gnovoa.cricket.core;

/**
 * Per-match automation switches.
 *
 * @param ballsPerTick deliveries bowled on each tick of the live ticker
 * @param autoDeclare declare as soon as the declaration window opens
 * @param autoFollowOn enforce the follow-on whenever it is available
 */
public record EngineOptions(int ballsPerTick, boolean autoDeclare, boolean autoFollowOn) {

    public EngineOptions {
        if (ballsPerTick <= 0) throw new IllegalArgumentException("ballsPerTick must be positive, was " + ballsPerTick);
    }

    public static EngineOptions defaults() {
        return new EngineOptions(1, true, true);
    }
}
