package com.gnovoa.cricket.model;

import java.util.Objects;

/**
 * A player taking part in a match: immutable {@link PlayerProfile} plus short-term state.
 *
 * <p>{@code form}, {@code fitness} and {@code confidence} are clamped to 0-100. For the duration of
 * a match the match state machine is their only writer; the probability engine, the bowler
 * scheduler and observers only read them, and only between deliveries.
 */
public final class Player {

    /** Share of the gap to the latest performance that form closes each time. */
    static final double FORM_WEIGHT = 0.3;

    private final PlayerProfile profile;

    private int form = 50;
    private int fitness = 100;
    private int confidence = 50;

    public Player(PlayerProfile profile) {
        this.profile = Objects.requireNonNull(profile, "profile");
    }

    public PlayerProfile profile() { return profile; }
    public String id() { return profile.playerId(); }
    public String name() { return profile.name(); }
    public PlayerRole role() { return profile.role(); }

    public BattingStyle battingStyle() { return profile.batting().style(); }
    public BowlingStyle bowlingStyle() { return profile.bowling().style(); }

    public int battingRating() { return profile.batting().overall(); }
    public int bowlingRating() { return profile.bowling().overall(); }
    public int fieldingRating() { return profile.fielding().overall(); }

    public int form() { return form; }
    public int fitness() { return fitness; }
    public int confidence() { return confidence; }

    public void setForm(int value) { form = clamp(value); }
    /**
     * Moves form part of the way towards a performance rating.
     *
     * @param performance 0-100, 50 being an ordinary day
     */
    public void updateForm(int performance) {
        setForm(form + (int) Math.round((clamp(performance) - form) * FORM_WEIGHT));
    }

    public void setFitness(int value) { fitness = clamp(value); }
    public void setConfidence(int value) { confidence = clamp(value); }

    private static int clamp(int value) {
        return Math.max(0, Math.min(100, value));
    }

    @Override
    public String toString() {
        return name() + " (" + id() + ")";
    }
}
