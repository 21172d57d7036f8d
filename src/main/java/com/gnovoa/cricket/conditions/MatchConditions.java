package com.gnovoa.cricket.conditions;

import com.gnovoa.cricket.model.BowlingStyle;

/**
 * Environmental state of a match and the multiplier bundles derived from it.
 *
 * <p>This class owns:
 * <ul>
 *   <li>Fixed conditions chosen before the toss (pitch, weather, ground size, altitude)</li>
 *   <li>Two counters that only ever grow during a match: {@code pitchWear} and {@code dewFactor}</li>
 * </ul>
 *
 * <p>Counters are advanced by the match engine as overs elapse; nothing else writes them.
 */
public final class MatchConditions {

    private final PitchType pitchType;
    private final Weather weather;
    private final GroundSize groundSize;
    private final boolean highAltitude;

    /** 0-100, grows with overs bowled and overnight. */
    private double pitchWear;

    /** 0-100, evening moisture; grows during a limited-overs chase. */
    private double dewFactor;

    public MatchConditions(
            PitchType pitchType,
            Weather weather,
            GroundSize groundSize,
            boolean highAltitude,
            double pitchWear,
            double dewFactor) {
        this.pitchType = pitchType == null ? PitchType.BALANCED : pitchType;
        this.weather = weather == null ? Weather.SUNNY : weather;
        this.groundSize = groundSize == null ? GroundSize.MEDIUM : groundSize;
        this.highAltitude = highAltitude;
        this.pitchWear = requirePercent("pitchWear", pitchWear);
        this.dewFactor = requirePercent("dewFactor", dewFactor);
    }

    /** @return balanced pitch, sunny, medium ground, sea level, no wear or dew */
    public static MatchConditions neutral() {
        return new MatchConditions(PitchType.BALANCED, Weather.SUNNY, GroundSize.MEDIUM, false, 0, 0);
    }

    public PitchType pitchType() { return pitchType; }
    public Weather weather() { return weather; }
    public GroundSize groundSize() { return groundSize; }
    public boolean highAltitude() { return highAltitude; }
    public double pitchWear() { return pitchWear; }
    public double dewFactor() { return dewFactor; }

    /**
     * Adds wear to the pitch, capped at 100.
     *
     * @param amount non-negative increment
     * @throws IllegalArgumentException if {@code amount} is negative
     */
    public void addPitchWear(double amount) {
        if (amount < 0) throw new IllegalArgumentException("Pitch wear cannot decrease: " + amount);
        pitchWear = Math.min(100, pitchWear + amount);
    }

    /**
     * Adds dew, capped at 100.
     *
     * @param amount non-negative increment
     * @throws IllegalArgumentException if {@code amount} is negative
     */
    public void addDew(double amount) {
        if (amount < 0) throw new IllegalArgumentException("Dew cannot decrease: " + amount);
        dewFactor = Math.min(100, dewFactor + amount);
    }

    /**
     * Pitch multipliers, including the effect of wear (spin up to +50%, pace down to -30%,
     * boundaries down to -20% at full wear).
     */
    public PitchModifiers pitchModifiers() {
        double dot = 1.0, single = 1.0, boundaries = 1.0, wickets = 1.0, pace = 1.0, spin = 1.0;

        switch (pitchType) {
            case BATTING -> { boundaries = 1.3; dot = 0.8; wickets = 0.7; pace = 0.8; spin = 0.8; }
            case BOWLING -> { boundaries = 0.7; dot = 1.2; wickets = 1.4; pace = 1.4; spin = 0.9; }
            case TURNING -> { boundaries = 0.9; dot = 1.1; wickets = 1.2; pace = 0.8; spin = 1.5; }
            case SLOW -> { boundaries = 0.8; single = 1.2; dot = 1.1; wickets = 0.9; pace = 0.7; }
            case BOUNCY -> { boundaries = 1.1; wickets = 1.1; pace = 1.3; spin = 0.9; }
            case BALANCED -> { }
        }

        double wear = pitchWear / 100.0;
        spin *= 1 + wear * 0.5;
        pace *= 1 - wear * 0.3;
        boundaries *= 1 - wear * 0.2;

        return new PitchModifiers(dot, single, boundaries, wickets, pace, spin);
    }

    /** Weather multipliers, including dew (less grip for spinners, slightly quicker off the pitch). */
    public WeatherModifiers weatherModifiers() {
        double pace = 1.0, spin = 1.0, staminaDrain = 1.0;

        switch (weather) {
            case OVERCAST -> pace = 1.2;
            case HUMID -> staminaDrain = 1.4;
            case RAIN -> { pace = 0.8; spin = 0.7; }
            case WINDY -> spin = 0.9;
            case SUNNY -> spin = 1.1;
        }

        if (dewFactor > 0) {
            double dew = dewFactor / 100.0;
            spin *= 1 - dew * 0.4;
            pace *= 1 + dew * 0.2;
        }

        return new WeatherModifiers(pace, spin, staminaDrain);
    }

    /** Ground-size multipliers; thin air at altitude carries the ball further. */
    public GroundModifiers groundModifiers() {
        double six = 1.0, four = 1.0, two = 1.0, three = 1.0;

        switch (groundSize) {
            case SMALL -> { six = 1.5; four = 1.3; two = 0.8; three = 0.7; }
            case LARGE -> { six = 0.6; four = 0.8; two = 1.3; three = 1.5; }
            case MEDIUM -> { }
        }

        if (highAltitude) {
            six *= 1.2;
            four *= 1.1;
        }

        return new GroundModifiers(six, four, two, three);
    }

    /**
     * Effectiveness of a bowling style in the current conditions.
     *
     * @param style bowler's style
     * @return pitch x weather multiplier for pace or spin; 1.0 for medium pace
     */
    public double bowlingEffectiveness(BowlingStyle style) {
        if (style == null) return 1.0;
        if (style.isPace()) return pitchModifiers().paceEffectiveness() * weatherModifiers().paceEffectiveness();
        if (style.isSpin()) return pitchModifiers().spinEffectiveness() * weatherModifiers().spinEffectiveness();
        return 1.0;
    }

    public String description() {
        StringBuilder sb = new StringBuilder()
                .append("Pitch: ").append(pitchType.name().toLowerCase())
                .append(", Weather: ").append(weather.name().toLowerCase());
        if (pitchWear > 50) sb.append(", Pitch showing signs of wear");
        if (dewFactor > 30) sb.append(", Dew settling in");
        sb.append(", Ground: ").append(groundSize.name().toLowerCase());
        if (highAltitude) sb.append(", High altitude");
        return sb.toString();
    }

    private static double requirePercent(String name, double value) {
        if (value < 0 || value > 100) {
            throw new IllegalArgumentException(name + " must be between 0 and 100 but was " + value);
        }
        return value;
    }
}
