package com.gnovoa.cricket.api.dto;

import com.gnovoa.cricket.conditions.GroundSize;
import com.gnovoa.cricket.conditions.PitchType;
import com.gnovoa.cricket.conditions.Weather;

/**
 * Body of {@code POST /api/matches}.
 *
 * <p>{@code format} is {@code T20}, {@code ODI}, {@code TEST}, {@code LIMITED_OVERS} (with
 * {@code overs}) or {@code MULTI_DAY} (with {@code days}, {@code sessionsPerDay} and
 * {@code oversPerSession}). Without {@code battingFirst} a toss decides. Without {@code conditions}
 * they are drawn from the seed.
 */
public record CreateMatchRequest(
        String format,
        Integer overs,
        Integer days,
        Integer sessionsPerDay,
        Integer oversPerSession,
        String teamA,
        String teamB,
        String battingFirst,
        Long seed,
        Conditions conditions,
        Boolean autoStart
) {
    public record Conditions(PitchType pitchType, Weather weather, GroundSize groundSize, Boolean highAltitude) {}
}
