package com.gnovoa.cricket.sim;

import com.gnovoa.cricket.conditions.GroundSize;
import com.gnovoa.cricket.conditions.MatchConditions;
import com.gnovoa.cricket.conditions.PitchType;
import com.gnovoa.cricket.conditions.Weather;
import com.gnovoa.cricket.core.MatchFormat;

/** Draws random pre-match conditions from the match's {@link RandomSource}. */
public final class ConditionsFactory {

    private ConditionsFactory() {}

    /**
     * Uniform pitch, weather and ground; a 30% chance of early dew (0-29) in limited-overs games,
     * and a 10% chance of a high-altitude venue. The pitch always starts unworn.
     */
    public static MatchConditions generateRandom(MatchFormat format, RandomSource rnd) {
        PitchType pitch = pick(PitchType.values(), rnd);
        Weather weather = pick(Weather.values(), rnd);
        GroundSize ground = pick(GroundSize.values(), rnd);

        double dew = 0;
        if (format.isLimitedOvers() && rnd.nextDouble() < 0.3) dew = rnd.nextIntInclusive(0, 29);
        boolean altitude = rnd.nextDouble() < 0.1;

        return new MatchConditions(pitch, weather, ground, altitude, 0, dew);
    }

    private static <T> T pick(T[] values, RandomSource rnd) {
        return values[rnd.nextIntInclusive(0, values.length - 1)];
    }
}
