package com.gnovoa.cricket.core;

/**
 * Match format as a tagged variant: {@code kind} is the discriminator and only the fields of that
 * kind are meaningful ({@code overs} for limited overs; days/sessions for multi-day).
 */
public record MatchFormat(FormatKind kind, int overs, int days, int sessionsPerDay, int oversPerSession) {

    public MatchFormat {
        if (kind == null) throw new IllegalArgumentException("Format kind is required");
        if (kind == FormatKind.LIMITED_OVERS && overs <= 0) {
            throw new IllegalArgumentException("Limited-overs format needs a positive over count, was " + overs);
        }
        if (kind == FormatKind.MULTI_DAY && (days <= 0 || sessionsPerDay <= 0 || oversPerSession <= 0)) {
            throw new IllegalArgumentException("Multi-day format needs positive days, sessions and overs per session");
        }
    }

    public static MatchFormat limitedOvers(int overs) {
        return new MatchFormat(FormatKind.LIMITED_OVERS, overs, 0, 0, 0);
    }

    public static MatchFormat t20() { return limitedOvers(20); }
    public static MatchFormat odi() { return limitedOvers(50); }

    public static MatchFormat multiDay(int days, int sessionsPerDay, int oversPerSession) {
        return new MatchFormat(FormatKind.MULTI_DAY, 0, days, sessionsPerDay, oversPerSession);
    }

    /** Five days, three 30-over sessions a day. */
    public static MatchFormat test() { return multiDay(5, 3, 30); }

    public boolean isLimitedOvers() { return kind == FormatKind.LIMITED_OVERS; }
    public boolean isMultiDay() { return kind == FormatKind.MULTI_DAY; }

    /** @return innings per match: two for limited overs, four for multi-day */
    public int maxInnings() { return isLimitedOvers() ? 2 : 4; }
}
