package com.gnovoa.cricket.core;

/**
 * Result of one delivery. Immutable once produced.
 *
 * @param kind outcome kind
 * @param runs runs added to the team total; always {@code kind.runs()}, so 0 for a wicket
 * @param legalDelivery false for wides and no-balls
 * @param wicketKind how the batter was out; {@code null} unless {@code kind} is {@link OutcomeKind#WICKET}
 * @param fielder fielder involved in a catch, run-out or stumping; {@code null} otherwise
 */
public record BallOutcome(OutcomeKind kind, int runs, boolean legalDelivery, WicketKind wicketKind, String fielder) {

    public BallOutcome {
        if (kind == null) throw new IllegalArgumentException("Outcome kind is required");
        if (runs != kind.runs()) {
            throw new IllegalArgumentException(kind + " carries " + kind.runs() + " run(s), was " + runs);
        }
        if (legalDelivery != kind.legal()) {
            throw new IllegalArgumentException(kind + " legality mismatch");
        }
        if ((kind == OutcomeKind.WICKET) != (wicketKind != null)) {
            throw new IllegalArgumentException("Wicket kind must be set exactly when the outcome is a wicket");
        }
    }

    public static BallOutcome of(OutcomeKind kind) {
        if (kind == OutcomeKind.WICKET) throw new IllegalArgumentException("Use wicket(...) for dismissals");
        return new BallOutcome(kind, kind.runs(), kind.legal(), null, null);
    }

    public static BallOutcome wicket(WicketKind wicketKind, String fielder) {
        return new BallOutcome(OutcomeKind.WICKET, 0, true, wicketKind, fielder);
    }

    public static BallOutcome wicket(WicketKind wicketKind) {
        return wicket(wicketKind, null);
    }

    public boolean isWicket() { return kind == OutcomeKind.WICKET; }
    public boolean isBoundary() { return kind.isBoundary(); }
}
