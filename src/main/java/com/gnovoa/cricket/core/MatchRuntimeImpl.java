package com.gnovoa.cricket.core;

import java.util.List;

/**
 * Default {@link MatchRuntime}: one engine, one ticker, all access serialized on this instance.
 */
public final class MatchRuntimeImpl implements MatchRuntime {

    private final MatchEngine engine;
    private final long seed;
    private final int ballsPerTick;
    private final MatchTicker ticker;

    /** Set by {@link #stop()}; checked between deliveries of a bulk advance. */
    private volatile boolean stopped = false;
    private volatile boolean finishedNotified = false;
    private volatile Runnable onFinished = () -> {};

    public MatchRuntimeImpl(MatchEngine engine, long seed, int tickMillis) {
        this.engine = engine;
        this.seed = seed;
        this.ballsPerTick = engine.options().ballsPerTick();
        this.ticker = new MatchTicker(engine.state().matchId(), tickMillis);
    }

    @Override public String matchId() { return engine.state().matchId(); }
    @Override public MatchFormat format() { return engine.state().format(); }
    @Override public String battingFirst() { return engine.state().teamBattingFirst().name(); }
    @Override public String bowlingFirst() { return engine.state().teamBowlingFirst().name(); }
    @Override public long seed() { return seed; }

    @Override
    public synchronized String conditions() {
        return engine.state().conditions().description();
    }

    @Override
    public synchronized MatchSnapshot snapshot() {
        return engine.state().snapshot();
    }

    @Override
    public synchronized Scorecard scorecard() {
        MatchState state = engine.state();
        List<SessionSummary> sessions = List.of();
        List<DaySummary> days = List.of();
        if (state instanceof TestMatchState test) {
            sessions = List.copyOf(test.sessions());
            days = List.copyOf(test.days());
        }
        return new Scorecard(
                state.matchId(),
                state.scorecard(),
                sessions,
                days,
                state.determineMatchResult().orElse(null));
    }

    @Override
    public synchronized int advance(int balls) {
        int bowled = engine.advance(balls, () -> stopped);
        notifyIfFinished();
        return bowled;
    }

    @Override
    public synchronized int advanceOver() {
        int bowled = engine.advanceOver(() -> stopped);
        notifyIfFinished();
        return bowled;
    }

    @Override
    public synchronized int advanceToBreak() {
        int bowled = engine.advanceToBreak(() -> stopped);
        notifyIfFinished();
        return bowled;
    }

    @Override
    public synchronized boolean declare() {
        boolean declared = engine.declare();
        notifyIfFinished();
        return declared;
    }

    @Override public boolean isFinished() { return stopped || engine.isFinished(); }
    @Override public boolean isLive() { return ticker.isRunning(); }

    @Override
    public void start() {
        if (isFinished()) return;
        ticker.start(this::tick);
    }

    private synchronized boolean tick() {
        if (stopped) return false;
        engine.advance(ballsPerTick, () -> stopped);
        if (engine.isFinished()) {
            notifyIfFinished();
            return false;
        }
        return true;
    }

    @Override
    public void pause() {
        ticker.stopNow();
    }

    @Override
    public void stop() {
        stopped = true;
        ticker.stopNow();
        // taken after the flag so a bulk advance in progress stops before we wait for it
        synchronized (this) {
            notifyIfFinished();
        }
    }

    @Override
    public void onFinished(Runnable callback) {
        this.onFinished = callback == null ? () -> {} : callback;
    }

    /** Runs the finish callback at most once; callers hold the monitor. */
    private void notifyIfFinished() {
        if (finishedNotified || !isFinished()) return;
        finishedNotified = true;
        onFinished.run();
    }
}
