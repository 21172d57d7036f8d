package com.gnovoa.cricket.core;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Fixed-rate driver for one match, on its own single thread. Restartable after a stop. */
public final class MatchTicker {

    private static final Logger log = LoggerFactory.getLogger(MatchTicker.class);

    private final String matchId;
    private final int tickMillis;

    private ScheduledExecutorService scheduler;

    public MatchTicker(String matchId, int tickMillis) {
        if (tickMillis <= 0) throw new IllegalArgumentException("tickMillis must be positive, was " + tickMillis);
        this.matchId = matchId;
        this.tickMillis = tickMillis;
    }

    public synchronized boolean isRunning() {
        return scheduler != null && !scheduler.isShutdown();
    }

    /**
     * Runs {@code tick} every {@code tickMillis} until it returns false or {@link #stopNow()} is called.
     */
    public synchronized void start(TickAction tick) {
        if (isRunning()) return;
        ScheduledExecutorService exec = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "ticker-" + matchId);
            t.setDaemon(true);
            return t;
        });
        scheduler = exec;
        exec.scheduleAtFixedRate(() -> {
            try {
                if (!tick.tick()) exec.shutdown();
            } catch (RuntimeException e) {
                log.error("Ticker for match {} failed; stopping", matchId, e);
                exec.shutdown();
            }
        }, 0, tickMillis, TimeUnit.MILLISECONDS);
    }

    public synchronized void stopNow() {
        if (scheduler != null) scheduler.shutdownNow();
        scheduler = null;
    }

    @FunctionalInterface
    public interface TickAction {
        /** @return false to stop ticking */
        boolean tick();
    }
}
