package com.gnovoa.cricket.runner;

import com.gnovoa.cricket.core.MatchRuntime;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** In-memory home of every match created since startup, with its ticker state. */
@Component
public final class MatchRegistry {

    private final Map<String, MatchRuntime> runtimes = new ConcurrentHashMap<>();
    private final Map<String, RunnerState> states = new ConcurrentHashMap<>();
    private final Map<String, Long> createdOrder = new ConcurrentHashMap<>();

    public void register(MatchRuntime runtime) {
        runtimes.put(runtime.matchId(), runtime);
        states.put(runtime.matchId(), RunnerState.IDLE);
        createdOrder.put(runtime.matchId(), System.nanoTime());
        runtime.onFinished(() -> states.put(runtime.matchId(),
                runtime.snapshot().matchComplete() ? RunnerState.DONE : RunnerState.STOPPED));
    }

    /** @throws UnknownMatchException if no match has that id */
    public MatchRuntime runtime(String matchId) {
        MatchRuntime r = runtimes.get(matchId);
        if (r == null) throw new UnknownMatchException(matchId);
        return r;
    }

    public RunnerState state(String matchId) {
        runtime(matchId);
        return states.get(matchId);
    }

    /** Ignored once the match is done or stopped. */
    void transition(String matchId, RunnerState next) {
        states.computeIfPresent(matchId, (id, current) ->
                current == RunnerState.DONE || current == RunnerState.STOPPED ? current : next);
    }

    /** @return every match, oldest first */
    public List<MatchRuntime> all() {
        return runtimes.values().stream()
                .sorted(Comparator.comparingLong(r -> createdOrder.getOrDefault(r.matchId(), 0L)))
                .toList();
    }
}
