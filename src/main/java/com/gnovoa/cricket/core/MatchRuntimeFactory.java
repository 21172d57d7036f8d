package com.gnovoa.cricket.core;

import com.gnovoa.cricket.conditions.MatchConditions;
import com.gnovoa.cricket.config.SimProperties;
import com.gnovoa.cricket.model.Team;
import com.gnovoa.cricket.out.EventPublisher;
import com.gnovoa.cricket.sim.ConditionsFactory;
import com.gnovoa.cricket.sim.OutcomeProbabilityEngine;
import com.gnovoa.cricket.sim.SeededRandomSource;

import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class MatchRuntimeFactory {

    private static final Logger log = LoggerFactory.getLogger(MatchRuntimeFactory.class);

    private final EventPublisher publisher;
    private final SimProperties simProps;
    private final EngineOptions options;

    public MatchRuntimeFactory(EventPublisher publisher, SimProperties simProps, EngineOptions options) {
        this.publisher = publisher;
        this.simProps = simProps;
        this.options = options;
    }

    /**
     * @param seed fixes every random draw of the match; a fresh one is drawn when {@code null}
     * @param conditions explicit conditions; generated from the seed when {@code null}
     */
    public MatchRuntime create(
            MatchFormat format,
            Team battingFirst,
            Team bowlingFirst,
            Long seed,
            MatchConditions conditions
    ) {
        String matchId = "m-" + UUID.randomUUID();
        long actualSeed = seed != null ? seed : ThreadLocalRandom.current().nextLong();

        var rnd = new SeededRandomSource(actualSeed);
        MatchConditions actualConditions = conditions != null ? conditions : ConditionsFactory.generateRandom(format, rnd);

        MatchState state = MatchState.create(matchId, format, actualConditions, battingFirst, bowlingFirst, simProps);
        MatchEngine engine = new MatchEngine(state, new OutcomeProbabilityEngine(rnd), publisher, simProps, options);

        log.info("match={} created: {} v {} ({}), seed={}, {}",
                matchId, battingFirst.name(), bowlingFirst.name(), format.kind(), actualSeed,
                actualConditions.description());
        return new MatchRuntimeImpl(engine, actualSeed, simProps.tickMillis());
    }
}
