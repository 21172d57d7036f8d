package com.gnovoa.cricket.runner;

import com.gnovoa.cricket.api.dto.AdvanceResponse;
import com.gnovoa.cricket.api.dto.CreateMatchRequest;
import com.gnovoa.cricket.api.dto.MatchCreatedResponse;
import com.gnovoa.cricket.api.dto.SquadResponse;
import com.gnovoa.cricket.conditions.MatchConditions;
import com.gnovoa.cricket.core.MatchFormat;
import com.gnovoa.cricket.core.MatchRuntime;
import com.gnovoa.cricket.core.MatchRuntimeFactory;
import com.gnovoa.cricket.core.MatchSnapshot;
import com.gnovoa.cricket.model.Player;
import com.gnovoa.cricket.model.Team;
import com.gnovoa.cricket.rosters.PlayingXiSelector;
import com.gnovoa.cricket.rosters.SquadCatalog;
import com.gnovoa.cricket.sim.SeededRandomSource;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/** Glue between the REST layer and the live matches: creation, fast-forward and ticker control. */
@Component
public final class RunnerFacade {

    private final MatchRegistry registry;
    private final MatchRuntimeFactory factory;
    private final SquadCatalog squads;

    public RunnerFacade(MatchRegistry registry, MatchRuntimeFactory factory, SquadCatalog squads) {
        this.registry = registry;
        this.factory = factory;
        this.squads = squads;
    }

    /**
     * Picks both XIs, settles the toss if needed and registers the match.
     *
     * @throws IllegalArgumentException for an unknown squad or format, or a team playing itself
     */
    public MatchCreatedResponse create(CreateMatchRequest req) {
        if (req.teamA() == null || req.teamB() == null) {
            throw new IllegalArgumentException("teamA and teamB are required");
        }
        if (req.teamA().equals(req.teamB())) {
            throw new IllegalArgumentException("A team cannot play itself: " + req.teamA());
        }
        MatchFormat format = formatOf(req.format(), req.overs(), req.days(), req.sessionsPerDay(), req.oversPerSession());
        Team a = PlayingXiSelector.selectPlayingXI(squads.squad(req.teamA()));
        Team b = PlayingXiSelector.selectPlayingXI(squads.squad(req.teamB()));

        long seed = req.seed() != null ? req.seed() : ThreadLocalRandom.current().nextLong();

        String tossWinner = null;
        Team battingFirst;
        if (req.battingFirst() == null) {
            // toss and decision from their own stream, so the match draws stay the same for a seed
            var toss = new SeededRandomSource(~seed);
            Team winner = toss.nextDouble() < 0.5 ? a : b;
            boolean bat = toss.nextDouble() < 0.5;
            tossWinner = winner.name();
            battingFirst = bat ? winner : (winner == a ? b : a);
        } else if (req.battingFirst().equals(a.teamId())) {
            battingFirst = a;
        } else if (req.battingFirst().equals(b.teamId())) {
            battingFirst = b;
        } else {
            throw new IllegalArgumentException("battingFirst must be " + a.teamId() + " or " + b.teamId());
        }
        Team bowlingFirst = battingFirst == a ? b : a;

        MatchRuntime runtime = factory.create(format, battingFirst, bowlingFirst, seed, conditionsOf(req.conditions()));
        registry.register(runtime);
        if (Boolean.TRUE.equals(req.autoStart())) start(runtime.matchId());

        return new MatchCreatedResponse(
                runtime.matchId(),
                format,
                battingFirst.name(),
                bowlingFirst.name(),
                tossWinner,
                runtime.seed(),
                runtime.conditions(),
                names(battingFirst),
                names(bowlingFirst),
                links(runtime.matchId()));
    }

    public MatchSnapshot snapshot(String matchId) {
        return registry.runtime(matchId).snapshot();
    }

    public MatchRuntime.Scorecard scorecard(String matchId) {
        return registry.runtime(matchId).scorecard();
    }

    public AdvanceResponse advance(String matchId, int balls) {
        MatchRuntime r = registry.runtime(matchId);
        int bowled = r.advance(balls);
        return new AdvanceResponse(bowled, r.snapshot());
    }

    public AdvanceResponse advanceOver(String matchId) {
        MatchRuntime r = registry.runtime(matchId);
        int bowled = r.advanceOver();
        return new AdvanceResponse(bowled, r.snapshot());
    }

    public AdvanceResponse advanceToBreak(String matchId) {
        MatchRuntime r = registry.runtime(matchId);
        int bowled = r.advanceToBreak();
        return new AdvanceResponse(bowled, r.snapshot());
    }

    /** @throws IllegalStateException when the batting side may not declare now */
    public MatchSnapshot declare(String matchId) {
        MatchRuntime r = registry.runtime(matchId);
        if (!r.declare()) {
            throw new IllegalStateException("Declaration not allowed in match " + matchId + " at this point");
        }
        return r.snapshot();
    }

    public void start(String matchId) {
        MatchRuntime r = registry.runtime(matchId);
        r.start();
        if (r.isLive()) registry.transition(matchId, RunnerState.RUNNING);
    }

    public void pause(String matchId) {
        registry.runtime(matchId).pause();
        registry.transition(matchId, RunnerState.PAUSED);
    }

    /** Immediate; the match cannot be resumed afterwards. */
    public void stop(String matchId) {
        registry.runtime(matchId).stop();
    }

    public RunnerStatus status(String matchId) {
        return status(registry.runtime(matchId));
    }

    public List<RunnerStatus> statuses() {
        return registry.all().stream().map(this::status).toList();
    }

    public List<SquadResponse> squads() {
        return squads.squads().stream()
                .map(s -> new SquadResponse(
                        s.teamId(),
                        s.name(),
                        s.shortName(),
                        s.players().stream()
                                .map(p -> new SquadResponse.SquadPlayer(
                                        p.playerId(),
                                        p.name(),
                                        p.role().name(),
                                        p.batting().overall(),
                                        p.bowling().overall()))
                                .toList()))
                .toList();
    }

    private RunnerStatus status(MatchRuntime r) {
        return new RunnerStatus(
                r.matchId(),
                registry.state(r.matchId()),
                r.format(),
                r.battingFirst(),
                r.bowlingFirst(),
                r.seed(),
                r.snapshot().status(),
                links(r.matchId()));
    }

    /**
     * @throws IllegalArgumentException for an unknown format name or missing format parameters
     */
    static MatchFormat formatOf(String name, Integer overs, Integer days, Integer sessionsPerDay, Integer oversPerSession) {
        String key = name == null ? "T20" : name.trim().toUpperCase(Locale.ROOT);
        return switch (key) {
            case "T20" -> MatchFormat.t20();
            case "ODI" -> MatchFormat.odi();
            case "TEST" -> MatchFormat.test();
            case "LIMITED_OVERS" -> MatchFormat.limitedOvers(require("overs", overs));
            case "MULTI_DAY" -> MatchFormat.multiDay(
                    require("days", days), require("sessionsPerDay", sessionsPerDay), require("oversPerSession", oversPerSession));
            default -> throw new IllegalArgumentException("Unknown format " + name);
        };
    }

    private static int require(String field, Integer value) {
        if (value == null) throw new IllegalArgumentException(field + " is required for this format");
        return value;
    }

    private static MatchConditions conditionsOf(CreateMatchRequest.Conditions c) {
        if (c == null) return null;
        return new MatchConditions(c.pitchType(), c.weather(), c.groundSize(), Boolean.TRUE.equals(c.highAltitude()), 0, 0);
    }

    private static List<String> names(Team team) {
        return team.players().stream().map(Player::name).toList();
    }

    private static Map<String, String> links(String matchId) {
        return Map.of(
                "match", "/api/matches/" + matchId,
                "scorecard", "/api/matches/" + matchId + "/scorecard",
                "events", "/ws/matches/" + matchId);
    }
}
