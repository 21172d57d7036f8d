package com.gnovoa.cricket.runner;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gnovoa.cricket.api.dto.AdvanceResponse;
import com.gnovoa.cricket.api.dto.CreateMatchRequest;
import com.gnovoa.cricket.api.dto.MatchCreatedResponse;
import com.gnovoa.cricket.api.dto.SquadResponse;
import com.gnovoa.cricket.conditions.PitchType;
import com.gnovoa.cricket.conditions.Weather;
import com.gnovoa.cricket.config.SimProperties;
import com.gnovoa.cricket.core.EngineOptions;
import com.gnovoa.cricket.core.FormatKind;
import com.gnovoa.cricket.core.MatchFormat;
import com.gnovoa.cricket.core.MatchRuntimeFactory;
import com.gnovoa.cricket.rosters.SquadCatalog;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RunnerFacadeTest {

    private MatchRegistry registry;
    private RunnerFacade facade;

    @BeforeEach
    void setUp() {
        Map<String, String> files = new LinkedHashMap<>();
        files.put("england", "squads/england.json");
        files.put("australia", "squads/australia.json");
        SimProperties props = new SimProperties(1000, null, null, new SimProperties.Squads(files), null, null, null, null);

        registry = new MatchRegistry();
        var factory = new MatchRuntimeFactory(event -> {}, props, EngineOptions.defaults());
        facade = new RunnerFacade(registry, factory, new SquadCatalog(new ObjectMapper(), props));
    }

    private static CreateMatchRequest request(String format, String battingFirst, Long seed) {
        return new CreateMatchRequest(
                format, null, null, null, null, "england", "australia", battingFirst, seed, null, false);
    }

    @Test
    void formatNamesResolve() {
        assertThat(RunnerFacade.formatOf(null, null, null, null, null)).isEqualTo(MatchFormat.t20());
        assertThat(RunnerFacade.formatOf(" odi ", null, null, null, null)).isEqualTo(MatchFormat.odi());
        assertThat(RunnerFacade.formatOf("Test", null, null, null, null)).isEqualTo(MatchFormat.test());
        assertThat(RunnerFacade.formatOf("LIMITED_OVERS", 10, null, null, null)).isEqualTo(MatchFormat.limitedOvers(10));
        assertThat(RunnerFacade.formatOf("MULTI_DAY", null, 4, 3, 30)).isEqualTo(MatchFormat.multiDay(4, 3, 30));
    }

    @Test
    void badFormatsAreRejected() {
        assertThatThrownBy(() -> RunnerFacade.formatOf("HUNDRED", null, null, null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("HUNDRED");
        assertThatThrownBy(() -> RunnerFacade.formatOf("LIMITED_OVERS", null, null, null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("overs");
        assertThatThrownBy(() -> RunnerFacade.formatOf("MULTI_DAY", null, 4, null, 30))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("sessionsPerDay");
    }

    @Test
    void createsAMatchWithTheChosenSideBatting() {
        MatchCreatedResponse created = facade.create(request("T20", "australia", 99L));

        assertThat(created.matchId()).startsWith("m-");
        assertThat(created.format().kind()).isEqualTo(FormatKind.LIMITED_OVERS);
        assertThat(created.battingFirst()).isEqualTo("Australia");
        assertThat(created.bowlingFirst()).isEqualTo("England");
        assertThat(created.tossWinner()).isNull();
        assertThat(created.seed()).isEqualTo(99L);
        assertThat(created.battingFirstXI()).hasSize(11).contains("Steve Smith", "Pat Cummins");
        assertThat(created.bowlingFirstXI()).hasSize(11).contains("Joe Root");
        assertThat(created.links()).containsEntry("events", "/ws/matches/" + created.matchId());

        RunnerStatus status = facade.status(created.matchId());
        assertThat(status.state()).isEqualTo(RunnerState.IDLE);
        assertThat(status.battingFirst()).isEqualTo("Australia");
        assertThat(status.seed()).isEqualTo(99L);
    }

    @Test
    void tossFollowsTheSeed() {
        MatchCreatedResponse first = facade.create(request("ODI", null, 1234L));
        MatchCreatedResponse second = facade.create(request("ODI", null, 1234L));

        assertThat(first.tossWinner()).isIn("England", "Australia");
        assertThat(second.tossWinner()).isEqualTo(first.tossWinner());
        assertThat(second.battingFirst()).isEqualTo(first.battingFirst());
        assertThat(second.conditions()).isEqualTo(first.conditions());
        assertThat(second.matchId()).isNotEqualTo(first.matchId());
    }

    @Test
    void explicitConditionsAreUsed() {
        var req = new CreateMatchRequest(
                "T20", null, null, null, null, "england", "australia", "england", 5L,
                new CreateMatchRequest.Conditions(PitchType.TURNING, Weather.OVERCAST, null, null), null);

        String conditions = facade.create(req).conditions().toLowerCase();

        assertThat(conditions).contains("turning").contains("overcast");
    }

    @Test
    void invalidSetUpsAreRejected() {
        assertThatThrownBy(() -> facade.create(new CreateMatchRequest(
                "T20", null, null, null, null, "england", "england", null, null, null, null)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("cannot play itself");
        assertThatThrownBy(() -> facade.create(new CreateMatchRequest(
                "T20", null, null, null, null, "england", "india", null, null, null, null)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("india");
        assertThatThrownBy(() -> facade.create(request("T20", "india", 1L)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("battingFirst");
        assertThatThrownBy(() -> facade.create(new CreateMatchRequest(
                "T20", null, null, null, null, null, "england", null, null, null, null)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void unknownMatchIdsAreReported() {
        assertThatThrownBy(() -> facade.snapshot("m-missing"))
                .isInstanceOf(UnknownMatchException.class)
                .hasMessage("Unknown match m-missing");
        assertThatThrownBy(() -> facade.advance("m-missing", 6)).isInstanceOf(UnknownMatchException.class);
    }

    @Test
    void fastForwardReturnsTheNewSnapshot() {
        String id = facade.create(request("T20", "england", 3L)).matchId();

        AdvanceResponse six = facade.advance(id, 6);
        AdvanceResponse over = facade.advanceOver(id);

        assertThat(six.ballsBowled()).isEqualTo(6);
        assertThat(six.match().battingTeam()).isEqualTo("England");
        assertThat(over.ballsBowled()).isPositive();
        assertThat(facade.scorecard(id).innings()).hasSize(1);
    }

    @Test
    void limitedOversSidesCannotDeclare() {
        String id = facade.create(request("T20", "england", 3L)).matchId();
        facade.advance(id, 30);

        assertThatThrownBy(() -> facade.declare(id))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining(id);
    }

    @Test
    void tickerStateTransitions() {
        String id = facade.create(request("TEST", "england", 8L)).matchId();

        facade.start(id);
        assertThat(facade.status(id).state()).isEqualTo(RunnerState.RUNNING);
        facade.pause(id);
        assertThat(facade.status(id).state()).isEqualTo(RunnerState.PAUSED);
        facade.stop(id);
        assertThat(facade.status(id).state()).isEqualTo(RunnerState.STOPPED);

        facade.start(id);
        facade.pause(id);
        assertThat(facade.status(id).state()).isEqualTo(RunnerState.STOPPED);
    }

    @Test
    void finishedMatchesAreDone() {
        String id = facade.create(new CreateMatchRequest(
                "LIMITED_OVERS", 2, null, null, null, "england", "australia", "england", 4L, null, null)).matchId();

        while (!facade.snapshot(id).matchComplete()) {
            facade.advance(id, 60);
        }

        assertThat(facade.status(id).state()).isEqualTo(RunnerState.DONE);
        assertThat(facade.scorecard(id).result()).isNotNull();
    }

    @Test
    void statusesListMatchesOldestFirst() {
        String first = facade.create(request("T20", "england", 1L)).matchId();
        String second = facade.create(request("ODI", "australia", 2L)).matchId();

        assertThat(facade.statuses()).extracting(RunnerStatus::matchId).containsExactly(first, second);
    }

    @Test
    void squadsAreListedWithRatings() {
        assertThat(facade.squads()).extracting(SquadResponse::teamId).containsExactly("england", "australia");
        SquadResponse england = facade.squads().get(0);
        assertThat(england.players()).hasSize(14);
        assertThat(england.players()).anySatisfy(p -> {
            assertThat(p.playerId()).isEqualTo("eng-root");
            assertThat(p.role()).isEqualTo("BATSMAN");
            assertThat(p.batting()).isEqualTo(88);
        });
    }
}
