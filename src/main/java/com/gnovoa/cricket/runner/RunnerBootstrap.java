package com.gnovoa.cricket.runner;

import com.gnovoa.cricket.api.dto.CreateMatchRequest;
import com.gnovoa.cricket.api.dto.MatchCreatedResponse;
import com.gnovoa.cricket.model.Squad;
import com.gnovoa.cricket.rosters.SquadCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;

/** Optionally starts a demo match between the first two configured squads once the app is up. */
@Component
public final class RunnerBootstrap {

    private static final Logger log = LoggerFactory.getLogger(RunnerBootstrap.class);

    private final RunnerProperties props;
    private final SquadCatalog squads;
    private final RunnerFacade facade;

    public RunnerBootstrap(RunnerProperties props, SquadCatalog squads, RunnerFacade facade) {
        this.props = props;
        this.squads = squads;
        this.facade = facade;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        if (!props.autoStartDemoOnBoot()) return;
        List<Squad> all = squads.squads();
        if (all.size() < 2) {
            log.warn("Demo match skipped: {} squad(s) configured, two needed", all.size());
            return;
        }
        MatchCreatedResponse demo = facade.create(new CreateMatchRequest(
                props.demoFormat(), null, null, null, null,
                all.get(0).teamId(), all.get(1).teamId(), null, null, null, true));
        log.info("Demo match {} started: {} v {}, events on {}",
                demo.matchId(), demo.battingFirst(), demo.bowlingFirst(), demo.links().get("events"));
    }
}
