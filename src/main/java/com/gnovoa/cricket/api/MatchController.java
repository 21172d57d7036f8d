package com.gnovoa.cricket.api;

import com.gnovoa.cricket.api.dto.AdvanceResponse;
import com.gnovoa.cricket.api.dto.CreateMatchRequest;
import com.gnovoa.cricket.api.dto.MatchCreatedResponse;
import com.gnovoa.cricket.api.dto.SquadResponse;
import com.gnovoa.cricket.core.MatchRuntime;
import com.gnovoa.cricket.core.MatchSnapshot;
import com.gnovoa.cricket.runner.RunnerFacade;
import com.gnovoa.cricket.runner.RunnerStatus;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api")
public class MatchController {

    private final RunnerFacade facade;

    public MatchController(RunnerFacade facade) {
        this.facade = facade;
    }

    @GetMapping("/squads")
    public List<SquadResponse> squads() {
        return facade.squads();
    }

    @PostMapping("/matches")
    public ResponseEntity<MatchCreatedResponse> create(@RequestBody CreateMatchRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(facade.create(request));
    }

    @GetMapping("/matches")
    public List<RunnerStatus> matches() {
        return facade.statuses();
    }

    @GetMapping("/matches/{matchId}")
    public MatchSnapshot snapshot(@PathVariable String matchId) {
        return facade.snapshot(matchId);
    }

    @GetMapping("/matches/{matchId}/status")
    public RunnerStatus status(@PathVariable String matchId) {
        return facade.status(matchId);
    }

    @GetMapping("/matches/{matchId}/scorecard")
    public MatchRuntime.Scorecard scorecard(@PathVariable String matchId) {
        return facade.scorecard(matchId);
    }

    @PostMapping("/matches/{matchId}/advance")
    public AdvanceResponse advance(@PathVariable String matchId, @RequestParam(defaultValue = "6") int balls) {
        return facade.advance(matchId, balls);
    }

    @PostMapping("/matches/{matchId}/advance-over")
    public AdvanceResponse advanceOver(@PathVariable String matchId) {
        return facade.advanceOver(matchId);
    }

    @PostMapping("/matches/{matchId}/advance-to-break")
    public AdvanceResponse advanceToBreak(@PathVariable String matchId) {
        return facade.advanceToBreak(matchId);
    }

    @PostMapping("/matches/{matchId}/declare")
    public MatchSnapshot declare(@PathVariable String matchId) {
        return facade.declare(matchId);
    }

    @PostMapping("/matches/{matchId}/start")
    public ResponseEntity<Void> start(@PathVariable String matchId) {
        facade.start(matchId);
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/matches/{matchId}/pause")
    public ResponseEntity<Void> pause(@PathVariable String matchId) {
        facade.pause(matchId);
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/matches/{matchId}/stop")
    public ResponseEntity<Void> stop(@PathVariable String matchId) {
        facade.stop(matchId); // immediate
        return ResponseEntity.accepted().build();
    }
}
