package com.gnovoa.cricket.events;

import com.gnovoa.cricket.core.MatchSnapshot;

import java.time.Instant;
import java.util.Map;

public record MatchEvent(
        String matchId,
        Instant occurredAt,
        MatchSnapshot match,
        CricketEventType type,
        Map<String, Object> data
) {}
