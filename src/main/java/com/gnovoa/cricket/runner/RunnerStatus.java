package com.gnovoa.cricket.runner;

import com.gnovoa.cricket.core.MatchFormat;

import java.util.Map;

public record RunnerStatus(
        String matchId,
        RunnerState state,
        MatchFormat format,
        String battingFirst,
        String bowlingFirst,
        long seed,
        String statusText,
        Map<String, String> links
) {}
