package com.gnovoa.cricket.api.dto;

import com.gnovoa.cricket.core.MatchFormat;

import java.util.List;
import java.util.Map;

public record MatchCreatedResponse(
        String matchId,
        MatchFormat format,
        String battingFirst,
        String bowlingFirst,
        String tossWinner,
        long seed,
        String conditions,
        List<String> battingFirstXI,
        List<String> bowlingFirstXI,
        Map<String, String> links
) {}
