package com.gnovoa.cricket.core;

import java.util.List;

/**
 * Immutable view of a match handed to observers (REST responses, event payloads).
 *
 * @param target runs needed to win in a chase; {@code null} otherwise
 * @param requiredRunRate {@code null} outside a limited-overs chase, once it is won, or with no balls left
 * @param projectedScore limited overs only; {@code null} before the first legal ball
 * @param winProbability chasing side's chance of winning, 0-100, in limited overs; {@code null} in a multi-day match
 * @param result {@code null} until the match is complete
 */
public record MatchSnapshot(
        String matchId,
        FormatKind format,
        int inningsNumber,
        String battingTeam,
        String bowlingTeam,
        int score,
        int wickets,
        String overs,
        String striker,
        String nonStriker,
        String bowler,
        Integer target,
        double runRate,
        Double requiredRunRate,
        Integer projectedScore,
        Integer winProbability,
        int day,
        int session,
        String status,
        boolean matchComplete,
        MatchResult result,
        List<InningsSummary> completedInnings
) {}
