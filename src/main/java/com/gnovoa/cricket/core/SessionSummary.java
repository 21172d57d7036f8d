package com.gnovoa.cricket.core;

/**
 * One completed session of a multi-day match.
 *
 * @param overs overs bowled in the session
 * @param scoreAtClose batting side's score line when the session closed
 */
public record SessionSummary(int day, int session, int runs, int wickets, String overs, String scoreAtClose) {}
