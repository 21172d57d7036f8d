package com.gnovoa.cricket.core;

/** Runs, wickets and overs across one day's play. */
public record DaySummary(int day, int runs, int wickets, String overs, String scoreAtStumps) {}
