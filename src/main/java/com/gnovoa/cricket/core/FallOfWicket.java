package com.gnovoa.cricket.core;

/**
 * @param batter dismissed batter
 * @param score team total when the wicket fell
 * @param wicketNumber 1-10
 * @param over overs bowled at the fall, e.g. "12.4"
 */
public record FallOfWicket(String batter, int score, int wicketNumber, String over) {}
