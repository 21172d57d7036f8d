package com.gnovoa.cricket.conditions;

/**
 * @param paceEffectiveness multiplier on seamers' wicket threat
 * @param spinEffectiveness multiplier on spinners' wicket threat
 * @param staminaDrain multiplier on how fast bowlers tire
 */
public record WeatherModifiers(double paceEffectiveness, double spinEffectiveness, double staminaDrain) {}
