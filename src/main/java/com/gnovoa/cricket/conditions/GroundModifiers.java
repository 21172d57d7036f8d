package com.gnovoa.cricket.conditions;

public record GroundModifiers(double six, double four, double twoRuns, double threeRuns) {}
