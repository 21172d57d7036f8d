package com.gnovoa.cricket.conditions;

public record PitchModifiers(
        double dot,
        double single,
        double boundaries,
        double wickets,
        double paceEffectiveness,
        double spinEffectiveness) {}
