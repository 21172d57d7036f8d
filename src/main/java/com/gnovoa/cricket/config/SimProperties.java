package com.gnovoa.cricket.config;

import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Simulation tuning under {@code sim.*}. Any value left out of the configuration falls back to the
 * default documented on its record; {@link #defaults()} builds the all-default instance used
 * outside Spring.
 */
@ConfigurationProperties(prefix = "sim")
public record SimProperties(
        Integer tickMillis,
        Integer snapshotEveryBalls,
        Integer fastForwardBallCeiling,
        Squads squads,
        Feedback feedback,
        Spells spells,
        TestRules test,
        Wear wear) {

    public SimProperties {
        if (tickMillis == null) tickMillis = 1000;
        if (snapshotEveryBalls == null) snapshotEveryBalls = 30;
        if (fastForwardBallCeiling == null) fastForwardBallCeiling = 180;
        if (squads == null) squads = new Squads(null);
        if (feedback == null) feedback = new Feedback(null, null, null, null, null, null, null, null, null);
        if (spells == null) spells = new Spells(null, null, null, null, null, null, null, null, null, null, null, null, null);
        if (test == null) test = new TestRules(null, null, null, null, null);
        if (wear == null) wear = new Wear(null, null, null, null);
    }

    public static SimProperties defaults() {
        return new SimProperties(null, null, null, null, null, null, null, null);
    }

    /** Squad JSON files on the classpath, keyed by team id. */
    public record Squads(Map<String, String> files) {
        public Squads {
            if (files == null) files = new LinkedHashMap<>();
        }
    }

    /**
     * Confidence/fitness feedback loop. None of these are calibrated against real data; they are
     * tunables, not invariants.
     */
    public record Feedback(
            Integer wicketConfidenceLoss,
            Integer confidenceFloor,
            Integer wicketConfidenceGain,
            Integer boundaryConfidenceGain,
            Integer milestoneConfidenceGain,
            Integer fitnessDrainEveryBalls,
            Integer fitnessDrain,
            Integer fitnessFloor,
            Integer overnightRecovery) {

        public Feedback {
            if (wicketConfidenceLoss == null) wicketConfidenceLoss = 10;
            if (confidenceFloor == null) confidenceFloor = 20;
            if (wicketConfidenceGain == null) wicketConfidenceGain = 15;
            if (boundaryConfidenceGain == null) boundaryConfidenceGain = 5;
            if (milestoneConfidenceGain == null) milestoneConfidenceGain = 10;
            if (fitnessDrainEveryBalls == null) fitnessDrainEveryBalls = 18;
            if (fitnessDrain == null) fitnessDrain = 3;
            if (fitnessFloor == null) fitnessFloor = 50;
            if (overnightRecovery == null) overnightRecovery = 15;
            if (fitnessDrainEveryBalls <= 0) {
                throw new IllegalArgumentException("sim.feedback.fitness-drain-every-balls must be positive");
            }
        }
    }

    /** Bowler spell and rest limits, in overs. */
    public record Spells(
            Integer paceSpellLimit,
            Integer paceSpellMax,
            Integer spinSpellLimit,
            Integer spinSpellMax,
            Integer wicketsToExtend,
            Double economyToExtend,
            Integer fitnessFloor,
            Integer paceRestOvers,
            Integer spinRestOvers,
            Integer openingPhaseEnd,
            Integer firstChangePhaseEnd,
            Integer expensiveAfterOvers,
            Double expensiveEconomy) {

        public Spells {
            if (paceSpellLimit == null) paceSpellLimit = 8;
            if (paceSpellMax == null) paceSpellMax = 10;
            if (spinSpellLimit == null) spinSpellLimit = 12;
            if (spinSpellMax == null) spinSpellMax = 15;
            if (wicketsToExtend == null) wicketsToExtend = 2;
            if (economyToExtend == null) economyToExtend = 3.0;
            if (fitnessFloor == null) fitnessFloor = 60;
            if (paceRestOvers == null) paceRestOvers = 10;
            if (spinRestOvers == null) spinRestOvers = 5;
            if (openingPhaseEnd == null) openingPhaseEnd = 10;
            if (firstChangePhaseEnd == null) firstChangePhaseEnd = 25;
            if (expensiveAfterOvers == null) expensiveAfterOvers = 6;
            if (expensiveEconomy == null) expensiveEconomy = 5.5;
            if (paceSpellMax < paceSpellLimit || spinSpellMax < spinSpellLimit) {
                throw new IllegalArgumentException("Spell maximum must not be below the spell limit");
            }
        }
    }

    /** Multi-day match rules. */
    public record TestRules(
            Integer followOnDeficit,
            Integer declarationMinOvers,
            Integer firstInningsDeclarationScore,
            Integer thirdInningsDeclarationLead,
            Double overnightPitchWear) {

        public TestRules {
            if (followOnDeficit == null) followOnDeficit = 200;
            if (declarationMinOvers == null) declarationMinOvers = 60;
            if (firstInningsDeclarationScore == null) firstInningsDeclarationScore = 350;
            if (thirdInningsDeclarationLead == null) thirdInningsDeclarationLead = 300;
            if (overnightPitchWear == null) overnightPitchWear = 10.0;
        }
    }

    /** Pitch wear and dew growth per completed over. */
    public record Wear(
            Double limitedOversPerOver,
            Double multiDayPerOver,
            Double dewPerOver,
            Integer dewStartsAfterOver) {

        public Wear {
            if (limitedOversPerOver == null) limitedOversPerOver = 0.5;
            if (multiDayPerOver == null) multiDayPerOver = 0.2;
            if (dewPerOver == null) dewPerOver = 2.0;
            if (dewStartsAfterOver == null) dewStartsAfterOver = 10;
        }
    }
}
