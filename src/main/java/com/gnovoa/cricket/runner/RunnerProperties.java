package com.gnovoa.cricket.runner;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Hosting options under {@code runner.*}.
 *
 * @param ballsPerTick deliveries bowled per ticker tick
 * @param autoStartDemoOnBoot create and start a match between the first two squads at startup
 * @param demoFormat {@code T20}, {@code ODI} or {@code TEST}
 * @param autoDeclare let the engine declare once the declaration window opens
 * @param autoFollowOn let the engine enforce the follow-on whenever it is available
 */
@ConfigurationProperties(prefix = "runner")
public record RunnerProperties(
        Integer ballsPerTick,
        Boolean autoStartDemoOnBoot,
        String demoFormat,
        Boolean autoDeclare,
        Boolean autoFollowOn
) {
    public RunnerProperties {
        if (ballsPerTick == null) ballsPerTick = 1;
        if (ballsPerTick <= 0) throw new IllegalArgumentException("runner.balls-per-tick must be positive");
        if (autoStartDemoOnBoot == null) autoStartDemoOnBoot = false;
        if (demoFormat == null) demoFormat = "T20";
        if (autoDeclare == null) autoDeclare = true;
        if (autoFollowOn == null) autoFollowOn = true;
    }
}
