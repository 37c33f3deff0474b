package com.routergen.config;

import java.time.Duration;

/**
 * Cooldown, demotion and disable thresholds for the BackendPool.
 */
public final class PoolSettings {

    public enum Strategy { WEIGHTED, ROUND_ROBIN }

    private final Duration rateLimitCooldown;
    private final Duration maxCooldown;
    private final int      demotionThreshold;
    private final int      authFailureLimit;
    private final Duration acquireTimeout;
    private final Strategy strategy;

    public PoolSettings(
            Duration rateLimitCooldown,
            Duration maxCooldown,
            int      demotionThreshold,
            int      authFailureLimit,
            Duration acquireTimeout,
            Strategy strategy
    ) {
        if (demotionThreshold < 1) {
            throw new IllegalArgumentException("demotionThreshold must be >= 1");
        }
        if (authFailureLimit < 1) {
            throw new IllegalArgumentException("authFailureLimit must be >= 1");
        }
        this.rateLimitCooldown = rateLimitCooldown;
        this.maxCooldown       = maxCooldown.compareTo(rateLimitCooldown) < 0 ? rateLimitCooldown : maxCooldown;
        this.demotionThreshold = demotionThreshold;
        this.authFailureLimit  = authFailureLimit;
        this.acquireTimeout    = acquireTimeout;
        this.strategy          = strategy;
    }

    public static PoolSettings defaults() {
        return new PoolSettings(
                Duration.ofSeconds(2), Duration.ofSeconds(60), 3, 3, Duration.ofMinutes(2), Strategy.WEIGHTED);
    }

    public Duration getRateLimitCooldown() { return rateLimitCooldown; }
    public Duration getMaxCooldown()       { return maxCooldown; }
    public int      getDemotionThreshold() { return demotionThreshold; }
    public int      getAuthFailureLimit()  { return authFailureLimit; }
    public Duration getAcquireTimeout()    { return acquireTimeout; }
    public Strategy getStrategy()          { return strategy; }
}
