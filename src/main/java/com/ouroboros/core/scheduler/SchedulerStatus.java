package com.ouroboros.core.scheduler;

import java.time.Instant;

/**
 * Point-in-time view of the scheduler, for the status command and health checks.
 */
public record SchedulerStatus(
    boolean running,
    boolean idle,
    long idleSeconds,
    boolean cycleInProgress,
    long cooldownRemainingSeconds,
    Instant lastActivity,
    Instant lastAttempt
) {}
