package com.gentoro.pricetracker.scheduler;

import java.time.Instant;

/** Aggregate execution statistics across all jobs. */
public record SchedulerHealthView(
    boolean schedulerRunning,
    int totalJobs,
    int enabledJobs,
    long totalExecutions,
    long totalSuccesses,
    long totalFailures,
    double overallSuccessRate,
    Instant uptimeStart,
    long unschedulableJobs) {}
