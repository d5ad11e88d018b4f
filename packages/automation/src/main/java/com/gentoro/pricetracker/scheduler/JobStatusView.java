package com.gentoro.pricetracker.scheduler;

import java.time.Instant;
import java.util.List;

/** Read-only view of one job, including its most recent executions (oldest first). */
public record JobStatusView(
    String jobId,
    String name,
    boolean enabled,
    boolean executing,
    ScheduleType scheduleType,
    String scheduleValue,
    String scheduleError,
    JobPriority priority,
    int maxRetries,
    long retryDelaySeconds,
    long timeoutSeconds,
    Instant createdAt,
    Instant lastRun,
    Instant nextRun,
    long runCount,
    long successCount,
    long failureCount,
    double successRate,
    List<JobExecutionRecord> recentResults) {}
