package com.gentoro.pricetracker.scheduler;

import java.time.Instant;

/**
 * Internal in-memory representation of a registered job and its statistics. Package-private;
 * every mutable field is read and written under the {@link JobScheduler} lock.
 */
final class ScheduledJob {
  final JobDefinition definition;
  // Distinguishes this registration from earlier/later ones with the same id
  final long generation;
  final Instant createdAt;
  // null when the schedule value could not be parsed
  final Schedule schedule;
  final String scheduleError;

  boolean enabled;
  Instant lastRun;
  Instant nextRun;
  long runCount;
  long successCount;
  long failureCount;

  ScheduledJob(
      JobDefinition definition,
      long generation,
      Instant createdAt,
      Schedule schedule,
      String scheduleError) {
    this.definition = definition;
    this.generation = generation;
    this.createdAt = createdAt;
    this.schedule = schedule;
    this.scheduleError = scheduleError;
    this.enabled = definition.enabled();
  }

  String id() {
    return definition.jobId();
  }

  double successRate() {
    return runCount > 0 ? successCount * 100.0 / runCount : 0.0;
  }
}
