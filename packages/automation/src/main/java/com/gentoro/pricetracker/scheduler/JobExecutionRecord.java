package com.gentoro.pricetracker.scheduler;

import java.time.Duration;
import java.time.Instant;

/**
 * Outcome of one run of a job. Created as {@link JobStatus#RUNNING} when the run starts and
 * replaced by a finished copy through {@link #completed} or {@link #failed}.
 */
public record JobExecutionRecord(
    String jobId,
    JobStatus status,
    Instant startTime,
    Instant endTime,
    Double durationSeconds,
    Object resultData,
    String errorMessage,
    int executionCount) {

  public static JobExecutionRecord running(String jobId, Instant startTime, int executionCount) {
    return new JobExecutionRecord(
        jobId, JobStatus.RUNNING, startTime, null, null, null, null, executionCount);
  }

  public JobExecutionRecord completed(Instant end, Object result) {
    return new JobExecutionRecord(
        jobId,
        JobStatus.COMPLETED,
        startTime,
        end,
        secondsUntil(end),
        result,
        null,
        executionCount);
  }

  public JobExecutionRecord failed(Instant end, String error) {
    return new JobExecutionRecord(
        jobId, JobStatus.FAILED, startTime, end, secondsUntil(end), null, error, executionCount);
  }

  public boolean succeeded() {
    return status == JobStatus.COMPLETED;
  }

  private double secondsUntil(Instant end) {
    return Duration.between(startTime, end).toNanos() / 1_000_000_000.0;
  }
}
