package com.gentoro.pricetracker.scheduler.persistence;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gentoro.pricetracker.scheduler.JobExecutionRecord;
import com.gentoro.pricetracker.scheduler.JobStatus;
import com.gentoro.pricetracker.utility.JacksonUtility;
import java.time.Instant;

/** Persisted form of a {@link JobExecutionRecord}. */
public record ExecutionSnapshot(
    @JsonProperty("status") JobStatus status,
    @JsonProperty("start_time") Instant startTime,
    @JsonProperty("end_time") Instant endTime,
    @JsonProperty("duration_seconds") Double durationSeconds,
    @JsonProperty("result_data") Object resultData,
    @JsonProperty("error_message") String errorMessage,
    @JsonProperty("execution_count") int executionCount) {

  public static ExecutionSnapshot of(JobExecutionRecord record) {
    return new ExecutionSnapshot(
        record.status(),
        record.startTime(),
        record.endTime(),
        record.durationSeconds(),
        JacksonUtility.toJsonSafe(record.resultData()),
        record.errorMessage(),
        record.executionCount());
  }

  public JobExecutionRecord toRecord(String jobId) {
    return new JobExecutionRecord(
        jobId,
        status,
        startTime,
        endTime,
        durationSeconds,
        resultData,
        errorMessage,
        executionCount);
  }
}
