package com.gentoro.pricetracker.scheduler.persistence;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gentoro.pricetracker.scheduler.JobPriority;
import com.gentoro.pricetracker.scheduler.ScheduleType;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/** Persisted descriptor of a job. The executable body is never part of it. */
public record JobSnapshot(
    @JsonProperty("job_id") String jobId,
    @JsonProperty("name") String name,
    @JsonProperty("schedule_type") ScheduleType scheduleType,
    @JsonProperty("schedule_value") String scheduleValue,
    @JsonProperty("priority") JobPriority priority,
    @JsonProperty("max_retries") int maxRetries,
    @JsonProperty("retry_delay") long retryDelay,
    @JsonProperty("timeout_seconds") long timeoutSeconds,
    @JsonProperty("enabled") boolean enabled,
    @JsonProperty("last_run") Instant lastRun,
    @JsonProperty("next_run") Instant nextRun,
    @JsonProperty("run_count") long runCount,
    @JsonProperty("success_count") long successCount,
    @JsonProperty("failure_count") long failureCount,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("args") List<Object> args,
    @JsonProperty("kwargs") Map<String, Object> kwargs) {}
