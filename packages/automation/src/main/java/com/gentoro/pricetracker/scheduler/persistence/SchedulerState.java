package com.gentoro.pricetracker.scheduler.persistence;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Snapshot of all job descriptors and their most recent executions, keyed by job id. */
public record SchedulerState(
    @JsonProperty("jobs") Map<String, JobSnapshot> jobs,
    @JsonProperty("job_results") Map<String, List<ExecutionSnapshot>> jobResults) {

  public SchedulerState {
    jobs = jobs == null ? new LinkedHashMap<>() : jobs;
    jobResults = jobResults == null ? new LinkedHashMap<>() : jobResults;
  }

  public static SchedulerState empty() {
    return new SchedulerState(new LinkedHashMap<>(), new LinkedHashMap<>());
  }
}
