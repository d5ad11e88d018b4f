package com.gentoro.pricetracker.scheduler;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** In-memory JobStore keeping a ring buffer of the latest {@code historySize} records per job. */
public final class InMemoryJobStore implements JobStore {
  private final Map<String, ScheduledJob> jobs = new ConcurrentHashMap<>();
  private final Map<String, ExecutionHistory> results = new ConcurrentHashMap<>();
  private final int historySize;

  public InMemoryJobStore(int historySize) {
    this.historySize = historySize;
  }

  @Override
  public void put(ScheduledJob job) {
    jobs.put(job.id(), job);
    results.put(job.id(), new ExecutionHistory(historySize));
  }

  @Override
  public Optional<ScheduledJob> get(String id) {
    return Optional.ofNullable(jobs.get(id));
  }

  @Override
  public Optional<ScheduledJob> remove(String id) {
    results.remove(id);
    return Optional.ofNullable(jobs.remove(id));
  }

  @Override
  public Collection<ScheduledJob> all() {
    return new ArrayList<>(jobs.values());
  }

  @Override
  public void appendResult(String id, JobExecutionRecord record) {
    ExecutionHistory history = results.get(id);
    if (history != null) {
      history.add(record);
    }
  }

  @Override
  public void restoreResults(String id, List<JobExecutionRecord> records) {
    ExecutionHistory history = results.get(id);
    if (history != null) {
      history.addAll(records);
    }
  }

  @Override
  public List<JobExecutionRecord> recentResults(String id, int limit) {
    ExecutionHistory history = results.get(id);
    return history == null ? List.of() : history.recent(limit);
  }
}
