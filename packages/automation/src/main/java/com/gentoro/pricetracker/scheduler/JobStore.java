package com.gentoro.pricetracker.scheduler;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/** Abstraction for storing registered jobs and their execution history. */
public interface JobStore {
  /** Insert or replace a job. Replacing starts a fresh, empty history. */
  void put(ScheduledJob job);

  Optional<ScheduledJob> get(String id);

  /** Remove a job together with its history. */
  Optional<ScheduledJob> remove(String id);

  Collection<ScheduledJob> all();

  void appendResult(String id, JobExecutionRecord record);

  /** Restore previously persisted records (oldest first) for a freshly registered job. */
  void restoreResults(String id, List<JobExecutionRecord> records);

  /** Up to {@code limit} most recent records, oldest first. */
  List<JobExecutionRecord> recentResults(String id, int limit);
}
