package com.gentoro.pricetracker.scheduler;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;

/** Bounded, oldest-first history of execution records for one job. Thread-safe. */
final class ExecutionHistory {
  private final int capacity;
  private final Deque<JobExecutionRecord> records;

  ExecutionHistory(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive: " + capacity);
    }
    this.capacity = capacity;
    this.records = new ArrayDeque<>(capacity);
  }

  synchronized void add(JobExecutionRecord record) {
    if (records.size() == capacity) {
      records.removeFirst();
    }
    records.addLast(record);
  }

  synchronized void addAll(Collection<JobExecutionRecord> restored) {
    restored.forEach(this::add);
  }

  /** Up to {@code limit} most recent records, oldest first. */
  synchronized List<JobExecutionRecord> recent(int limit) {
    List<JobExecutionRecord> all = new ArrayList<>(records);
    return all.subList(Math.max(0, all.size() - limit), all.size());
  }

  synchronized List<JobExecutionRecord> all() {
    return new ArrayList<>(records);
  }

  synchronized int size() {
    return records.size();
  }
}
