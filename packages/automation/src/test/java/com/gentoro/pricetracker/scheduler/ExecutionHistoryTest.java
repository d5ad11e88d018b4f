package com.gentoro.pricetracker.scheduler;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ExecutionHistoryTest {

  private static JobExecutionRecord record(int n) {
    Instant start = Instant.parse("2024-06-01T00:00:00Z").plusSeconds(n);
    return JobExecutionRecord.running("j", start, n).completed(start.plusMillis(250), n);
  }

  @Test
  @DisplayName("N + k additions keep exactly the latest N in order")
  void evictsOldestFirst() {
    ExecutionHistory history = new ExecutionHistory(4);
    for (int i = 1; i <= 7; i++) {
      history.add(record(i));
    }
    assertEquals(4, history.size());
    assertEquals(
        List.of(4, 5, 6, 7),
        history.all().stream()
            .map(JobExecutionRecord::executionCount)
            .collect(Collectors.toList()));
    assertEquals(
        List.of(6, 7),
        history.recent(2).stream()
            .map(JobExecutionRecord::executionCount)
            .collect(Collectors.toList()));
    assertEquals(4, history.recent(10).size());
  }

  @Test
  @DisplayName("Finished records carry end time and duration")
  void recordDuration() {
    JobExecutionRecord r = record(1);
    assertEquals(JobStatus.COMPLETED, r.status());
    assertEquals(0.25, r.durationSeconds(), 1e-9);
    assertTrue(r.succeeded());
  }

  @Test
  @DisplayName("Capacity must be positive")
  void rejectsZeroCapacity() {
    assertThrows(IllegalArgumentException.class, () -> new ExecutionHistory(0));
  }
}
