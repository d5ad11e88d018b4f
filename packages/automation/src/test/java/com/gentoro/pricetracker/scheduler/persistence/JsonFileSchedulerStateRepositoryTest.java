package com.gentoro.pricetracker.scheduler.persistence;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.pricetracker.exception.PersistenceException;
import com.gentoro.pricetracker.scheduler.JobPriority;
import com.gentoro.pricetracker.scheduler.JobStatus;
import com.gentoro.pricetracker.scheduler.ScheduleType;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonFileSchedulerStateRepositoryTest {

  @TempDir Path tempDir;

  @Test
  @DisplayName("Missing file loads as empty")
  void missingFile() {
    var repo = new JsonFileSchedulerStateRepository(tempDir.resolve("absent.json"));
    assertTrue(repo.load().isEmpty());
  }

  @Test
  @DisplayName("Saved state reads back, and no temp file is left behind")
  void saveAndLoad() throws Exception {
    Path file = tempDir.resolve("nested").resolve("state.json");
    var repo = new JsonFileSchedulerStateRepository(file);
    Instant created = Instant.parse("2024-06-01T10:00:00Z");

    SchedulerState state = SchedulerState.empty();
    state
        .jobs()
        .put(
            "main_tracking",
            new JobSnapshot(
                "main_tracking",
                "Main Price Tracking",
                ScheduleType.INTERVAL_MINUTES,
                "60",
                JobPriority.HIGH,
                2,
                60,
                1800,
                true,
                created,
                created.plusSeconds(3600),
                4,
                3,
                1,
                created,
                List.of(),
                Map.of()));
    state
        .jobResults()
        .put(
            "main_tracking",
            List.of(
                new ExecutionSnapshot(
                    JobStatus.FAILED, created, created.plusSeconds(2), 2.0, null, "timeout", 4)));
    repo.save(state);

    assertTrue(Files.exists(file));
    assertFalse(Files.exists(file.resolveSibling("state.json.tmp")));

    SchedulerState loaded = repo.load().orElseThrow();
    JobSnapshot job = loaded.jobs().get("main_tracking");
    assertEquals(ScheduleType.INTERVAL_MINUTES, job.scheduleType());
    assertEquals(JobPriority.HIGH, job.priority());
    assertEquals(created.plusSeconds(3600), job.nextRun());
    assertEquals(4, job.runCount());
    ExecutionSnapshot result = loaded.jobResults().get("main_tracking").get(0);
    assertEquals(JobStatus.FAILED, result.status());
    assertEquals("timeout", result.errorMessage());
    assertEquals(
        "main_tracking", result.toRecord("main_tracking").jobId());
  }

  @Test
  @DisplayName("Unreadable content raises a PersistenceException")
  void corruptFile() throws Exception {
    Path file = tempDir.resolve("state.json");
    Files.writeString(file, "[1, 2");
    var repo = new JsonFileSchedulerStateRepository(file);
    assertThrows(PersistenceException.class, repo::load);
  }
}
