package com.gentoro.pricetracker.scheduler;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.pricetracker.scheduler.persistence.JsonFileSchedulerStateRepository;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JobSchedulerTest {

  @TempDir Path tempDir;

  private JobScheduler scheduler;

  @AfterEach
  void tearDown() {
    if (scheduler != null) {
      scheduler.close();
    }
  }

  private JobScheduler newScheduler(SchedulerSettings settings) {
    scheduler =
        new JobScheduler(settings, new JsonFileSchedulerStateRepository(settings.stateFile()));
    return scheduler;
  }

  private JobScheduler newScheduler() {
    return newScheduler(
        SchedulerSettings.defaults()
            .withTickInterval(Duration.ofMillis(100))
            .withStateFile(tempDir.resolve("state.json")));
  }

  private static JobDefinition.Builder job(String id, JobHandler handler) {
    return JobDefinition.builder(id, "Job " + id, handler)
        .schedule(ScheduleType.INTERVAL_SECONDS, 1)
        .timeout(Duration.ofSeconds(10));
  }

  private static void await(BooleanSupplier condition, Duration timeout) throws Exception {
    long deadline = System.nanoTime() + timeout.toNanos();
    while (!condition.getAsBoolean()) {
      if (System.nanoTime() > deadline) {
        fail("Condition not met within " + timeout);
      }
      Thread.sleep(20);
    }
  }

  private JobStatusView status(String id) {
    return scheduler.getJobStatus(id).orElseThrow();
  }

  @Test
  @DisplayName("A 1s interval job runs three or four times in 3.5 seconds")
  void intervalJobRunsOnCadence() throws Exception {
    JobScheduler s = newScheduler();
    s.addJob(job("tick", ctx -> "ok").build());
    s.start();
    Thread.sleep(3500);
    s.stop();

    JobStatusView view = status("tick");
    assertTrue(
        view.runCount() >= 3 && view.runCount() <= 4, "unexpected run count " + view.runCount());
    assertEquals(view.runCount(), view.successCount());
    assertEquals(0, view.failureCount());
    assertEquals(100.0, view.successRate());
  }

  @Test
  @DisplayName("An always failing 1s job fails three times in 3.4 seconds")
  void failuresAreRecorded() throws Exception {
    JobScheduler s = newScheduler();
    s.addJob(
        job(
                "fail",
                ctx -> {
                  throw new RuntimeException("scraper unavailable");
                })
            .build());
    s.start();
    Thread.sleep(3400);
    s.stop();

    JobStatusView view = status("fail");
    assertEquals(3, view.failureCount());
    assertEquals(0, view.successCount());
    assertEquals(3, view.runCount());
    assertEquals(3, view.recentResults().size());
    for (JobExecutionRecord r : view.recentResults()) {
      assertEquals(JobStatus.FAILED, r.status());
      assertEquals("scraper unavailable", r.errorMessage());
    }
  }

  @Test
  @DisplayName("addJob computes a next run; unparseable values leave it null")
  void nextRunOnRegistration() {
    JobScheduler s = newScheduler();
    Instant before = Instant.now();
    s.addJob(job("good", ctx -> null).schedule(ScheduleType.DAILY, "02:00").build());
    s.addJob(job("bad", ctx -> null).schedule(ScheduleType.DAILY, "2 o'clock").build());

    assertTrue(status("good").nextRun().isAfter(before));
    assertNull(status("good").scheduleError());
    assertNull(status("bad").nextRun());
    assertNotNull(status("bad").scheduleError());
    assertEquals(1, s.getSystemHealth().unschedulableJobs());
  }

  @Test
  @DisplayName("Pause is idempotent and resume recomputes a future next run")
  void pauseAndResume() throws Exception {
    JobScheduler s = newScheduler();
    s.addJob(job("p", ctx -> null).schedule(ScheduleType.INTERVAL_MINUTES, 5).build());

    assertTrue(s.pauseJob("p"));
    assertTrue(s.pauseJob("p"));
    assertFalse(status("p").enabled());

    Instant beforeResume = Instant.now();
    assertTrue(s.resumeJob("p"));
    JobStatusView resumed = status("p");
    assertTrue(resumed.enabled());
    assertTrue(resumed.nextRun().isAfter(beforeResume));
  }

  @Test
  @DisplayName("Paused jobs are not dispatched")
  void pausedJobsDoNotRun() throws Exception {
    JobScheduler s = newScheduler();
    s.addJob(job("p", ctx -> null).build());
    s.pauseJob("p");
    s.start();
    Thread.sleep(1500);
    s.stop();
    assertEquals(0, status("p").runCount());
  }

  @Test
  @DisplayName("Operations on unknown ids return false")
  void unknownIds() {
    JobScheduler s = newScheduler();
    assertFalse(s.pauseJob("nope"));
    assertFalse(s.resumeJob("nope"));
    assertFalse(s.removeJob("nope"));
    assertFalse(s.executeNow("nope"));
    assertTrue(s.getJobStatus("nope").isEmpty());
  }

  @Test
  @DisplayName("A job slower than its cadence never overlaps itself")
  void noOverlap() throws Exception {
    AtomicInteger concurrent = new AtomicInteger();
    AtomicInteger maxConcurrent = new AtomicInteger();
    JobScheduler s = newScheduler();
    s.addJob(
        job(
                "slow",
                ctx -> {
                  int now = concurrent.incrementAndGet();
                  maxConcurrent.accumulateAndGet(now, Math::max);
                  try {
                    Thread.sleep(1500);
                  } finally {
                    concurrent.decrementAndGet();
                  }
                  return null;
                })
            .build());
    s.start();
    await(() -> status("slow").executing(), Duration.ofSeconds(3));
    assertFalse(s.executeNow("slow"), "manual trigger must be refused while in flight");
    Thread.sleep(3000);
    s.stop();

    assertEquals(1, maxConcurrent.get());
  }

  @Test
  @DisplayName("executeNow runs the job without touching its next run")
  void executeNowKeepsNextRun() throws Exception {
    JobScheduler s = newScheduler();
    s.addJob(job("manual", ctx -> "done").schedule(ScheduleType.INTERVAL_MINUTES, 60).build());
    Instant nextRun = status("manual").nextRun();

    assertTrue(s.executeNow("manual"));
    await(() -> status("manual").runCount() == 1, Duration.ofSeconds(3));

    JobStatusView view = status("manual");
    assertEquals(nextRun, view.nextRun());
    assertNotNull(view.lastRun());
    assertEquals("done", view.recentResults().get(0).resultData());
  }

  @Test
  @DisplayName("A result finishing after stop is discarded")
  void resultAfterStopIsDiscarded() throws Exception {
    JobScheduler s = newScheduler();
    s.addJob(
        job(
                "late",
                ctx -> {
                  Thread.sleep(1500);
                  return "late";
                })
            .build());
    s.start();
    await(() -> status("late").executing(), Duration.ofSeconds(3));
    s.stop();
    await(() -> !status("late").executing(), Duration.ofSeconds(3));

    JobStatusView view = status("late");
    assertEquals(0, view.runCount());
    assertNull(view.lastRun());
    assertTrue(view.recentResults().isEmpty());
  }

  @Test
  @DisplayName("A result of a replaced registration does not count for the new one")
  void resultOfReplacedRegistrationIsDiscarded() throws Exception {
    JobScheduler s = newScheduler();
    s.addJob(
        job(
                "swap",
                ctx -> {
                  Thread.sleep(1000);
                  return "old";
                })
            .schedule(ScheduleType.HOURLY, "")
            .build());
    assertTrue(s.executeNow("swap"));
    await(() -> status("swap").executing(), Duration.ofSeconds(3));

    s.addJob(job("swap", ctx -> "new").schedule(ScheduleType.HOURLY, "").build());
    await(() -> !status("swap").executing(), Duration.ofSeconds(3));

    JobStatusView view = status("swap");
    assertEquals(0, view.runCount());
    assertEquals(0, view.successCount());
    assertEquals(0, view.failureCount());
    assertTrue(view.recentResults().isEmpty());
  }

  @Test
  @DisplayName("History keeps only the latest N records, oldest evicted first")
  void historyIsBounded() throws Exception {
    JobScheduler s =
        newScheduler(
            SchedulerSettings.defaults()
                .withHistorySize(3)
                .withStateFile(tempDir.resolve("state.json")));
    s.addJob(job("h", ctx -> ctx.executionCount()).schedule(ScheduleType.HOURLY, "").build());

    for (int i = 1; i <= 5; i++) {
      int expected = i;
      assertTrue(s.executeNow("h"));
      await(
          () -> status("h").runCount() == expected && !status("h").executing(),
          Duration.ofSeconds(3));
    }

    List<JobExecutionRecord> recent = status("h").recentResults();
    assertEquals(3, recent.size());
    assertEquals(
        List.of(3, 4, 5), recent.stream().map(JobExecutionRecord::executionCount).toList());
    assertEquals(5, status("h").runCount());
  }

  @Test
  @DisplayName("Re-adding an id overwrites the job and resets its counters")
  void overwriteResetsCounters() throws Exception {
    JobScheduler s = newScheduler();
    s.addJob(job("o", ctx -> null).schedule(ScheduleType.HOURLY, "").build());
    s.executeNow("o");
    await(() -> status("o").runCount() == 1, Duration.ofSeconds(3));

    s.addJob(
        job("o", ctx -> null)
            .schedule(ScheduleType.INTERVAL_MINUTES, 10)
            .priority(JobPriority.HIGH)
            .build());

    JobStatusView view = status("o");
    assertEquals(0, view.runCount());
    assertEquals(JobPriority.HIGH, view.priority());
    assertEquals(ScheduleType.INTERVAL_MINUTES, view.scheduleType());
    assertTrue(view.recentResults().isEmpty());
    assertEquals(1, s.getAllJobsStatus().totalJobs());
  }

  @Test
  @DisplayName("removeJob deletes the job and its history")
  void removeJob() {
    JobScheduler s = newScheduler();
    s.addJob(job("r", ctx -> null).build());
    assertTrue(s.removeJob("r"));
    assertTrue(s.getJobStatus("r").isEmpty());
    assertEquals(0, s.getAllJobsStatus().totalJobs());
  }

  @Test
  @DisplayName("Status lists jobs by priority and reports retry settings")
  void statusOrderingAndMetadata() {
    JobScheduler s = newScheduler();
    s.addJob(job("low", ctx -> null).priority(JobPriority.LOW).build());
    s.addJob(
        job("crit", ctx -> null)
            .priority(JobPriority.CRITICAL)
            .maxRetries(2)
            .retryDelay(Duration.ofSeconds(30))
            .enabled(false)
            .build());

    SchedulerStatusView all = s.getAllJobsStatus();
    assertEquals(2, all.totalJobs());
    assertEquals(1, all.enabledJobs());
    assertFalse(all.running());
    assertEquals(List.of("crit", "low"), List.copyOf(all.jobs().keySet()));
    assertEquals(2, all.jobs().get("crit").maxRetries());
    assertEquals(30, all.jobs().get("crit").retryDelaySeconds());
  }

  @Test
  @DisplayName("Second start only warns; stop ends the loop")
  void startTwiceAndStop() {
    JobScheduler s = newScheduler();
    s.start();
    s.start();
    assertTrue(s.isRunning());
    assertTrue(s.getSystemHealth().schedulerRunning());
    s.stop();
    assertFalse(s.isRunning());
    s.stop();
  }
}
