package com.gentoro.pricetracker.monitor;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.pricetracker.utility.JacksonUtility;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.Deque;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SystemMonitorTest {

  @TempDir Path tempDir;

  private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");
  private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

  private static MetricsSample sample(double heap, double disk, double cpu) {
    return new MetricsSample(NOW, heap, 512, disk, 20, cpu, 42);
  }

  /** Probe returning queued samples, repeating the last one. */
  private static final class QueuedProbe implements SystemProbe {
    private final Deque<MetricsSample> queue = new ArrayDeque<>();
    private MetricsSample last;

    QueuedProbe add(MetricsSample s) {
      queue.add(s);
      return this;
    }

    @Override
    public MetricsSample sample(Instant now) {
      if (!queue.isEmpty()) {
        last = queue.poll();
      }
      return last;
    }
  }

  @Test
  @DisplayName("Built-in checks classify disk, memory and cpu against the thresholds")
  void builtInChecks() {
    SystemMonitor monitor =
        new SystemMonitor(
            MonitorSettings.defaults(), new QueuedProbe().add(sample(85, 97, 10)), clock);
    monitor.refresh();

    HealthStatus health = monitor.getHealthStatus();
    assertEquals(HealthState.CRITICAL, health.overallStatus());
    assertEquals(HealthState.CRITICAL, health.checks().get(SystemMonitor.DISK_CHECK).status());
    assertEquals(HealthState.WARNING, health.checks().get(SystemMonitor.MEMORY_CHECK).status());
    assertEquals(HealthState.HEALTHY, health.checks().get(SystemMonitor.CPU_CHECK).status());
    assertEquals(1, health.criticalIssues().size());
    assertEquals("Critically low disk space (3.0% free)", health.criticalIssues().get(0));
    assertEquals("High memory usage (85.0%)", health.warnings().get(0));
  }

  @Test
  @DisplayName("Missing load average is reported as unknown and does not degrade health")
  void cpuUnavailable() {
    SystemMonitor monitor =
        new SystemMonitor(
            MonitorSettings.defaults(), new QueuedProbe().add(sample(10, 10, -1)), clock);
    monitor.refresh();

    HealthStatus health = monitor.getHealthStatus();
    assertEquals(HealthState.UNKNOWN, health.checks().get(SystemMonitor.CPU_CHECK).status());
    assertEquals(HealthState.HEALTHY, health.overallStatus());
  }

  @Test
  @DisplayName("Sampling failures mark the built-in checks unknown")
  void samplingFailure() {
    SystemProbe failing =
        now -> {
          throw new IOException("no such file store");
        };
    SystemMonitor monitor = new SystemMonitor(MonitorSettings.defaults(), failing, clock);
    monitor.refresh();

    HealthCheckResult disk = monitor.getHealthStatus().checks().get(SystemMonitor.DISK_CHECK);
    assertEquals(HealthState.UNKNOWN, disk.status());
    assertTrue(disk.message().contains("no such file store"));
    assertTrue(monitor.getCurrentMetrics().isEmpty());
    assertTrue(monitor.getPerformanceMetrics().isEmpty());
  }

  @Test
  @DisplayName("A custom check that throws is recorded as critical")
  void customCheckFailure() {
    SystemMonitor monitor =
        new SystemMonitor(
            MonitorSettings.defaults(), new QueuedProbe().add(sample(10, 10, 10)), clock);
    monitor.addHealthCheck(
        "database",
        () -> {
          throw new IllegalStateException("connection refused");
        });
    monitor.refresh();

    HealthStatus health = monitor.getHealthStatus();
    assertEquals(HealthState.CRITICAL, health.overallStatus());
    assertEquals(
        "Custom check failed: connection refused", health.checks().get("database").message());
  }

  @Test
  @DisplayName("Performance metrics summarize the retained samples")
  void performanceSummary() {
    QueuedProbe probe =
        new QueuedProbe().add(sample(10, 50, 20)).add(sample(30, 50, 40)).add(sample(20, 50, 60));
    SystemMonitor monitor = new SystemMonitor(MonitorSettings.defaults(), probe, clock);
    monitor.refresh();
    monitor.refresh();
    monitor.refresh();

    PerformanceMetrics metrics = monitor.getPerformanceMetrics().orElseThrow();
    assertEquals(20, metrics.current().heapUsedPercent());
    MetricsSummary hour = metrics.lastHour();
    assertEquals(3, hour.dataPoints());
    assertEquals(20.0, hour.heap().avg(), 1e-9);
    assertEquals(10.0, hour.heap().min(), 1e-9);
    assertEquals(30.0, hour.heap().max(), 1e-9);
    assertEquals(40.0, hour.cpu().avg(), 1e-9);
    assertEquals(42, hour.latestThreadCount());
    assertEquals(3, metrics.last24Hours().dataPoints());
  }

  @Test
  @DisplayName("History is bounded by the retention window")
  void historyBounded() {
    MonitorSettings oneHour =
        new MonitorSettings(Duration.ofSeconds(60), 1, Path.of("."), 15, 5, 80, 90, 80, 90);
    SystemMonitor monitor =
        new SystemMonitor(oneHour, new QueuedProbe().add(sample(10, 10, 10)), clock);
    for (int i = 0; i < 70; i++) {
      monitor.refresh();
    }
    assertEquals(60, monitor.getMetricsSummary(24).orElseThrow().dataPoints());
  }

  @Test
  @DisplayName("exportMetrics writes samples, health and performance as JSON")
  void exportMetrics() throws Exception {
    SystemMonitor monitor =
        new SystemMonitor(
            MonitorSettings.defaults(), new QueuedProbe().add(sample(10, 10, 10)), clock);
    monitor.refresh();
    monitor.refresh();

    Path file = tempDir.resolve("exports").resolve("metrics.json");
    assertEquals(2, monitor.exportMetrics(file, 24));

    JsonNode root = JacksonUtility.getJsonMapper().readTree(file.toFile());
    assertEquals(2, root.path("total_metrics").asInt());
    assertEquals(24, root.path("time_period_hours").asInt());
    assertEquals("healthy", root.path("health_status").path("overall_status").asText());
    assertEquals(2, root.path("metrics").size());
  }

  @Test
  @DisplayName("start samples in the background until stop")
  void startAndStop() throws Exception {
    SystemMonitor monitor =
        new SystemMonitor(
            MonitorSettings.defaults().withSampleInterval(Duration.ofMillis(50)),
            new QueuedProbe().add(sample(10, 10, 10)),
            Clock.systemUTC());
    monitor.start();
    monitor.start();
    long deadline = System.nanoTime() + Duration.ofSeconds(3).toNanos();
    while (monitor.getCurrentMetrics().isEmpty() && System.nanoTime() < deadline) {
      Thread.sleep(20);
    }
    monitor.stop();
    assertTrue(monitor.getCurrentMetrics().isPresent());
    assertEquals(HealthState.HEALTHY, monitor.getHealthStatus().overallStatus());
    monitor.stop();
  }
}
