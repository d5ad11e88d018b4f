package com.gentoro.pricetracker.monitor;

import com.gentoro.pricetracker.exception.ExceptionUtil;
import com.gentoro.pricetracker.exception.PersistenceException;
import com.gentoro.pricetracker.logging.LoggingService;
import com.gentoro.pricetracker.utility.JacksonUtility;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;

/**
 * Default {@link Monitor}: samples JVM heap, disk usage and system load on a background thread
 * and evaluates the built-in {@code disk_space}, {@code memory_usage} and {@code cpu_load}
 * checks plus any registered custom checks.
 */
public class SystemMonitor implements Monitor {
  private static final Logger log = LoggingService.getLogger(SystemMonitor.class);

  public static final String DISK_CHECK = "disk_space";
  public static final String MEMORY_CHECK = "memory_usage";
  public static final String CPU_CHECK = "cpu_load";

  private final MonitorSettings settings;
  private final SystemProbe probe;
  private final Clock clock;

  private final Deque<MetricsSample> history = new ArrayDeque<>();
  private final Map<String, HealthCheckResult> results = new LinkedHashMap<>();
  private final Map<String, HealthCheck> customChecks = new LinkedHashMap<>();
  private ScheduledExecutorService sampler;

  public SystemMonitor(MonitorSettings settings) {
    this(settings, SystemProbe.jvm(settings.diskPath()), Clock.systemUTC());
  }

  public SystemMonitor(MonitorSettings settings, SystemProbe probe, Clock clock) {
    this.settings = settings;
    this.probe = probe;
    this.clock = clock;
  }

  @Override
  public synchronized void start() {
    if (sampler != null) {
      log.warn("Monitoring is already running");
      return;
    }
    sampler =
        Executors.newSingleThreadScheduledExecutor(
            r -> {
              Thread t = new Thread(r, "system-monitor");
              t.setDaemon(true);
              return t;
            });
    long period = Math.max(1, settings.sampleInterval().toMillis());
    sampler.scheduleWithFixedDelay(this::safeRefresh, 0, period, TimeUnit.MILLISECONDS);
    log.info("System monitoring started (every {})", settings.sampleInterval());
  }

  @Override
  public void stop() {
    ScheduledExecutorService current;
    synchronized (this) {
      current = sampler;
      sampler = null;
    }
    if (current == null) {
      return;
    }
    current.shutdownNow();
    try {
      if (!current.awaitTermination(5, TimeUnit.SECONDS)) {
        log.warn("Monitoring thread did not terminate in time");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    log.info("System monitoring stopped");
  }

  private void safeRefresh() {
    try {
      refresh();
    } catch (RuntimeException e) {
      log.error("Error in monitoring loop: {}", e.getMessage(), e);
    }
  }

  /** Take a sample and evaluate every check now. */
  public void refresh() {
    Instant now = clock.instant();
    MetricsSample sample = null;
    String sampleError = null;
    try {
      sample = probe.sample(now);
    } catch (Exception e) {
      sampleError = ExceptionUtil.extractErrorMessage(e);
      log.warn("Could not sample system metrics: {}", sampleError);
    }

    Map<String, HealthCheckResult> fresh = new LinkedHashMap<>();
    if (sample != null) {
      fresh.put(DISK_CHECK, checkDisk(sample));
      fresh.put(MEMORY_CHECK, checkMemory(sample));
      fresh.put(CPU_CHECK, checkCpu(sample));
    } else {
      String message = "Could not sample system metrics: " + sampleError;
      for (String name : List.of(DISK_CHECK, MEMORY_CHECK, CPU_CHECK)) {
        fresh.put(
            name,
            new HealthCheckResult(
                name, HealthState.UNKNOWN, message, now, null, Map.of("error", sampleError)));
      }
    }

    Map<String, HealthCheck> custom;
    synchronized (this) {
      custom = new LinkedHashMap<>(customChecks);
    }
    custom.forEach((name, check) -> fresh.put(name, evaluate(name, check)));

    synchronized (this) {
      if (sample != null) {
        history.addLast(sample);
        while (history.size() > settings.historyCapacity()) {
          history.removeFirst();
        }
      }
      results.putAll(fresh);
    }
  }

  @Override
  public void addHealthCheck(String name, HealthCheck check) {
    HealthCheckResult result = evaluate(name, check);
    synchronized (this) {
      customChecks.put(name, check);
      results.put(name, result);
    }
    log.info("Added custom health check: {}", name);
  }

  private HealthCheckResult evaluate(String name, HealthCheck check) {
    long started = System.nanoTime();
    try {
      HealthCheckResult result = check.check();
      if (result == null) {
        return HealthCheckResult.of(
            name, HealthState.UNKNOWN, "Health check returned no result", clock.instant());
      }
      return result;
    } catch (Exception e) {
      String message = ExceptionUtil.extractErrorMessage(e);
      log.error("Custom health check failed: {} - {}", name, message);
      return new HealthCheckResult(
          name,
          HealthState.CRITICAL,
          "Custom check failed: " + message,
          clock.instant(),
          Duration.ofNanos(System.nanoTime() - started).toMillis(),
          Map.of("error", message));
    }
  }

  private HealthCheckResult checkDisk(MetricsSample s) {
    double freePercent = 100.0 - s.diskUsedPercent();
    HealthState state;
    String message;
    if (freePercent < settings.diskCriticalFreePercent()) {
      state = HealthState.CRITICAL;
      message = String.format(Locale.ROOT, "Critically low disk space (%.1f%% free)", freePercent);
    } else if (freePercent < settings.diskWarningFreePercent()) {
      state = HealthState.WARNING;
      message = String.format(Locale.ROOT, "Low disk space (%.1f%% free)", freePercent);
    } else {
      state = HealthState.HEALTHY;
      message = String.format(Locale.ROOT, "Disk space OK (%.1fGB free)", s.diskFreeGb());
    }
    return new HealthCheckResult(
        DISK_CHECK,
        state,
        message,
        s.timestamp(),
        null,
        Map.of("free_percent", freePercent, "free_gb", s.diskFreeGb()));
  }

  private HealthCheckResult checkMemory(MetricsSample s) {
    double used = s.heapUsedPercent();
    HealthState state;
    String message;
    if (used > settings.memoryCriticalPercent()) {
      state = HealthState.CRITICAL;
      message = String.format(Locale.ROOT, "Critical memory usage (%.1f%%)", used);
    } else if (used > settings.memoryWarningPercent()) {
      state = HealthState.WARNING;
      message = String.format(Locale.ROOT, "High memory usage (%.1f%%)", used);
    } else {
      state = HealthState.HEALTHY;
      message = String.format(Locale.ROOT, "Memory usage OK (%.1f%%)", used);
    }
    return new HealthCheckResult(
        MEMORY_CHECK,
        state,
        message,
        s.timestamp(),
        null,
        Map.of("percent_used", used, "used_mb", s.heapUsedMb()));
  }

  private HealthCheckResult checkCpu(MetricsSample s) {
    double load = s.cpuLoadPercent();
    if (load < 0) {
      return HealthCheckResult.of(
          CPU_CHECK, HealthState.UNKNOWN, "CPU load is not available", s.timestamp());
    }
    HealthState state;
    String message;
    if (load > settings.cpuCriticalPercent()) {
      state = HealthState.CRITICAL;
      message = String.format(Locale.ROOT, "Critical CPU usage (%.1f%%)", load);
    } else if (load > settings.cpuWarningPercent()) {
      state = HealthState.WARNING;
      message = String.format(Locale.ROOT, "High CPU usage (%.1f%%)", load);
    } else {
      state = HealthState.HEALTHY;
      message = String.format(Locale.ROOT, "CPU usage OK (%.1f%%)", load);
    }
    return new HealthCheckResult(
        CPU_CHECK, state, message, s.timestamp(), null, Map.of("percent_used", load));
  }

  @Override
  public synchronized HealthStatus getHealthStatus() {
    return HealthStatus.aggregate(results, clock.instant());
  }

  public synchronized Optional<MetricsSample> getCurrentMetrics() {
    return Optional.ofNullable(history.peekLast());
  }

  /** Summary of the samples taken during the last {@code hours}, if there are any. */
  public Optional<MetricsSummary> getMetricsSummary(int hours) {
    return Optional.ofNullable(MetricsSummary.of(hours, samplesSince(hours)));
  }

  @Override
  public Optional<PerformanceMetrics> getPerformanceMetrics() {
    return getCurrentMetrics()
        .map(
            current ->
                new PerformanceMetrics(
                    current,
                    getMetricsSummary(1).orElse(null),
                    getMetricsSummary(24).orElse(null)));
  }

  /**
   * Write the samples of the last {@code hours} together with the current health and performance
   * figures to {@code file} as JSON.
   *
   * @return number of exported samples
   */
  @Override
  public int exportMetrics(Path file, int hours) {
    List<MetricsSample> samples = samplesSince(hours);
    Map<String, Object> export = new LinkedHashMap<>();
    export.put("export_time", clock.instant());
    export.put("time_period_hours", hours);
    export.put("total_metrics", samples.size());
    export.put("metrics", samples);
    export.put("health_status", getHealthStatus());
    export.put("performance_summary", getPerformanceMetrics().orElse(null));
    try {
      Path parent = file.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      JacksonUtility.getJsonMapper()
          .writerWithDefaultPrettyPrinter()
          .writeValue(file.toFile(), export);
    } catch (IOException e) {
      throw new PersistenceException("Could not export metrics to " + file, e);
    }
    log.info("Exported {} metrics to {}", samples.size(), file);
    return samples.size();
  }

  private synchronized List<MetricsSample> samplesSince(int hours) {
    Instant cutoff = clock.instant().minus(Duration.ofHours(hours));
    List<MetricsSample> recent = new ArrayList<>();
    for (MetricsSample s : history) {
      if (!s.timestamp().isBefore(cutoff)) {
        recent.add(s);
      }
    }
    return recent;
  }
}
