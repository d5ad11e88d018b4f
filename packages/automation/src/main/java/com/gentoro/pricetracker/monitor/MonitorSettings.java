package com.gentoro.pricetracker.monitor;

import java.nio.file.Path;
import java.time.Duration;
import org.apache.commons.configuration2.Configuration;

/**
 * Tunables of {@link SystemMonitor}, read from the {@code monitor.*} configuration keys. Disk
 * thresholds are free-space percentages (alert when below), memory and cpu thresholds are usage
 * percentages (alert when above).
 */
public record MonitorSettings(
    Duration sampleInterval,
    int retentionHours,
    Path diskPath,
    double diskWarningFreePercent,
    double diskCriticalFreePercent,
    double memoryWarningPercent,
    double memoryCriticalPercent,
    double cpuWarningPercent,
    double cpuCriticalPercent) {

  public static MonitorSettings defaults() {
    return new MonitorSettings(Duration.ofSeconds(60), 168, Path.of("."), 15, 5, 80, 90, 80, 90);
  }

  public static MonitorSettings fromConfiguration(Configuration config) {
    MonitorSettings d = defaults();
    return new MonitorSettings(
        Duration.ofSeconds(
            config.getLong("monitor.sample-interval-seconds", d.sampleInterval().toSeconds())),
        config.getInt("monitor.retention-hours", d.retentionHours()),
        Path.of(config.getString("monitor.disk-path", d.diskPath().toString())),
        config.getDouble("monitor.disk.warning-free-percent", d.diskWarningFreePercent()),
        config.getDouble("monitor.disk.critical-free-percent", d.diskCriticalFreePercent()),
        config.getDouble("monitor.memory.warning-percent", d.memoryWarningPercent()),
        config.getDouble("monitor.memory.critical-percent", d.memoryCriticalPercent()),
        config.getDouble("monitor.cpu.warning-percent", d.cpuWarningPercent()),
        config.getDouble("monitor.cpu.critical-percent", d.cpuCriticalPercent()));
  }

  /** One sample per minute of retention. */
  int historyCapacity() {
    return Math.max(1, retentionHours * 60);
  }

  public MonitorSettings withSampleInterval(Duration interval) {
    return new MonitorSettings(
        interval,
        retentionHours,
        diskPath,
        diskWarningFreePercent,
        diskCriticalFreePercent,
        memoryWarningPercent,
        memoryCriticalPercent,
        cpuWarningPercent,
        cpuCriticalPercent);
  }
}
