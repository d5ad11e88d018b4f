package com.gentoro.pricetracker.scheduler;

import com.gentoro.pricetracker.exception.ConfigurationException;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import org.apache.commons.configuration2.Configuration;

/**
 * Tunables of {@link JobScheduler}, read from the {@code scheduler.*} configuration keys.
 *
 * @param tickInterval longest time the dispatch loop waits between two checks
 * @param errorBackoff pause after an unexpected error inside the dispatch loop
 * @param stopTimeout how long {@link JobScheduler#stop()} waits for the loop thread
 * @param historySize execution records kept in memory per job
 * @param persistedHistorySize execution records written to the snapshot per job
 * @param timeZone zone in which daily and weekly slots are evaluated
 * @param stateFile location of the JSON snapshot
 */
public record SchedulerSettings(
    Duration tickInterval,
    Duration errorBackoff,
    Duration stopTimeout,
    int historySize,
    int persistedHistorySize,
    ZoneId timeZone,
    Path stateFile) {

  public static final int STATUS_RECENT_RESULTS = 5;

  public SchedulerSettings {
    if (historySize <= 0 || persistedHistorySize < 0) {
      throw new ConfigurationException("History sizes must be positive");
    }
  }

  public static SchedulerSettings defaults() {
    return new SchedulerSettings(
        Duration.ofSeconds(1),
        Duration.ofSeconds(5),
        Duration.ofSeconds(5),
        100,
        10,
        ZoneId.of("UTC"),
        Path.of("data", "scheduler_state.json"));
  }

  public static SchedulerSettings fromConfiguration(Configuration config) {
    SchedulerSettings d = defaults();
    ZoneId zone;
    try {
      zone = ZoneId.of(config.getString("scheduler.time-zone", d.timeZone().getId()));
    } catch (DateTimeException e) {
      throw new ConfigurationException("Invalid scheduler.time-zone", e);
    }
    return new SchedulerSettings(
        Duration.ofMillis(
            config.getLong("scheduler.tick-interval-ms", d.tickInterval().toMillis())),
        Duration.ofMillis(
            config.getLong("scheduler.error-backoff-ms", d.errorBackoff().toMillis())),
        Duration.ofMillis(config.getLong("scheduler.stop-timeout-ms", d.stopTimeout().toMillis())),
        config.getInt("scheduler.history-size", d.historySize()),
        config.getInt("scheduler.persisted-history-size", d.persistedHistorySize()),
        zone,
        Path.of(config.getString("scheduler.state-file", d.stateFile().toString())));
  }

  public SchedulerSettings withTickInterval(Duration tick) {
    return new SchedulerSettings(
        tick, errorBackoff, stopTimeout, historySize, persistedHistorySize, timeZone, stateFile);
  }

  public SchedulerSettings withHistorySize(int size) {
    return new SchedulerSettings(
        tickInterval, errorBackoff, stopTimeout, size, persistedHistorySize, timeZone, stateFile);
  }

  public SchedulerSettings withStateFile(Path file) {
    return new SchedulerSettings(
        tickInterval, errorBackoff, stopTimeout, historySize, persistedHistorySize, timeZone, file);
  }
}
