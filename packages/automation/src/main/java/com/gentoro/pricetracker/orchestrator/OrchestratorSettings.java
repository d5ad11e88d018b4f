package com.gentoro.pricetracker.orchestrator;

import java.time.Duration;
import java.util.HashSet;
import java.util.Set;
import org.apache.commons.configuration2.Configuration;

/**
 * Tunables of {@link AutomationOrchestrator}, read from the {@code orchestrator.*} keys.
 *
 * @param superviseInterval pause between two supervisory health reads
 * @param quickCheckLimit maximum number of priority products refreshed by {@code quick_check}
 * @param historyRetention price history older than this is deleted by {@code database_cleanup}
 * @param reportDays period covered by {@code weekly_report}
 * @param disabledJobs default jobs switched off with {@code orchestrator.jobs.<id>.enabled}
 */
public record OrchestratorSettings(
    Duration superviseInterval,
    int quickCheckLimit,
    Duration historyRetention,
    int reportDays,
    Set<String> disabledJobs) {

  public OrchestratorSettings {
    disabledJobs = Set.copyOf(disabledJobs);
  }

  public static OrchestratorSettings defaults() {
    return new OrchestratorSettings(Duration.ofMinutes(5), 10, Duration.ofDays(90), 7, Set.of());
  }

  public static OrchestratorSettings fromConfiguration(Configuration config) {
    OrchestratorSettings d = defaults();
    Set<String> disabled = new HashSet<>();
    for (String id : AutomationOrchestrator.DEFAULT_JOB_IDS) {
      if (!config.getBoolean("orchestrator.jobs." + id + ".enabled", true)) {
        disabled.add(id);
      }
    }
    return new OrchestratorSettings(
        Duration.ofSeconds(
            config.getLong(
                "orchestrator.supervise-interval-seconds", d.superviseInterval().toSeconds())),
        config.getInt("orchestrator.quick-check-limit", d.quickCheckLimit()),
        Duration.ofDays(
            config.getLong("orchestrator.history-retention-days", d.historyRetention().toDays())),
        config.getInt("orchestrator.report-days", d.reportDays()),
        disabled);
  }

  public boolean isJobEnabled(String jobId) {
    return !disabledJobs.contains(jobId);
  }

  public OrchestratorSettings withSuperviseInterval(Duration interval) {
    return new OrchestratorSettings(
        interval, quickCheckLimit, historyRetention, reportDays, disabledJobs);
  }

  public OrchestratorSettings withDisabledJobs(Set<String> jobs) {
    return new OrchestratorSettings(
        superviseInterval, quickCheckLimit, historyRetention, reportDays, jobs);
  }
}
