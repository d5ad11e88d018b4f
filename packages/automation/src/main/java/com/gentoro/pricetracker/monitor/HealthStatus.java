package com.gentoro.pricetracker.monitor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregated health of the system.
 *
 * @param overallStatus critical if any check is critical, otherwise warning if any check warns
 * @param criticalIssues messages of the critical checks
 * @param warnings messages of the warning checks
 * @param checks latest result per check name
 */
public record HealthStatus(
    HealthState overallStatus,
    Instant lastCheck,
    List<String> criticalIssues,
    List<String> warnings,
    Map<String, HealthCheckResult> checks) {

  public HealthStatus {
    criticalIssues = Collections.unmodifiableList(new ArrayList<>(criticalIssues));
    warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
    checks = Collections.unmodifiableMap(new LinkedHashMap<>(checks));
  }

  public static HealthStatus aggregate(Map<String, HealthCheckResult> checks, Instant now) {
    HealthState overall = HealthState.HEALTHY;
    List<String> critical = new ArrayList<>();
    List<String> warnings = new ArrayList<>();
    for (HealthCheckResult result : checks.values()) {
      if (result.status() == HealthState.CRITICAL) {
        overall = HealthState.CRITICAL;
        critical.add(result.message());
      } else if (result.status() == HealthState.WARNING) {
        if (overall != HealthState.CRITICAL) {
          overall = HealthState.WARNING;
        }
        warnings.add(result.message());
      }
    }
    return new HealthStatus(overall, now, critical, warnings, checks);
  }

  public boolean isCritical() {
    return overallStatus == HealthState.CRITICAL;
  }
}
