package com.gentoro.pricetracker.monitor;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one health check.
 *
 * @param latencyMs time the check took, or {@code null} when not measured
 * @param details structured detail, never {@code null}
 */
public record HealthCheckResult(
    String name,
    HealthState status,
    String message,
    Instant timestamp,
    Long latencyMs,
    Map<String, Object> details) {

  public HealthCheckResult {
    details =
        details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
  }

  public static HealthCheckResult of(
      String name, HealthState status, String message, Instant timestamp) {
    return new HealthCheckResult(name, status, message, timestamp, null, Map.of());
  }
}
