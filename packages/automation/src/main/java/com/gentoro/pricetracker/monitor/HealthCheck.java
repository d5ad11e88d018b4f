package com.gentoro.pricetracker.monitor;

/** A named probe evaluated on every monitoring cycle. A check that throws counts as critical. */
@FunctionalInterface
public interface HealthCheck {
  HealthCheckResult check() throws Exception;
}
