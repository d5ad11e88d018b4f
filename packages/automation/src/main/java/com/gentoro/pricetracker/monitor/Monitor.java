package com.gentoro.pricetracker.monitor;

import java.nio.file.Path;
import java.util.Optional;

/** Source of health signals consumed by the orchestrator's supervisory loop. */
public interface Monitor {
  void start();

  void stop();

  HealthStatus getHealthStatus();

  /** Register an additional check evaluated together with the built-in ones. */
  default void addHealthCheck(String name, HealthCheck check) {}

  default Optional<PerformanceMetrics> getPerformanceMetrics() {
    return Optional.empty();
  }

  /**
   * Write the metrics of the last {@code hours} to {@code file}.
   *
   * @return number of exported samples
   */
  default int exportMetrics(Path file, int hours) {
    throw new UnsupportedOperationException(
        getClass().getSimpleName() + " does not support metrics export");
  }
}
