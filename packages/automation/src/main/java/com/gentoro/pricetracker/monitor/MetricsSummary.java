package com.gentoro.pricetracker.monitor;

import java.util.List;
import java.util.function.ToDoubleFunction;

/** Average, minimum and maximum of the samples taken during the last {@code hours}. */
public record MetricsSummary(
    int hours, int dataPoints, Stats heap, Stats disk, Stats cpu, int latestThreadCount) {

  public record Stats(double avg, double min, double max) {
    static Stats of(List<MetricsSample> samples, ToDoubleFunction<MetricsSample> metric) {
      double sum = 0;
      double min = Double.MAX_VALUE;
      double max = -Double.MAX_VALUE;
      for (MetricsSample s : samples) {
        double v = metric.applyAsDouble(s);
        sum += v;
        min = Math.min(min, v);
        max = Math.max(max, v);
      }
      return new Stats(sum / samples.size(), min, max);
    }
  }

  /** Returns {@code null} for an empty sample list. */
  static MetricsSummary of(int hours, List<MetricsSample> samples) {
    if (samples.isEmpty()) {
      return null;
    }
    return new MetricsSummary(
        hours,
        samples.size(),
        Stats.of(samples, MetricsSample::heapUsedPercent),
        Stats.of(samples, MetricsSample::diskUsedPercent),
        Stats.of(samples, MetricsSample::cpuLoadPercent),
        samples.get(samples.size() - 1).threadCount());
  }
}
