package com.gentoro.pricetracker.monitor;

import java.time.Instant;

/**
 * One sample of resource usage. Percentages are in {@code [0, 100]}; {@code cpuLoadPercent} is
 * negative when the platform does not report a load average.
 */
public record MetricsSample(
    Instant timestamp,
    double heapUsedPercent,
    double heapUsedMb,
    double diskUsedPercent,
    double diskFreeGb,
    double cpuLoadPercent,
    int threadCount) {}
