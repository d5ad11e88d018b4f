package com.gentoro.pricetracker.monitor;

/** Latest sample plus one-hour and one-day summaries ({@code null} when no samples exist). */
public record PerformanceMetrics(
    MetricsSample current, MetricsSummary lastHour, MetricsSummary last24Hours) {}
