package com.gentoro.pricetracker.orchestrator;

import com.gentoro.pricetracker.monitor.HealthStatus;
import com.gentoro.pricetracker.monitor.PerformanceMetrics;
import com.gentoro.pricetracker.scheduler.SchedulerStatusView;
import java.time.Instant;
import java.util.Map;

/**
 * Point-in-time view of the whole automation system. Components that could not be read are
 * {@code null}.
 */
public record SystemStatus(
    boolean running,
    OrchestratorState state,
    Instant startupTime,
    double uptimeSeconds,
    SchedulerStatusView schedulerStatus,
    HealthStatus healthStatus,
    PerformanceMetrics performanceMetrics,
    Integer trackedProducts,
    Map<String, Object> notificationStatus,
    Map<String, Object> exportStatus) {}
