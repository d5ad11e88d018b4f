package com.gentoro.pricetracker.orchestrator;

import com.gentoro.pricetracker.exception.PriceTrackerErrorCode;
import com.gentoro.pricetracker.export.DataManager;
import com.gentoro.pricetracker.export.ExportResult;
import com.gentoro.pricetracker.logging.LoggingService;
import com.gentoro.pricetracker.monitor.HealthCheckResult;
import com.gentoro.pricetracker.monitor.HealthState;
import com.gentoro.pricetracker.monitor.HealthStatus;
import com.gentoro.pricetracker.monitor.Monitor;
import com.gentoro.pricetracker.notification.NotificationPriority;
import com.gentoro.pricetracker.notification.Notifier;
import com.gentoro.pricetracker.scheduler.JobContext;
import com.gentoro.pricetracker.scheduler.JobDefinition;
import com.gentoro.pricetracker.scheduler.JobPriority;
import com.gentoro.pricetracker.scheduler.JobScheduler;
import com.gentoro.pricetracker.scheduler.JobStatusView;
import com.gentoro.pricetracker.scheduler.ScheduleType;
import com.gentoro.pricetracker.scheduler.SchedulerHealthView;
import com.gentoro.pricetracker.scheduler.SchedulerStatusView;
import com.gentoro.pricetracker.tracking.Product;
import com.gentoro.pricetracker.tracking.Tracker;
import com.gentoro.pricetracker.tracking.TrackingResult;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.slf4j.Logger;

/**
 * Composes the scheduler, the monitor and the price tracker collaborators into the running
 * automation system: registers the default jobs, supervises health and owns the start/stop
 * lifecycle.
 */
public class AutomationOrchestrator {
  private static final Logger log = LoggingService.getLogger(AutomationOrchestrator.class);

  public static final String MAIN_TRACKING = "main_tracking";
  public static final String QUICK_CHECK = "quick_check";
  public static final String DAILY_EXPORT = "daily_export";
  public static final String WEEKLY_REPORT = "weekly_report";
  public static final String HEALTH_CHECK = "health_check";
  public static final String DATABASE_CLEANUP = "database_cleanup";
  public static final List<String> DEFAULT_JOB_IDS =
      List.of(
          MAIN_TRACKING, QUICK_CHECK, DAILY_EXPORT, WEEKLY_REPORT, HEALTH_CHECK, DATABASE_CLEANUP);

  static final String SCHEDULER_CHECK = "scheduler";
  private static final DateTimeFormatter TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

  private final JobScheduler scheduler;
  private final Monitor monitor;
  private final Tracker tracker;
  private final DataManager dataManager;
  private final Notifier notifier;
  private final OrchestratorSettings settings;
  private final Clock clock;

  private final AtomicReference<OrchestratorState> state =
      new AtomicReference<>(OrchestratorState.STOPPED);
  private volatile Instant startupTime;
  private ScheduledExecutorService supervisor;

  public AutomationOrchestrator(
      JobScheduler scheduler,
      Monitor monitor,
      Tracker tracker,
      DataManager dataManager,
      Notifier notifier,
      OrchestratorSettings settings,
      Clock clock) {
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    this.monitor = Objects.requireNonNull(monitor, "monitor");
    this.tracker = Objects.requireNonNull(tracker, "tracker");
    this.dataManager = Objects.requireNonNull(dataManager, "dataManager");
    this.notifier = Objects.requireNonNull(notifier, "notifier");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.clock = Objects.requireNonNull(clock, "clock");
    log.info("AutomationOrchestrator initialized");
  }

  // --------------------------------------------------------------------
  // Lifecycle
  // --------------------------------------------------------------------

  /**
   * Start monitoring, register the default jobs, start the scheduler and the supervisory loop.
   * Calling it while the system is not stopped only logs a warning. When a step fails, the
   * components started so far are stopped again and the error is rethrown.
   */
  public void start() {
    if (!state.compareAndSet(OrchestratorState.STOPPED, OrchestratorState.STARTING)) {
      log.warn("Automation system is already running");
      return;
    }
    log.info("Starting price tracker automation system");
    startupTime = clock.instant();
    try {
      monitor.start();
      monitor.addHealthCheck(SCHEDULER_CHECK, this::checkScheduler);
      log.info("System monitoring started");

      registerDefaultJobs();
      log.info("Default jobs configured");

      scheduler.start();
      log.info("Job scheduler started");

      sendStartupNotification();
      startSupervisor();
      state.set(OrchestratorState.RUNNING);
      log.info("Automation system fully operational");
    } catch (RuntimeException e) {
      log.error("Failed to start automation system: {}", e.getMessage());
      state.set(OrchestratorState.STOPPING);
      stopComponents();
      state.set(OrchestratorState.STOPPED);
      throw e;
    }
  }

  /**
   * Stop the scheduler, the monitor and the supervisory loop, then send the shutdown
   * notification. Errors of the individual steps are logged and never rethrown. A no-op unless
   * the system is running.
   */
  public void stop() {
    if (!state.compareAndSet(OrchestratorState.RUNNING, OrchestratorState.STOPPING)) {
      return;
    }
    log.info("Stopping price tracker automation system");
    stopComponents();
    runStep("shutdown notification", this::sendShutdownNotification);
    state.set(OrchestratorState.STOPPED);
    log.info("Automation system stopped gracefully");
  }

  private void stopComponents() {
    runStep("scheduler", scheduler::stop);
    runStep("monitor", monitor::stop);
    runStep("supervisor", this::stopSupervisor);
  }

  private void runStep(String step, Runnable action) {
    try {
      action.run();
    } catch (RuntimeException e) {
      log.error(
          "[{}] Error stopping {}: {}",
          PriceTrackerErrorCode.SHUTDOWN_ERROR,
          step,
          e.getMessage(),
          e);
    }
  }

  public boolean isRunning() {
    return state.get() == OrchestratorState.RUNNING;
  }

  public OrchestratorState state() {
    return state.get();
  }

  // --------------------------------------------------------------------
  // Supervision
  // --------------------------------------------------------------------

  private synchronized void startSupervisor() {
    supervisor =
        Executors.newSingleThreadScheduledExecutor(
            r -> {
              Thread t = new Thread(r, "orchestrator-supervisor");
              t.setDaemon(true);
              return t;
            });
    long period = Math.max(1, settings.superviseInterval().toMillis());
    supervisor.scheduleWithFixedDelay(this::superviseSafely, 0, period, TimeUnit.MILLISECONDS);
  }

  private void stopSupervisor() {
    ScheduledExecutorService current;
    synchronized (this) {
      current = supervisor;
      supervisor = null;
    }
    if (current == null) {
      return;
    }
    current.shutdownNow();
    try {
      if (!current.awaitTermination(5, TimeUnit.SECONDS)) {
        log.warn("Supervisory loop did not terminate in time");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private void superviseSafely() {
    try {
      superviseOnce();
    } catch (RuntimeException e) {
      log.error("Error in supervisory loop: {}", e.getMessage(), e);
    }
  }

  /** Read the monitor once and alert when the system is critical. */
  void superviseOnce() {
    HealthStatus health = monitor.getHealthStatus();
    if (health != null && health.isCritical()) {
      log.error("CRITICAL: Critical system issues detected: {}", health.criticalIssues());
      sendCriticalAlert(health.criticalIssues());
    }
  }

  HealthCheckResult checkScheduler() {
    SchedulerHealthView health = scheduler.getSystemHealth();
    Instant now = clock.instant();
    Map<String, Object> details = new LinkedHashMap<>();
    details.put("running", health.schedulerRunning());
    details.put("total_jobs", health.totalJobs());
    details.put("success_rate", health.overallSuccessRate());
    details.put("unschedulable_jobs", health.unschedulableJobs());

    HealthState status;
    String message;
    if (state.get() == OrchestratorState.RUNNING && !health.schedulerRunning()) {
      status = HealthState.CRITICAL;
      message = "Job scheduler is not running";
    } else if (health.unschedulableJobs() > 0) {
      status = HealthState.WARNING;
      message = health.unschedulableJobs() + " enabled job(s) have no next run";
    } else {
      status = HealthState.HEALTHY;
      message =
          String.format(
              Locale.ROOT,
              "Scheduler OK (%d jobs, %.1f%% success)",
              health.totalJobs(), health.overallSuccessRate());
    }
    return new HealthCheckResult(SCHEDULER_CHECK, status, message, now, null, details);
  }

  // --------------------------------------------------------------------
  // Default jobs
  // --------------------------------------------------------------------

  private void registerDefaultJobs() {
    for (JobDefinition definition : defaultJobs()) {
      if (settings.isJobEnabled(definition.jobId())) {
        scheduler.addJob(definition);
      } else {
        // drop the descriptor a previous run may have persisted for it
        scheduler.removeJob(definition.jobId());
        log.info("Default job {} disabled by configuration", definition.jobId());
      }
    }
  }

  List<JobDefinition> defaultJobs() {
    return List.of(
        JobDefinition.builder(MAIN_TRACKING, "Main Price Tracking", ctx -> runMainTracking())
            .schedule(ScheduleType.INTERVAL_MINUTES, 60)
            .priority(JobPriority.HIGH)
            .timeout(Duration.ofMinutes(30))
            .maxRetries(2)
            .build(),
        JobDefinition.builder(QUICK_CHECK, "Quick Price Check", ctx -> runQuickCheck())
            .schedule(ScheduleType.INTERVAL_MINUTES, 15)
            .priority(JobPriority.MEDIUM)
            .timeout(Duration.ofMinutes(10))
            .maxRetries(1)
            .build(),
        JobDefinition.builder(DAILY_EXPORT, "Daily Data Export", ctx -> runDailyExport())
            .schedule(ScheduleType.DAILY, "02:00")
            .priority(JobPriority.LOW)
            .timeout(Duration.ofMinutes(15))
            .maxRetries(2)
            .build(),
        JobDefinition.builder(WEEKLY_REPORT, "Weekly Analytics Report", this::sendWeeklyReport)
            .schedule(ScheduleType.WEEKLY, "sunday 09:00")
            .priority(JobPriority.LOW)
            .timeout(Duration.ofMinutes(10))
            .maxRetries(1)
            .build(),
        JobDefinition.builder(HEALTH_CHECK, "System Health Check", ctx -> runHealthCheck())
            .schedule(ScheduleType.INTERVAL_MINUTES, 30)
            .priority(JobPriority.MEDIUM)
            .timeout(Duration.ofMinutes(5))
            .maxRetries(1)
            .build(),
        JobDefinition.builder(DATABASE_CLEANUP, "Database Cleanup", ctx -> runDatabaseCleanup())
            .schedule(ScheduleType.DAILY, "03:00")
            .priority(JobPriority.LOW)
            .timeout(Duration.ofMinutes(20))
            .maxRetries(1)
            .build());
  }

  Map<String, Object> runMainTracking() {
    log.info("Running main price tracking job");
    TrackingResult result = tracker.runTracking(List.of());
    log.info(
        "Main tracking completed: {} updated, {} failed", result.updated(), result.failed());
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("updated_count", result.updated());
    out.put("failed_count", result.failed());
    out.put("total_count", result.total());
    return out;
  }

  Map<String, Object> runQuickCheck() {
    log.info("Running quick price check");
    List<Long> ids =
        tracker.getTrackedProducts().stream()
            .filter(Product::isPriority)
            .limit(settings.quickCheckLimit())
            .map(Product::id)
            .collect(Collectors.toList());
    if (ids.isEmpty()) {
      return Map.of("message", "No priority products to check");
    }
    TrackingResult result = tracker.runTracking(ids);
    log.info("Quick check completed: {} updated, {} failed", result.updated(), result.failed());
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("checked_count", ids.size());
    out.put("updated_count", result.updated());
    out.put("failed_count", result.failed());
    return out;
  }

  Map<String, Object> runDailyExport() {
    log.info("Running daily data export");
    ExportResult result = dataManager.runDailyExport();
    log.info("Daily export completed: {}", result.targets());
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("targets", result.targets());
    out.put("files", result.files());
    return out;
  }

  Map<String, Object> sendWeeklyReport(JobContext ctx) {
    log.info("Generating weekly analytics report");
    Map<String, Object> analytics = dataManager.getAnalytics(settings.reportDays());
    StringBuilder message = new StringBuilder();
    message
        .append("Price analytics for the last ")
        .append(settings.reportDays())
        .append(" days\n");
    analytics.forEach((k, v) -> message.append('\n').append(k).append(": ").append(v));
    Map<String, Boolean> delivery =
        notifier.send("Weekly Price Report", message.toString(), NotificationPriority.MEDIUM);
    log.info("Weekly report sent: {}", delivery);
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("analytics", analytics);
    out.put("delivery", delivery);
    return out;
  }

  Map<String, Object> runHealthCheck() {
    log.debug("Running system health check");
    HealthStatus health = monitor.getHealthStatus();
    if (!health.warnings().isEmpty()) {
      log.warn("System warnings: {}", health.warnings());
    }
    if (!health.criticalIssues().isEmpty()) {
      log.error("CRITICAL: Critical issues: {}", health.criticalIssues());
      sendCriticalAlert(health.criticalIssues());
    }
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("overall_status", health.overallStatus());
    out.put("critical_issues", health.criticalIssues());
    out.put("warnings", health.warnings());
    return out;
  }

  Map<String, Object> runDatabaseCleanup() {
    log.info("Running database cleanup");
    Instant cutoff = clock.instant().minus(settings.historyRetention());
    int deleted = dataManager.deletePriceHistoryOlderThan(cutoff);
    log.info("Database cleanup completed: {} old records removed", deleted);
    return Map.of("deleted_records", deleted);
  }

  // --------------------------------------------------------------------
  // Notifications
  // --------------------------------------------------------------------

  private void sendStartupNotification() {
    try {
      int products = tracker.getTrackedProducts().size();
      String message =
          "Smart Price Tracker Started\n\n"
              + "System Status: Operational\n"
              + "Tracked Products: "
              + products
              + "\n"
              + "Started At: "
              + TIMESTAMP.format(startupTime)
              + "\n\n"
              + "The automated price tracking system is now running and will monitor your"
              + " products according to the configured schedule.";
      notifier.send("Price Tracker Started", message, NotificationPriority.MEDIUM);
    } catch (RuntimeException e) {
      log.error("Failed to send startup notification: {}", e.getMessage());
    }
  }

  private void sendShutdownNotification() {
    try {
      Instant now = clock.instant();
      String message =
          "Smart Price Tracker Stopped\n\n"
              + "System Status: Offline\n"
              + "Uptime: "
              + formatUptime(uptime(now))
              + "\n"
              + "Stopped At: "
              + TIMESTAMP.format(now)
              + "\n\n"
              + "The automated price tracking system has been stopped gracefully.";
      notifier.send("Price Tracker Stopped", message, NotificationPriority.MEDIUM);
    } catch (RuntimeException e) {
      log.error("Failed to send shutdown notification: {}", e.getMessage());
    }
  }

  private void sendCriticalAlert(List<String> issues) {
    try {
      StringBuilder message = new StringBuilder("CRITICAL SYSTEM ALERT\n\n");
      message.append("The following critical issues have been detected:\n\n");
      for (String issue : issues) {
        message.append("- ").append(issue).append('\n');
      }
      message
          .append("\nPlease check the system immediately to ensure proper operation.\n\n")
          .append("Time: ")
          .append(TIMESTAMP.format(clock.instant()));
      notifier.send("Critical System Alert", message.toString(), NotificationPriority.URGENT);
    } catch (RuntimeException e) {
      log.error("Failed to send critical alert: {}", e.getMessage());
    }
  }

  private Duration uptime(Instant now) {
    Instant started = startupTime;
    return started == null ? Duration.ZERO : Duration.between(started, now);
  }

  /** {@code H:MM:SS}, with a leading day count once the uptime exceeds a day. */
  static String formatUptime(Duration uptime) {
    long days = uptime.toDays();
    String clockPart =
        String.format(
            Locale.ROOT,
            "%d:%02d:%02d",
            uptime.toHoursPart(),
            uptime.toMinutesPart(),
            uptime.toSecondsPart());
    if (days == 0) {
      return clockPart;
    }
    return days + (days == 1 ? " day, " : " days, ") + clockPart;
  }

  // --------------------------------------------------------------------
  // Status and job management
  // --------------------------------------------------------------------

  /** Read-only snapshot of the system. Collaborators that fail to answer are left out. */
  public SystemStatus getSystemStatus() {
    Instant now = clock.instant();
    List<Product> products = read("tracked products", tracker::getTrackedProducts);
    return new SystemStatus(
        isRunning(),
        state.get(),
        startupTime,
        uptime(now).toMillis() / 1000.0,
        read("scheduler status", scheduler::getAllJobsStatus),
        read("health status", monitor::getHealthStatus),
        read("performance metrics", () -> monitor.getPerformanceMetrics().orElse(null)),
        products == null ? null : products.size(),
        read("notification status", notifier::status),
        read("export status", dataManager::exportStatus));
  }

  private <T> T read(String what, Supplier<T> source) {
    try {
      return source.get();
    } catch (RuntimeException e) {
      log.warn("Could not read {}: {}", what, e.getMessage());
      return null;
    }
  }

  public HealthStatus getSystemHealth() {
    return monitor.getHealthStatus();
  }

  public boolean addCustomJob(JobDefinition definition) {
    return scheduler.addJob(definition);
  }

  public boolean pauseJob(String jobId) {
    return scheduler.pauseJob(jobId);
  }

  public boolean resumeJob(String jobId) {
    return scheduler.resumeJob(jobId);
  }

  public boolean executeJobNow(String jobId) {
    return scheduler.executeNow(jobId);
  }

  public Optional<JobStatusView> getJobStatus(String jobId) {
    return scheduler.getJobStatus(jobId);
  }

  public SchedulerStatusView listAllJobs() {
    return scheduler.getAllJobsStatus();
  }

  /** Export the monitor's metrics of the last {@code hours}; failures are logged and rethrown. */
  public int exportSystemMetrics(Path file, int hours) {
    try {
      int exported = monitor.exportMetrics(file, hours);
      log.info("System metrics exported to {}", file);
      return exported;
    } catch (RuntimeException e) {
      log.error("Failed to export metrics: {}", e.getMessage());
      throw e;
    }
  }
}
