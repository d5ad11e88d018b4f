package com.gentoro.pricetracker;

import com.gentoro.pricetracker.backend.BackendResolver;
import com.gentoro.pricetracker.backend.spi.BackendProvider;
import com.gentoro.pricetracker.exception.StateException;
import com.gentoro.pricetracker.export.DataManager;
import com.gentoro.pricetracker.logging.LoggingService;
import com.gentoro.pricetracker.monitor.MonitorSettings;
import com.gentoro.pricetracker.monitor.SystemMonitor;
import com.gentoro.pricetracker.notification.LoggingNotifier;
import com.gentoro.pricetracker.notification.Notifier;
import com.gentoro.pricetracker.orchestrator.AutomationOrchestrator;
import com.gentoro.pricetracker.orchestrator.OrchestratorSettings;
import com.gentoro.pricetracker.scheduler.JobScheduler;
import com.gentoro.pricetracker.scheduler.SchedulerSettings;
import com.gentoro.pricetracker.scheduler.persistence.JsonFileSchedulerStateRepository;
import com.gentoro.pricetracker.tracking.Tracker;
import java.time.Clock;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;

/**
 * Application container. Owns the configuration, the scheduler, the monitor and the single
 * {@link AutomationOrchestrator} instance.
 */
public class PriceTracker {
  private static final Logger log = LoggingService.getLogger(PriceTracker.class);

  private final StartupParameters startupParameters;
  private ConfigurationProvider configurationProvider;
  private JobScheduler scheduler;
  private SystemMonitor monitor;
  private AutomationOrchestrator orchestrator;
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private final CountDownLatch shutdownLatch = new CountDownLatch(1);
  private volatile Thread shutdownHook;

  public PriceTracker(String[] applicationArgs) {
    this.startupParameters = new StartupParameters(applicationArgs);
  }

  /** Load configuration, wire the components and start the orchestrator. */
  public void initialize() {
    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    // Apply logging levels from the configuration as early as possible
    LoggingService.applyConfiguration(configuration());

    BackendProvider backend = BackendResolver.resolve(configuration());
    Tracker tracker = backend.createTracker(configuration());
    DataManager dataManager = backend.createDataManager(configuration());
    Notifier notifier =
        backend
            .createNotifier(configuration())
            .orElseGet(
                () -> {
                  log.info("Backend {} has no notifier, notifications go to the log", backend.id());
                  return new LoggingNotifier();
                });

    SchedulerSettings schedulerSettings = SchedulerSettings.fromConfiguration(configuration());
    this.scheduler =
        new JobScheduler(
            schedulerSettings, new JsonFileSchedulerStateRepository(schedulerSettings.stateFile()));
    this.monitor = new SystemMonitor(MonitorSettings.fromConfiguration(configuration()));
    this.orchestrator =
        new AutomationOrchestrator(
            scheduler,
            monitor,
            tracker,
            dataManager,
            notifier,
            OrchestratorSettings.fromConfiguration(configuration()),
            Clock.systemUTC());

    try {
      orchestrator.start();
    } catch (RuntimeException e) {
      shutdown();
      throw e;
    }
  }

  /**
   * Block the current thread until a shutdown signal is received (SIGINT, SIGTERM or JVM
   * termination). The shutdown hook stops the orchestrator before the JVM exits.
   */
  public void waitShutdownSignal() {
    // Register a JVM shutdown hook once
    if (shutdownHook == null) {
      synchronized (this) {
        if (shutdownHook == null) {
          shutdownHook = new Thread(() -> triggerShutdown("signal"), "pricetracker-shutdown-hook");
          Runtime.getRuntime().addShutdownHook(shutdownHook);
        }
      }
    }

    try {
      shutdownLatch.await();
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
  }

  /** Release resources. Safe to call multiple times; executed only once. */
  public void shutdown() {
    triggerShutdown("explicit");
  }

  private void triggerShutdown(String reason) {
    if (shuttingDown.compareAndSet(false, true)) {
      log.info("Shutting down ({})", reason);
      try {
        if (orchestrator != null) {
          orchestrator.stop();
        }
        if (scheduler != null) {
          scheduler.close();
        }
      } finally {
        shutdownLatch.countDown();
      }
    }
  }

  /** Expose the application configuration to other components. */
  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("PriceTracker not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }

  public JobScheduler scheduler() {
    return scheduler;
  }

  public SystemMonitor monitor() {
    return monitor;
  }

  public AutomationOrchestrator orchestrator() {
    if (orchestrator == null) {
      throw new StateException("PriceTracker not initialized. Call initialize() first.");
    }
    return orchestrator;
  }
}
