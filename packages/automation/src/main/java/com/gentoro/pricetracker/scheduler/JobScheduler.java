package com.gentoro.pricetracker.scheduler;

import com.gentoro.pricetracker.exception.PersistenceException;
import com.gentoro.pricetracker.exception.PriceTrackerErrorCode;
import com.gentoro.pricetracker.exception.ScheduleParseException;
import com.gentoro.pricetracker.exception.StateException;
import com.gentoro.pricetracker.logging.LoggingService;
import com.gentoro.pricetracker.scheduler.persistence.ExecutionSnapshot;
import com.gentoro.pricetracker.scheduler.persistence.JobSnapshot;
import com.gentoro.pricetracker.scheduler.persistence.SchedulerState;
import com.gentoro.pricetracker.scheduler.persistence.SchedulerStateRepository;
import com.gentoro.pricetracker.utility.JacksonUtility;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;
import org.slf4j.Logger;

/**
 * Recurring job scheduler with a single dispatch loop, per-run timeouts and a persisted snapshot
 * of job metadata.
 *
 * <p>Threads: one dispatch loop ({@code job-scheduler}); per in-flight execution one runner
 * thread ({@code job-runner-N}) waiting on one body thread ({@code job-body-N}).
 *
 * <p>Every mutation takes {@link #lock}, changes the in-memory state, then builds and writes the
 * snapshot before releasing it, so snapshot writes are serialized and never stale. A failed write
 * is logged and does not roll back the mutation.
 *
 * <p>Executions of one job never overlap: a job stays in {@link #inFlight} until its result has
 * been committed and its next run recomputed. Results of executions abandoned by {@link #stop()}
 * or by re-registering the job id are discarded.
 *
 * <p>{@code maxRetries} and {@code retryDelay} are kept as metadata only. A failed run is not
 * repeated before the job's next regular trigger.
 */
public final class JobScheduler implements AutoCloseable {
  private static final Logger log = LoggingService.getLogger(JobScheduler.class);

  private static final Duration MIN_WAIT = Duration.ofMillis(10);
  private static final Comparator<ScheduledJob> DISPATCH_ORDER =
      Comparator.comparing((ScheduledJob j) -> j.definition.priority())
          .reversed()
          .thenComparing(j -> j.createdAt)
          .thenComparing(ScheduledJob::id);

  private final SchedulerSettings settings;
  private final SchedulerStateRepository repository;
  private final JobStore store;
  private final TimeCalculator calculator;
  private final JobRunner runner;
  private final Clock clock;

  private final ReentrantLock lock = new ReentrantLock();
  private final Condition wakeUp = lock.newCondition();
  private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
  private final AtomicLong generations = new AtomicLong();
  private final ExecutorService dispatchExecutor;

  // Descriptors loaded from the snapshot whose body has not been registered yet
  private final Map<String, JobSnapshot> restored = new LinkedHashMap<>();
  private final Map<String, List<ExecutionSnapshot>> restoredResults = new LinkedHashMap<>();

  private volatile boolean running;
  // Bumped on start/stop; results from an older epoch are discarded
  private long epoch;
  private Thread loopThread;

  public JobScheduler(SchedulerSettings settings, SchedulerStateRepository repository) {
    this(settings, repository, new InMemoryJobStore(settings.historySize()), Clock.systemUTC());
  }

  public JobScheduler(
      SchedulerSettings settings,
      SchedulerStateRepository repository,
      JobStore store,
      Clock clock) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.repository = Objects.requireNonNull(repository, "repository");
    this.store = Objects.requireNonNull(store, "store");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.calculator = new TimeCalculator(settings.timeZone());
    this.runner = new JobRunner(clock);
    AtomicInteger counter = new AtomicInteger();
    this.dispatchExecutor =
        Executors.newCachedThreadPool(
            r -> {
              Thread t = new Thread(r, "job-runner-" + counter.incrementAndGet());
              t.setDaemon(true);
              return t;
            });
    loadState();
    log.info("JobScheduler initialized");
  }

  // --------------------------------------------------------------------
  // Job lifecycle
  // --------------------------------------------------------------------

  /**
   * Register a job, replacing any job with the same id. The next run is computed right away; when
   * the schedule value cannot be parsed the job is kept without a next run and never dispatched.
   */
  public boolean addJob(JobDefinition definition) {
    Objects.requireNonNull(definition, "definition");
    String id = definition.jobId();
    lock.lock();
    try {
      Instant now = clock.instant();
      boolean replacing = store.get(id).isPresent();
      if (replacing) {
        log.warn("Job {} already exists, updating...", id);
      }

      Schedule schedule = null;
      String scheduleError = null;
      try {
        schedule = Schedule.parse(definition.scheduleType(), definition.scheduleValue());
      } catch (ScheduleParseException e) {
        scheduleError = e.getMessage();
        log.warn("[{}] Job {} cannot be scheduled: {}", e.getCode(), id, e.getMessage());
      }

      ScheduledJob job =
          new ScheduledJob(definition, generations.incrementAndGet(), now, schedule, scheduleError);
      job.nextRun = schedule == null ? null : calculator.nextRun(schedule, now);
      store.put(job);

      JobSnapshot previous = restored.remove(id);
      List<ExecutionSnapshot> previousResults = restoredResults.remove(id);
      if (!replacing && previous != null) {
        carryOver(job, previous, previousResults);
      }

      persistLocked();
      wakeUp.signalAll();
      log.info(
          "Added job: {} ({}) - {}: {}",
          definition.name(),
          id,
          definition.scheduleType().id(),
          definition.scheduleValue());
      return true;
    } finally {
      lock.unlock();
    }
  }

  /** Exclude a job from dispatch. Returns false for unknown ids. */
  public boolean pauseJob(String jobId) {
    lock.lock();
    try {
      Optional<ScheduledJob> job = store.get(jobId);
      if (job.isEmpty()) {
        return false;
      }
      job.get().enabled = false;
      persistLocked();
      log.info("Paused job: {}", jobId);
      return true;
    } finally {
      lock.unlock();
    }
  }

  /** Re-enable a job and compute a fresh next run from now. Returns false for unknown ids. */
  public boolean resumeJob(String jobId) {
    lock.lock();
    try {
      Optional<ScheduledJob> found = store.get(jobId);
      if (found.isEmpty()) {
        return false;
      }
      ScheduledJob job = found.get();
      job.enabled = true;
      if (job.schedule != null) {
        job.nextRun = calculator.nextRun(job.schedule, clock.instant());
      }
      persistLocked();
      wakeUp.signalAll();
      log.info("Resumed job: {}", jobId);
      return true;
    } finally {
      lock.unlock();
    }
  }

  /** Delete a job and its history, or a restored descriptor that was never re-registered. */
  public boolean removeJob(String jobId) {
    lock.lock();
    try {
      boolean removed = store.remove(jobId).isPresent();
      removed |= restored.remove(jobId) != null;
      restoredResults.remove(jobId);
      if (!removed) {
        return false;
      }
      persistLocked();
      log.info("Removed job: {}", jobId);
      return true;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Run a job immediately on a background thread, outside its schedule. The regular next run is
   * left untouched. Paused jobs can be run this way too. Returns false for unknown ids and while
   * the job already has an execution in flight.
   */
  public boolean executeNow(String jobId) {
    lock.lock();
    try {
      Optional<ScheduledJob> job = store.get(jobId);
      if (job.isEmpty()) {
        return false;
      }
      if (!dispatch(job.get(), false)) {
        log.warn("Job {} is already executing, manual trigger ignored", jobId);
        return false;
      }
      log.info("Manually triggered job: {}", jobId);
      return true;
    } finally {
      lock.unlock();
    }
  }

  // --------------------------------------------------------------------
  // Dispatch loop
  // --------------------------------------------------------------------

  /**
   * Start the dispatch loop. Next runs of enabled jobs are recomputed from now.
   *
   * @throws StateException when jobs restored from the persisted state have no registered body
   */
  public void start() {
    lock.lock();
    try {
      if (running) {
        log.warn("Scheduler is already running");
        return;
      }
      if (!restored.isEmpty()) {
        List<String> missing = new ArrayList<>(restored.keySet());
        throw new StateException(
                "Jobs restored from persisted state were not registered again: " + missing)
            .with("jobs", missing);
      }

      Instant now = clock.instant();
      for (ScheduledJob job : store.all()) {
        if (job.enabled && job.schedule != null) {
          job.nextRun = calculator.nextRun(job.schedule, now);
        }
      }
      running = true;
      epoch++;
      persistLocked();

      Thread thread = new Thread(this::runLoop, "job-scheduler");
      thread.setDaemon(true);
      loopThread = thread;
      thread.start();
    } finally {
      lock.unlock();
    }
    log.info("Scheduler started");
  }

  /**
   * Stop the dispatch loop and wait for it up to the configured stop timeout. In-flight executions
   * are not cancelled; their results are discarded when they eventually finish.
   */
  public void stop() {
    Thread thread;
    lock.lock();
    try {
      if (!running) {
        return;
      }
      running = false;
      epoch++;
      thread = loopThread;
      loopThread = null;
      wakeUp.signalAll();
    } finally {
      lock.unlock();
    }

    if (thread != null) {
      try {
        thread.join(settings.stopTimeout().toMillis());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      if (thread.isAlive()) {
        log.warn("Dispatch loop did not stop within {}", settings.stopTimeout());
        thread.interrupt();
      }
    }
    log.info("Scheduler stopped");
  }

  public boolean isRunning() {
    return running;
  }

  private void runLoop() {
    lock.lock();
    try {
      while (running) {
        try {
          Duration wait = dispatchDueJobs();
          wakeUp.await(wait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          return;
        } catch (RuntimeException e) {
          log.error(
              "[{}] Scheduler loop error, backing off for {}",
              PriceTrackerErrorCode.DISPATCH_ERROR,
              settings.errorBackoff(),
              e);
          try {
            backOff(settings.errorBackoff());
          } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return;
          }
        }
      }
    } finally {
      lock.unlock();
    }
  }

  /** Dispatch every due job and return how long the loop may wait before the next check. */
  private Duration dispatchDueJobs() {
    Instant now = clock.instant();
    List<ScheduledJob> due =
        store.all().stream()
            .filter(j -> j.enabled && j.nextRun != null && !now.isBefore(j.nextRun))
            .filter(j -> !inFlight.contains(j.id()))
            .sorted(DISPATCH_ORDER)
            .collect(Collectors.toList());
    for (ScheduledJob job : due) {
      dispatch(job, true);
    }

    Duration wait = settings.tickInterval();
    for (ScheduledJob job : store.all()) {
      if (job.enabled && job.nextRun != null && !inFlight.contains(job.id())) {
        Duration untilDue = Duration.between(now, job.nextRun);
        if (untilDue.compareTo(wait) < 0) {
          wait = untilDue;
        }
      }
    }
    return wait.compareTo(MIN_WAIT) < 0 ? MIN_WAIT : wait;
  }

  /** Must hold {@link #lock}. Returns false when the job is already in flight. */
  private boolean dispatch(ScheduledJob job, boolean scheduled) {
    if (!inFlight.add(job.id())) {
      return false;
    }
    long dispatchEpoch = epoch;
    int executionCount = (int) job.runCount + 1;
    try {
      dispatchExecutor.execute(() -> runJob(job, scheduled, dispatchEpoch, executionCount));
      return true;
    } catch (RejectedExecutionException e) {
      inFlight.remove(job.id());
      log.error("Executor rejected job {}", job.id(), e);
      return false;
    }
  }

  private void runJob(ScheduledJob job, boolean scheduled, long dispatchEpoch, int count) {
    try {
      JobExecutionRecord record = runner.run(job.definition, count);
      commit(job, record, scheduled, dispatchEpoch);
    } finally {
      lock.lock();
      try {
        inFlight.remove(job.id());
        wakeUp.signalAll();
      } finally {
        lock.unlock();
      }
    }
  }

  private void commit(
      ScheduledJob job, JobExecutionRecord record, boolean scheduled, long dispatchEpoch) {
    lock.lock();
    try {
      Optional<ScheduledJob> current = store.get(job.id());
      if (current.isEmpty() || current.get().generation != job.generation) {
        log.debug("Discarding result of job {}: removed or re-registered meanwhile", job.id());
        return;
      }
      if (dispatchEpoch != epoch) {
        log.debug("Discarding result of job {}: scheduler was stopped or restarted", job.id());
        return;
      }

      job.lastRun = record.startTime();
      job.runCount++;
      if (record.succeeded()) {
        job.successCount++;
      } else {
        job.failureCount++;
      }
      if (scheduled && job.schedule != null) {
        job.nextRun = calculator.nextRun(job.schedule, clock.instant());
      }
      store.appendResult(job.id(), record);
      persistLocked();
    } finally {
      lock.unlock();
    }
  }

  private void backOff(Duration duration) throws InterruptedException {
    long remaining = duration.toNanos();
    while (running && remaining > 0) {
      remaining = wakeUp.awaitNanos(remaining);
    }
  }

  // --------------------------------------------------------------------
  // Status
  // --------------------------------------------------------------------

  public Optional<JobStatusView> getJobStatus(String jobId) {
    lock.lock();
    try {
      return store.get(jobId).map(this::viewOf);
    } finally {
      lock.unlock();
    }
  }

  public SchedulerStatusView getAllJobsStatus() {
    lock.lock();
    try {
      List<ScheduledJob> jobs = sortedJobs();
      Map<String, JobStatusView> views = new LinkedHashMap<>();
      for (ScheduledJob job : jobs) {
        views.put(job.id(), viewOf(job));
      }
      int enabled = (int) jobs.stream().filter(j -> j.enabled).count();
      return new SchedulerStatusView(
          jobs.size(), enabled, running, views, new ArrayList<>(restored.keySet()));
    } finally {
      lock.unlock();
    }
  }

  public SchedulerHealthView getSystemHealth() {
    lock.lock();
    try {
      List<ScheduledJob> jobs = sortedJobs();
      long runs = jobs.stream().mapToLong(j -> j.runCount).sum();
      long successes = jobs.stream().mapToLong(j -> j.successCount).sum();
      long failures = jobs.stream().mapToLong(j -> j.failureCount).sum();
      Instant uptimeStart =
          jobs.stream().map(j -> j.createdAt).min(Instant::compareTo).orElse(clock.instant());
      long unschedulable = jobs.stream().filter(j -> j.enabled && j.nextRun == null).count();
      return new SchedulerHealthView(
          running,
          jobs.size(),
          (int) jobs.stream().filter(j -> j.enabled).count(),
          runs,
          successes,
          failures,
          runs > 0 ? successes * 100.0 / runs : 0.0,
          uptimeStart,
          unschedulable);
    } finally {
      lock.unlock();
    }
  }

  private List<ScheduledJob> sortedJobs() {
    List<ScheduledJob> jobs = new ArrayList<>(store.all());
    jobs.sort(DISPATCH_ORDER);
    return jobs;
  }

  private JobStatusView viewOf(ScheduledJob job) {
    JobDefinition d = job.definition;
    return new JobStatusView(
        d.jobId(),
        d.name(),
        job.enabled,
        inFlight.contains(d.jobId()),
        d.scheduleType(),
        d.scheduleValue(),
        job.scheduleError,
        d.priority(),
        d.maxRetries(),
        d.retryDelay().toSeconds(),
        d.timeout().toSeconds(),
        job.createdAt,
        job.lastRun,
        job.nextRun,
        job.runCount,
        job.successCount,
        job.failureCount,
        job.successRate(),
        store.recentResults(d.jobId(), SchedulerSettings.STATUS_RECENT_RESULTS));
  }

  // --------------------------------------------------------------------
  // Persistence
  // --------------------------------------------------------------------

  private void loadState() {
    Optional<SchedulerState> state;
    try {
      state = repository.load();
    } catch (PersistenceException e) {
      log.error("[{}] Error loading scheduler state: {}", e.getCode(), e.getMessage());
      return;
    }
    if (state.isEmpty()) {
      return;
    }
    restored.putAll(state.get().jobs());
    state.get().jobResults().forEach((id, results) -> {
      if (restored.containsKey(id)) {
        restoredResults.put(id, results);
      }
    });
    log.info(
        "Loaded scheduler state with {} jobs; bodies must be registered again before start",
        restored.size());
  }

  private void carryOver(ScheduledJob job, JobSnapshot previous, List<ExecutionSnapshot> results) {
    job.lastRun = previous.lastRun();
    job.runCount = previous.runCount();
    job.successCount = previous.successCount();
    job.failureCount = previous.failureCount();
    if (results != null) {
      List<JobExecutionRecord> records = new ArrayList<>(results.size());
      results.forEach(r -> records.add(r.toRecord(job.id())));
      store.restoreResults(job.id(), records);
    }
    log.info(
        "Restored statistics of job {} from persisted state ({} runs)", job.id(), job.runCount);
  }

  private void persistLocked() {
    try {
      repository.save(snapshotLocked());
    } catch (PersistenceException e) {
      log.error("[{}] Error saving scheduler state: {}", e.getCode(), e.getMessage());
    } catch (RuntimeException e) {
      log.error(
          "[{}] Error saving scheduler state: {}",
          PriceTrackerErrorCode.PERSISTENCE_ERROR,
          e.toString());
    }
  }

  private SchedulerState snapshotLocked() {
    SchedulerState state = SchedulerState.empty();
    for (ScheduledJob job : sortedJobs()) {
      state.jobs().put(job.id(), snapshotOf(job));
      List<ExecutionSnapshot> results = new ArrayList<>();
      for (JobExecutionRecord r : store.recentResults(job.id(), settings.persistedHistorySize())) {
        results.add(ExecutionSnapshot.of(r));
      }
      state.jobResults().put(job.id(), results);
    }
    state.jobs().putAll(restored);
    state.jobResults().putAll(restoredResults);
    return state;
  }

  @SuppressWarnings("unchecked")
  private static JobSnapshot snapshotOf(ScheduledJob job) {
    JobDefinition d = job.definition;
    return new JobSnapshot(
        d.jobId(),
        d.name(),
        d.scheduleType(),
        d.scheduleValue(),
        d.priority(),
        d.maxRetries(),
        d.retryDelay().toSeconds(),
        d.timeout().toSeconds(),
        job.enabled,
        job.lastRun,
        job.nextRun,
        job.runCount,
        job.successCount,
        job.failureCount,
        job.createdAt,
        (List<Object>) JacksonUtility.toJsonSafe(d.args()),
        (Map<String, Object>) JacksonUtility.toJsonSafe(d.kwargs()));
  }

  @Override
  public void close() {
    stop();
    dispatchExecutor.shutdownNow();
    runner.close();
  }
}
