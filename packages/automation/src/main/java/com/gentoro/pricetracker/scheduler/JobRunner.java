package com.gentoro.pricetracker.scheduler;

import com.gentoro.pricetracker.exception.ExceptionUtil;
import com.gentoro.pricetracker.exception.JobExecutionException;
import com.gentoro.pricetracker.exception.JobTimeoutException;
import com.gentoro.pricetracker.exception.PriceTrackerException;
import com.gentoro.pricetracker.logging.LoggingService;
import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;

/**
 * Runs one job body on its own thread and waits for it at most the job's timeout.
 *
 * <p>Timeouts are best effort. When the wait expires the execution is reported as failed, the
 * body thread is interrupted and {@link JobContext#isCancelled()} turns true, but a body that
 * ignores both keeps running and keeps holding whatever it holds until it returns on its own.
 * Body threads are daemons, so a runaway body never blocks JVM exit.
 */
public final class JobRunner implements AutoCloseable {
  private static final Logger log = LoggingService.getLogger(JobRunner.class);

  private final Clock clock;
  private final ExecutorService bodyExecutor;

  public JobRunner(Clock clock) {
    this.clock = clock;
    AtomicInteger counter = new AtomicInteger();
    this.bodyExecutor =
        Executors.newCachedThreadPool(
            r -> {
              Thread t = new Thread(r, "job-body-" + counter.incrementAndGet());
              t.setDaemon(true);
              return t;
            });
  }

  /**
   * Execute {@code definition}'s body once. Never throws: every outcome is returned as a
   * finished {@link JobExecutionRecord}.
   */
  public JobExecutionRecord run(JobDefinition definition, int executionCount) {
    JobExecutionRecord record =
        JobExecutionRecord.running(definition.jobId(), clock.instant(), executionCount);
    AtomicBoolean abandoned = new AtomicBoolean();
    JobContext ctx =
        new JobContext(
            definition.jobId(),
            definition.name(),
            executionCount,
            definition.args(),
            definition.kwargs(),
            () -> abandoned.get() || Thread.currentThread().isInterrupted());

    log.info("Starting job: {} ({})", definition.name(), definition.jobId());
    Future<Object> future;
    try {
      future = bodyExecutor.submit(() -> definition.handler().execute(ctx));
    } catch (RejectedExecutionException e) {
      return failed(record, new JobExecutionException("Job runner is shut down", e));
    }

    Duration timeout = definition.timeout();
    try {
      Object result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      JobExecutionRecord done = record.completed(clock.instant(), result);
      log.info(
          "Job completed successfully: {} ({}s)",
          definition.name(),
          String.format(Locale.ROOT, "%.2f", done.durationSeconds()));
      return done;
    } catch (TimeoutException e) {
      abandoned.set(true);
      future.cancel(true);
      return failed(
          record,
          new JobTimeoutException("Job execution timed out after " + describe(timeout)));
    } catch (ExecutionException e) {
      return failed(
          record,
          new JobExecutionException(
              ExceptionUtil.extractErrorMessage(e), ExceptionUtil.unwrap(e)));
    } catch (InterruptedException e) {
      abandoned.set(true);
      future.cancel(true);
      Thread.currentThread().interrupt();
      return failed(record, new JobExecutionException("Job execution was interrupted", e));
    }
  }

  private JobExecutionRecord failed(JobExecutionRecord running, PriceTrackerException error) {
    log.error("Job failed: {} [{}] - {}", running.jobId(), error.getCode(), error.getMessage());
    if (error.getCause() != null && log.isDebugEnabled()) {
      log.debug(
          "Job {} failure trace: {}",
          running.jobId(),
          ExceptionUtil.formatCompactStackTrace(error.getCause()));
    }
    return running.failed(clock.instant(), error.getMessage());
  }

  private static String describe(Duration timeout) {
    long millis = timeout.toMillis();
    return millis % 1000 == 0 ? (millis / 1000) + " seconds" : millis + " ms";
  }

  @Override
  public void close() {
    bodyExecutor.shutdownNow();
  }
}
