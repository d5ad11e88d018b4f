package com.gentoro.pricetracker.scheduler;

import java.util.List;
import java.util.Map;

/** Context passed to {@link JobHandler} with the bound arguments and a cancellation flag. */
public final class JobContext {
  private final String jobId;
  private final String jobName;
  private final int executionCount;
  private final List<Object> args;
  private final Map<String, Object> kwargs;
  private final CancelChecker cancelChecker;

  /** Functional interface checked by handlers to cooperatively stop once abandoned. */
  @FunctionalInterface
  public interface CancelChecker {
    boolean isCancelled();
  }

  public JobContext(
      String jobId,
      String jobName,
      int executionCount,
      List<Object> args,
      Map<String, Object> kwargs,
      CancelChecker cancelChecker) {
    this.jobId = jobId;
    this.jobName = jobName;
    this.executionCount = executionCount;
    this.args = args;
    this.kwargs = kwargs;
    this.cancelChecker = cancelChecker;
  }

  public String jobId() {
    return jobId;
  }

  public String jobName() {
    return jobName;
  }

  /** 1-based ordinal of this execution. */
  public int executionCount() {
    return executionCount;
  }

  public List<Object> args() {
    return args;
  }

  public Map<String, Object> kwargs() {
    return kwargs;
  }

  /**
   * True once the scheduler has given up on this execution (timeout or shutdown). Long running
   * bodies should poll it; the scheduler cannot stop them otherwise.
   */
  public boolean isCancelled() {
    return cancelChecker != null && cancelChecker.isCancelled();
  }
}
