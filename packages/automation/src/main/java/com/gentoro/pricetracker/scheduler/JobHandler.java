package com.gentoro.pricetracker.scheduler;

/** Executable body of a job. Implementations are registered with the scheduler, never persisted. */
@FunctionalInterface
public interface JobHandler {
  /**
   * Run the job once.
   *
   * @return an optional result payload, recorded verbatim on the execution record
   * @throws Exception any failure; it is recorded on the execution and never reaches the
   *     dispatch loop
   */
  Object execute(JobContext ctx) throws Exception;
}
