package com.gentoro.pricetracker.exception;

/** A job body raised an error. The original exception is kept as the cause. */
public class JobExecutionException extends PriceTrackerException {
  public JobExecutionException(String message) {
    super(PriceTrackerErrorCode.JOB_EXECUTION_ERROR, message);
  }

  public JobExecutionException(String message, Throwable cause) {
    super(PriceTrackerErrorCode.JOB_EXECUTION_ERROR, message, cause);
  }
}
