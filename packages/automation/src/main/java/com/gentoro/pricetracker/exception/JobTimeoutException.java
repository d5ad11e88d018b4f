package com.gentoro.pricetracker.exception;

/** A job body did not return within its configured timeout. */
public class JobTimeoutException extends PriceTrackerException {
  public JobTimeoutException(String message) {
    super(PriceTrackerErrorCode.JOB_TIMEOUT, message);
  }

  public JobTimeoutException(String message, Throwable cause) {
    super(PriceTrackerErrorCode.JOB_TIMEOUT, message, cause);
  }
}
