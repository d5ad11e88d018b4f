package com.gentoro.pricetracker.exception;

/** Stable error codes attached to every {@link PriceTrackerException}. */
public enum PriceTrackerErrorCode {
  UNKNOWN,
  CONFIGURATION_ERROR,
  VALIDATION_ERROR,
  STATE_ERROR,
  SCHEDULE_PARSE_ERROR,
  JOB_TIMEOUT,
  JOB_EXECUTION_ERROR,
  DISPATCH_ERROR,
  PERSISTENCE_ERROR,
  SHUTDOWN_ERROR
}
