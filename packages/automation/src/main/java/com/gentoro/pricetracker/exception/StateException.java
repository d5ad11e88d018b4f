package com.gentoro.pricetracker.exception;

/** Operation not allowed in the current lifecycle state. */
public class StateException extends PriceTrackerException {
  public StateException(String message) {
    super(PriceTrackerErrorCode.STATE_ERROR, message);
  }

  public StateException(String message, Throwable cause) {
    super(PriceTrackerErrorCode.STATE_ERROR, message, cause);
  }
}
