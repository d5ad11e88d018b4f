package com.gentoro.pricetracker.exception;

/** Reading or writing the scheduler state snapshot failed. */
public class PersistenceException extends PriceTrackerException {
  public PersistenceException(String message) {
    super(PriceTrackerErrorCode.PERSISTENCE_ERROR, message);
  }

  public PersistenceException(String message, Throwable cause) {
    super(PriceTrackerErrorCode.PERSISTENCE_ERROR, message, cause);
  }
}
