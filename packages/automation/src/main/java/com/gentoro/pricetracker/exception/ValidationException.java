package com.gentoro.pricetracker.exception;

/** Invalid input supplied by a caller, e.g. a malformed job definition. */
public class ValidationException extends PriceTrackerException {
  public ValidationException(String message) {
    super(PriceTrackerErrorCode.VALIDATION_ERROR, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(PriceTrackerErrorCode.VALIDATION_ERROR, message, cause);
  }
}
