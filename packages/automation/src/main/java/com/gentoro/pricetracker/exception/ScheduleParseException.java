package com.gentoro.pricetracker.exception;

/** A schedule value could not be parsed for its schedule type. */
public class ScheduleParseException extends PriceTrackerException {
  public ScheduleParseException(String message) {
    super(PriceTrackerErrorCode.SCHEDULE_PARSE_ERROR, message);
  }

  public ScheduleParseException(String message, Throwable cause) {
    super(PriceTrackerErrorCode.SCHEDULE_PARSE_ERROR, message, cause);
  }
}
