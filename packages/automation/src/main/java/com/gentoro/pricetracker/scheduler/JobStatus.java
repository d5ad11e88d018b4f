package com.gentoro.pricetracker.scheduler;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Lifecycle state of a single job execution. */
public enum JobStatus {
  /** Execution accepted but not yet started. */
  PENDING,
  /** Job body is currently executing. */
  RUNNING,
  /** Job body returned normally. */
  COMPLETED,
  /** Job body raised an error or exceeded its timeout. */
  FAILED;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static JobStatus fromValue(String value) {
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
