package com.gentoro.pricetracker.monitor;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Severity of a health check, ordered from best to worst apart from {@link #UNKNOWN}. */
public enum HealthState {
  HEALTHY,
  WARNING,
  CRITICAL,
  UNKNOWN;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static HealthState fromValue(String value) {
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
