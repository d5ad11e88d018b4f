package com.gentoro.pricetracker.scheduler;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.gentoro.pricetracker.exception.ScheduleParseException;
import java.util.Locale;

/** Supported cadences. The id is the form written to the persisted state. */
public enum ScheduleType {
  /** Every {@code n} seconds. */
  INTERVAL_SECONDS("interval"),
  /** Every {@code n} minutes. */
  INTERVAL_MINUTES("minutes"),
  /** Every hour; the schedule value is ignored. */
  HOURLY("hourly"),
  /** Once a day at {@code HH:mm}. */
  DAILY("daily"),
  /** Once a week at {@code <weekday> HH:mm}, e.g. {@code sunday 09:00}. */
  WEEKLY("weekly");

  private final String id;

  ScheduleType(String id) {
    this.id = id;
  }

  @JsonValue
  public String id() {
    return id;
  }

  @JsonCreator
  public static ScheduleType fromId(String id) {
    if (id != null) {
      String normalized = id.trim().toLowerCase(Locale.ROOT);
      for (ScheduleType type : values()) {
        if (type.id.equals(normalized) || type.name().toLowerCase(Locale.ROOT).equals(normalized)) {
          return type;
        }
      }
    }
    throw new ScheduleParseException("Unsupported schedule type: " + id);
  }
}
