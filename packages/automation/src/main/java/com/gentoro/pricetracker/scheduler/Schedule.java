package com.gentoro.pricetracker.scheduler;

import com.gentoro.pricetracker.exception.ScheduleParseException;
import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.TemporalAdjusters;
import java.util.Locale;
import java.util.Objects;
import org.apache.commons.lang3.StringUtils;

/**
 * A parsed, validated schedule. Instances are immutable and compute trigger instants without
 * reading the wall clock.
 */
public final class Schedule {
  private final ScheduleType type;
  private final String value;
  private final Duration interval;
  private final LocalTime time;
  private final DayOfWeek day;

  private Schedule(
      ScheduleType type, String value, Duration interval, LocalTime time, DayOfWeek day) {
    this.type = type;
    this.value = value;
    this.interval = interval;
    this.time = time;
    this.day = day;
  }

  /**
   * Parse a schedule value for the given type.
   *
   * @throws ScheduleParseException when the value is missing or malformed
   */
  public static Schedule parse(ScheduleType type, String value) {
    Objects.requireNonNull(type, "type");
    String trimmed = StringUtils.trimToEmpty(value);
    switch (type) {
      case INTERVAL_SECONDS:
        return new Schedule(
            type, trimmed, Duration.ofSeconds(parseCount(type, trimmed)), null, null);
      case INTERVAL_MINUTES:
        return new Schedule(
            type, trimmed, Duration.ofMinutes(parseCount(type, trimmed)), null, null);
      case HOURLY:
        return new Schedule(type, trimmed, Duration.ofHours(1), null, null);
      case DAILY:
        return new Schedule(type, trimmed, null, parseTime(trimmed), null);
      case WEEKLY:
        String[] parts = trimmed.split("\\s+");
        if (parts.length != 2) {
          throw new ScheduleParseException(
              "Weekly schedule must look like '<weekday> HH:mm', got '" + value + "'");
        }
        return new Schedule(type, trimmed, null, parseTime(parts[1]), parseDay(parts[0]));
      default:
        throw new ScheduleParseException("Unsupported schedule type: " + type);
    }
  }

  /** Next trigger strictly after {@code now}; daily and weekly slots are read in {@code zone}. */
  public Instant nextAfter(Instant now, ZoneId zone) {
    switch (type) {
      case INTERVAL_SECONDS:
      case INTERVAL_MINUTES:
      case HOURLY:
        return now.plus(interval);
      case DAILY:
        {
          ZonedDateTime local = now.atZone(zone);
          ZonedDateTime candidate = local.with(time);
          if (!candidate.toInstant().isAfter(now)) {
            candidate = local.plusDays(1).with(time);
          }
          return candidate.toInstant();
        }
      case WEEKLY:
        {
          ZonedDateTime local = now.atZone(zone);
          ZonedDateTime candidate = local.with(TemporalAdjusters.nextOrSame(day)).with(time);
          if (!candidate.toInstant().isAfter(now)) {
            candidate = candidate.plusWeeks(1);
          }
          return candidate.toInstant();
        }
      default:
        throw new IllegalStateException("Unhandled schedule type " + type);
    }
  }

  public ScheduleType type() {
    return type;
  }

  public String value() {
    return value;
  }

  private static long parseCount(ScheduleType type, String value) {
    long count;
    try {
      count = Long.parseLong(value);
    } catch (NumberFormatException e) {
      throw new ScheduleParseException(
          "Schedule type '" + type.id() + "' needs a whole number, got '" + value + "'", e);
    }
    if (count <= 0) {
      throw new ScheduleParseException(
          "Schedule type '" + type.id() + "' needs a positive count, got " + count);
    }
    return count;
  }

  private static LocalTime parseTime(String value) {
    String[] hm = value.split(":");
    if (hm.length != 2) {
      throw new ScheduleParseException("Expected time as HH:mm, got '" + value + "'");
    }
    try {
      return LocalTime.of(Integer.parseInt(hm[0].trim()), Integer.parseInt(hm[1].trim()));
    } catch (NumberFormatException | DateTimeException e) {
      throw new ScheduleParseException("Expected time as HH:mm, got '" + value + "'", e);
    }
  }

  private static DayOfWeek parseDay(String value) {
    try {
      return DayOfWeek.valueOf(value.toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new ScheduleParseException("Unknown weekday '" + value + "'", e);
    }
  }

  @Override
  public String toString() {
    return type.id() + (value.isEmpty() ? "" : ": " + value);
  }
}
