package com.gentoro.pricetracker.scheduler;

import com.gentoro.pricetracker.exception.ScheduleParseException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Objects;
import java.util.Optional;

/**
 * Maps a schedule to its next trigger instant. {@code now} is always passed in, so results only
 * depend on the arguments and the configured zone.
 */
public final class TimeCalculator {
  private final ZoneId zone;

  public TimeCalculator(ZoneId zone) {
    this.zone = Objects.requireNonNull(zone, "zone");
  }

  /**
   * Next trigger for a raw schedule definition.
   *
   * @return the instant, or empty when the value cannot be parsed for {@code type}
   */
  public Optional<Instant> nextRun(ScheduleType type, String value, Instant now) {
    try {
      return Optional.of(nextRun(Schedule.parse(type, value), now));
    } catch (ScheduleParseException e) {
      return Optional.empty();
    }
  }

  public Instant nextRun(Schedule schedule, Instant now) {
    return schedule.nextAfter(now, zone);
  }

  public ZoneId zone() {
    return zone;
  }
}
