package com.gentoro.pricetracker.scheduler;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.pricetracker.exception.ValidationException;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class JobDefinitionTest {

  private static final JobHandler NOOP = ctx -> null;

  @Test
  @DisplayName("Defaults match the documented job defaults")
  void defaults() {
    JobDefinition d =
        JobDefinition.builder("a", "A", NOOP).schedule(ScheduleType.HOURLY, "").build();
    assertEquals(JobPriority.MEDIUM, d.priority());
    assertEquals(3, d.maxRetries());
    assertEquals(Duration.ofSeconds(60), d.retryDelay());
    assertEquals(Duration.ofSeconds(300), d.timeout());
    assertTrue(d.enabled());
    assertTrue(d.args().isEmpty());
  }

  @Test
  @DisplayName("Arguments are bound at registration and copied")
  void argumentsAreCopied() {
    Map<String, Object> kwargs = new HashMap<>();
    kwargs.put("limit", 10);
    JobDefinition d =
        JobDefinition.builder("a", "A", NOOP)
            .schedule(ScheduleType.INTERVAL_SECONDS, 5)
            .args("x", 1)
            .kwargs(kwargs)
            .build();
    kwargs.put("limit", 99);
    assertEquals(10, d.kwargs().get("limit"));
    assertEquals(2, d.args().size());
    assertEquals("5", d.scheduleValue());
    assertThrows(UnsupportedOperationException.class, () -> d.args().add("y"));
  }

  @Test
  @DisplayName("Invalid definitions are rejected synchronously")
  void rejectsInvalid() {
    assertThrows(
        ValidationException.class,
        () ->
            JobDefinition.builder("a", "A", NOOP)
                .schedule(ScheduleType.HOURLY, "")
                .timeout(Duration.ZERO)
                .build());
    assertThrows(
        ValidationException.class,
        () -> JobDefinition.builder(" ", "A", NOOP).schedule(ScheduleType.HOURLY, "").build());
    assertThrows(
        ValidationException.class,
        () -> JobDefinition.builder("a", "", NOOP).schedule(ScheduleType.HOURLY, "").build());
    assertThrows(
        ValidationException.class,
        () -> JobDefinition.builder("a", "A", null).schedule(ScheduleType.HOURLY, "").build());
    assertThrows(ValidationException.class, () -> JobDefinition.builder("a", "A", NOOP).build());
    assertThrows(
        ValidationException.class,
        () ->
            JobDefinition.builder("a", "A", NOOP)
                .schedule(ScheduleType.HOURLY, "")
                .maxRetries(-1)
                .build());
  }
}
