package com.gentoro.pricetracker.notification;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum NotificationPriority {
  LOW,
  MEDIUM,
  HIGH,
  URGENT;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
