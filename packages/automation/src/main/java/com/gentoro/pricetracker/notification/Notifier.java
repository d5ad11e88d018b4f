package com.gentoro.pricetracker.notification;

import java.util.Map;

/** Delivers notifications over one or more channels. */
public interface Notifier {

  /**
   * Send a notification to every configured channel.
   *
   * @return delivery outcome per channel name
   */
  Map<String, Boolean> send(String title, String message, NotificationPriority priority);

  /** Configuration and delivery statistics of the channels, for status reporting. */
  default Map<String, Object> status() {
    return Map.of();
  }
}
