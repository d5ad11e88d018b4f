package com.gentoro.pricetracker.notification;

import com.gentoro.pricetracker.logging.LoggingService;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;

/** Writes notifications to the application log. Used when no other channel is configured. */
public class LoggingNotifier implements Notifier {
  private static final Logger log = LoggingService.getLogger(LoggingNotifier.class);
  static final String CHANNEL = "log";

  private final AtomicLong sent = new AtomicLong();

  @Override
  public Map<String, Boolean> send(String title, String message, NotificationPriority priority) {
    if (priority == NotificationPriority.URGENT || priority == NotificationPriority.HIGH) {
      log.warn("[{}] {}\n{}", priority.value(), title, message);
    } else {
      log.info("[{}] {}\n{}", priority.value(), title, message);
    }
    sent.incrementAndGet();
    return Map.of(CHANNEL, true);
  }

  @Override
  public Map<String, Object> status() {
    Map<String, Object> status = new LinkedHashMap<>();
    status.put("channels", List.of(CHANNEL));
    status.put("sent", sent.get());
    return status;
  }
}
