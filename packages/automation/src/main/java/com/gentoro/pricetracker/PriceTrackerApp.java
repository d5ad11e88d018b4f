package com.gentoro.pricetracker;

import com.gentoro.pricetracker.logging.LoggingService;
import org.slf4j.Logger;

public class PriceTrackerApp {

  private static final Logger log = LoggingService.getLogger(PriceTrackerApp.class);

  public static void main(String[] args) {
    try {
      PriceTracker app = new PriceTracker(args);
      app.initialize();
      // Keep the automation running until shutdown signal
      app.waitShutdownSignal();
    } catch (Exception e) {
      log.error("Application failed to start", e);
      System.exit(1);
    }
  }
}
