package com.gentoro.pricetracker.backend.spi;

import com.gentoro.pricetracker.export.DataManager;
import com.gentoro.pricetracker.notification.Notifier;
import com.gentoro.pricetracker.tracking.Tracker;
import java.util.Optional;
import org.apache.commons.configuration2.Configuration;

/**
 * Service Provider Interface for the collaborators driven by the automation core.
 *
 * <p>Implementations must register using ServiceLoader by adding their fully qualified class name
 * to: META-INF/services/com.gentoro.pricetracker.backend.spi.BackendProvider
 */
public interface BackendProvider {
  /** Unique provider id used in configuration ({@code backend.provider}). */
  String id();

  /** Whether the provider can operate in the current runtime (dependencies present, enabled). */
  default boolean isAvailable(Configuration configuration) {
    return true;
  }

  Tracker createTracker(Configuration configuration);

  DataManager createDataManager(Configuration configuration);

  /** Notification channels; when empty, notifications are written to the log. */
  default Optional<Notifier> createNotifier(Configuration configuration) {
    return Optional.empty();
  }
}
