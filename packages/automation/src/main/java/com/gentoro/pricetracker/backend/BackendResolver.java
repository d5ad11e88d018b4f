package com.gentoro.pricetracker.backend;

import com.gentoro.pricetracker.backend.spi.BackendProvider;
import com.gentoro.pricetracker.exception.ConfigurationException;
import com.gentoro.pricetracker.logging.LoggingService;
import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;
import java.util.stream.Collectors;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;

/**
 * Picks the {@link BackendProvider} named by {@code backend.provider}. Without that key the only
 * available provider is used.
 */
public final class BackendResolver {
  private static final Logger log = LoggingService.getLogger(BackendResolver.class);

  static final String PROVIDER_KEY = "backend.provider";

  private BackendResolver() {}

  /** Resolve among the providers registered through {@link ServiceLoader}. */
  public static BackendProvider resolve(Configuration configuration) {
    return resolve(configuration, ServiceLoader.load(BackendProvider.class));
  }

  /**
   * @throws ConfigurationException when the requested provider is missing or unavailable, or
   *     when no provider is requested and there is not exactly one available
   */
  public static BackendProvider resolve(
      Configuration configuration, Iterable<BackendProvider> providers) {
    List<BackendProvider> available = new ArrayList<>();
    for (BackendProvider provider : providers) {
      if (provider.isAvailable(configuration)) {
        available.add(provider);
      } else {
        log.debug("Backend provider {} is not available", provider.id());
      }
    }
    String ids = available.stream().map(BackendProvider::id).collect(Collectors.joining(", "));

    String requested = StringUtils.trimToNull(configuration.getString(PROVIDER_KEY, null));
    if (requested == null) {
      if (available.size() == 1) {
        log.info("Using backend provider {}", available.get(0).id());
        return available.get(0);
      }
      throw new ConfigurationException(
          available.isEmpty()
              ? "No backend provider available"
              : "Several backend providers available (" + ids + "), set " + PROVIDER_KEY);
    }

    for (BackendProvider provider : available) {
      if (provider.id().equalsIgnoreCase(requested)) {
        log.info("Using backend provider {}", provider.id());
        return provider;
      }
    }
    throw new ConfigurationException(
            "Backend provider '" + requested + "' not found or not available")
        .with("available", ids);
  }
}
