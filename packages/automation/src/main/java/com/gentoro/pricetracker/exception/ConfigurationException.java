package com.gentoro.pricetracker.exception;

/** Missing or invalid application configuration. */
public class ConfigurationException extends PriceTrackerException {
  public ConfigurationException(String message) {
    super(PriceTrackerErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(PriceTrackerErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
