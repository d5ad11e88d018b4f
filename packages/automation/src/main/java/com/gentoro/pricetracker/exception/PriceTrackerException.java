package com.gentoro.pricetracker.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Root of the unchecked exception hierarchy. Carries a {@link PriceTrackerErrorCode} and an
 * optional context map that is included in log output.
 */
public class PriceTrackerException extends RuntimeException {
  private final PriceTrackerErrorCode code;
  private final Map<String, Object> context = new LinkedHashMap<>();

  public PriceTrackerException(PriceTrackerErrorCode code, String message) {
    super(message);
    this.code = code;
  }

  public PriceTrackerException(PriceTrackerErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public PriceTrackerErrorCode getCode() {
    return code;
  }

  public Map<String, Object> getContext() {
    return Collections.unmodifiableMap(context);
  }

  /** Attach a context entry; returns {@code this} for chaining at the throw site. */
  public PriceTrackerException with(String key, Object value) {
    context.put(key, value);
    return this;
  }

  @Override
  public String toString() {
    String base = getClass().getSimpleName() + "[" + code + "]: " + getMessage();
    return context.isEmpty() ? base : base + " " + context;
  }
}
