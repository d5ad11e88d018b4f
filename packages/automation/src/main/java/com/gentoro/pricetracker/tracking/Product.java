package com.gentoro.pricetracker.tracking;

/**
 * A product watched by the tracker.
 *
 * @param targetPrice price below which the owner wants to be notified, or {@code null}
 */
public record Product(
    long id, String name, String url, Double targetPrice, boolean notificationEnabled) {

  /** Products with a target price or notifications switched on are checked more often. */
  public boolean isPriority() {
    return targetPrice != null || notificationEnabled;
  }
}
