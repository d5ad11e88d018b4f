package com.gentoro.pricetracker.tracking;

import java.util.List;

/** Fetches current prices for tracked products. */
public interface Tracker {

  /**
   * Refresh the prices of the given products.
   *
   * @param productIds products to refresh; empty means every active product
   */
  TrackingResult runTracking(List<Long> productIds);

  /** Active tracked products. */
  List<Product> getTrackedProducts();
}
