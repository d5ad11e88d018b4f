package com.gentoro.pricetracker.export;

import java.time.Instant;
import java.util.Map;

/** Storage and export side of the price tracker. */
public interface DataManager {

  ExportResult runDailyExport();

  /** Price analytics over the last {@code days}, rendered as-is in the weekly report. */
  Map<String, Object> getAnalytics(int days);

  /**
   * Delete price history recorded before {@code cutoff}.
   *
   * @return number of deleted records
   */
  int deletePriceHistoryOlderThan(Instant cutoff);

  /** Status of the export targets, for status reporting. */
  Map<String, Object> exportStatus();
}
