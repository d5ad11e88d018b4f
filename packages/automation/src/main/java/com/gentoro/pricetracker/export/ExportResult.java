package com.gentoro.pricetracker.export;

import java.util.List;
import java.util.Map;

/**
 * Outcome of an export run.
 *
 * @param targets success flag per export target, e.g. {@code excel}
 * @param files files written by the run
 */
public record ExportResult(Map<String, Boolean> targets, List<String> files) {

  public boolean allSucceeded() {
    return targets.values().stream().allMatch(Boolean::booleanValue);
  }
}
