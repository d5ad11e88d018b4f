package com.gentoro.pricetracker.scheduler;

/**
 * Relative importance of a job. Used to order dispatch and status listings; a higher priority
 * never preempts a running job.
 */
public enum JobPriority {
  LOW,
  MEDIUM,
  HIGH,
  CRITICAL
}
