package com.gentoro.pricetracker.scheduler;

import java.util.List;
import java.util.Map;

/**
 * Consistent snapshot of every job. {@code jobs} iterates in dispatch order: priority first,
 * then registration time. {@code pendingRegistration} lists ids restored from the persisted
 * state whose body has not been registered again.
 */
public record SchedulerStatusView(
    int totalJobs,
    int enabledJobs,
    boolean running,
    Map<String, JobStatusView> jobs,
    List<String> pendingRegistration) {}
