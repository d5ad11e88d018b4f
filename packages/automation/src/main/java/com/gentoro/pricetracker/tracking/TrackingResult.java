package com.gentoro.pricetracker.tracking;

/** Counts of one tracking pass. */
public record TrackingResult(int updated, int failed, int total) {}
