package com.gentoro.pricetracker.orchestrator;

/** Lifecycle of {@link AutomationOrchestrator}: STOPPED, STARTING, RUNNING, STOPPING, STOPPED. */
public enum OrchestratorState {
  STOPPED,
  STARTING,
  RUNNING,
  STOPPING
}
