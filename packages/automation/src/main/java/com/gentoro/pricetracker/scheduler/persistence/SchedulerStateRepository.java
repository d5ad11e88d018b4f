package com.gentoro.pricetracker.scheduler.persistence;

import com.gentoro.pricetracker.exception.PersistenceException;
import java.util.Optional;

/** Durable storage for {@link SchedulerState}. */
public interface SchedulerStateRepository {
  /**
   * @throws PersistenceException when the snapshot cannot be written
   */
  void save(SchedulerState state);

  /**
   * @return the last saved snapshot, or empty when nothing was saved yet
   * @throws PersistenceException when a snapshot exists but cannot be read
   */
  Optional<SchedulerState> load();
}
