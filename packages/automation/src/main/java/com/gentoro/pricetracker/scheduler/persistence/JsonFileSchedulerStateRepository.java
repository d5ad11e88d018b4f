package com.gentoro.pricetracker.scheduler.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.pricetracker.exception.PersistenceException;
import com.gentoro.pricetracker.utility.JacksonUtility;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.Optional;

/**
 * Stores the scheduler state as a pretty-printed JSON document. Writes go to a sibling temp file
 * which then replaces the target, so readers never see a half-written snapshot.
 */
public final class JsonFileSchedulerStateRepository implements SchedulerStateRepository {
  private final Path file;
  private final ObjectMapper mapper = JacksonUtility.getJsonMapper();

  public JsonFileSchedulerStateRepository(Path file) {
    this.file = Objects.requireNonNull(file, "file").toAbsolutePath();
  }

  @Override
  public void save(SchedulerState state) {
    Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
    try {
      Files.createDirectories(file.getParent());
      mapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), state);
      try {
        Files.move(
            tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (IOException e) {
      throw new PersistenceException("Could not write scheduler state to " + file, e);
    }
  }

  @Override
  public Optional<SchedulerState> load() {
    if (!Files.exists(file)) {
      return Optional.empty();
    }
    try {
      return Optional.of(mapper.readValue(file.toFile(), SchedulerState.class));
    } catch (IOException e) {
      throw new PersistenceException("Could not read scheduler state from " + file, e);
    }
  }

  public Path file() {
    return file;
  }
}
