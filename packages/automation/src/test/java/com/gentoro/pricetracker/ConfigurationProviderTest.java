package com.gentoro.pricetracker;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.pricetracker.exception.ConfigurationException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.Configuration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigurationProviderTest {

  @TempDir Path tempDir;

  @Test
  void bundledDefaults() {
    Configuration config = new ConfigurationProvider(null).config();
    assertEquals(1000L, config.getLong("scheduler.tick-interval-ms"));
    assertEquals("UTC", config.getString("scheduler.time-zone"));
    assertTrue(config.getBoolean("orchestrator.jobs.weekly_report.enabled"));
  }

  @Test
  void explicitFile() throws Exception {
    Path file = tempDir.resolve("custom.yaml");
    Files.writeString(file, "scheduler:\n  history-size: 25\n");
    Configuration config = new ConfigurationProvider(file.toString()).config();
    assertEquals(25, config.getInt("scheduler.history-size"));
  }

  @Test
  void missingFile() {
    assertThrows(
        ConfigurationException.class,
        () -> new ConfigurationProvider(tempDir.resolve("nope.yaml").toString()));
  }
}
