package com.gentoro.pricetracker;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.pricetracker.exception.ConfigurationException;
import com.gentoro.pricetracker.exception.StateException;
import com.gentoro.pricetracker.orchestrator.AutomationOrchestrator;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PriceTrackerTest {

  @TempDir Path tempDir;

  private Path writeConfig(String provider) throws IOException {
    Path stateFile = tempDir.resolve("data").resolve("scheduler_state.json");
    String yaml =
        "logging:\n"
            + "  level: INFO\n"
            + "backend:\n"
            + "  provider: '"
            + provider
            + "'\n"
            + "scheduler:\n"
            + "  tick-interval-ms: 100\n"
            + "  state-file: '"
            + stateFile
            + "'\n"
            + "monitor:\n"
            + "  sample-interval-seconds: 1\n"
            + "orchestrator:\n"
            + "  jobs:\n"
            + "    database_cleanup:\n"
            + "      enabled: false\n";
    Path file = tempDir.resolve("application.yaml");
    Files.writeString(file, yaml, StandardCharsets.UTF_8);
    return file;
  }

  @Test
  @DisplayName("initialize wires the backend and starts the orchestrator; shutdown stops it")
  void initializeAndShutdown() throws Exception {
    Path config = writeConfig("in-memory");
    PriceTracker app = new PriceTracker(new String[] {"--config", config.toString()});
    try {
      app.initialize();
      AutomationOrchestrator orchestrator = app.orchestrator();
      assertTrue(orchestrator.isRunning());
      assertEquals(5, orchestrator.listAllJobs().totalJobs());
      assertTrue(orchestrator.getJobStatus(AutomationOrchestrator.DATABASE_CLEANUP).isEmpty());
      assertEquals(Integer.valueOf(2), orchestrator.getSystemStatus().trackedProducts());
      assertTrue(Files.exists(tempDir.resolve("data").resolve("scheduler_state.json")));
    } finally {
      app.shutdown();
    }
    assertFalse(app.orchestrator().isRunning());
    assertFalse(app.scheduler().isRunning());
    app.shutdown();
  }

  @Test
  @DisplayName("An unknown backend id fails initialization")
  void unknownBackend() throws Exception {
    Path config = writeConfig("postgres");
    PriceTracker app = new PriceTracker(new String[] {"--config=" + config});
    assertThrows(ConfigurationException.class, app::initialize);
  }

  @Test
  @DisplayName("Accessors fail before initialize")
  void notInitialized() {
    PriceTracker app = new PriceTracker(new String[0]);
    assertThrows(StateException.class, app::configuration);
    assertThrows(StateException.class, app::orchestrator);
  }
}
