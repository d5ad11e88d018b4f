package com.gentoro.pricetracker;

import com.gentoro.pricetracker.exception.ConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;

/**
 * Loads the application configuration. An explicit file wins; otherwise the {@code
 * application.yaml} bundled on the classpath is used.
 */
public class ConfigurationProvider {
  static final String DEFAULT_RESOURCE = "application.yaml";

  private final YAMLConfiguration config = new YAMLConfiguration();

  public ConfigurationProvider(String configFile) {
    if (configFile != null && !configFile.isBlank()) {
      Path path = Path.of(configFile);
      if (!Files.isRegularFile(path)) {
        throw new ConfigurationException("Configuration file not found: " + path.toAbsolutePath());
      }
      try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
        config.read(reader);
      } catch (IOException | org.apache.commons.configuration2.ex.ConfigurationException e) {
        throw new ConfigurationException("Could not read configuration file " + path, e);
      }
      return;
    }

    try (InputStream in =
        ConfigurationProvider.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
      if (in == null) {
        throw new ConfigurationException("Missing classpath resource " + DEFAULT_RESOURCE);
      }
      config.read(new InputStreamReader(in, StandardCharsets.UTF_8));
    } catch (IOException | org.apache.commons.configuration2.ex.ConfigurationException e) {
      throw new ConfigurationException("Could not read " + DEFAULT_RESOURCE, e);
    }
  }

  public Configuration config() {
    return config;
  }
}
