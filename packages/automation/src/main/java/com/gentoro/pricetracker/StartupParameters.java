package com.gentoro.pricetracker;

import com.gentoro.pricetracker.exception.ConfigurationException;
import java.util.HashMap;
import java.util.Map;

/** Parses {@code --name value} pairs from the command line. */
public class StartupParameters {
  private final Map<String, String> parameters = new HashMap<>();

  public StartupParameters(String[] args) {
    if (args == null) {
      return;
    }
    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if (!arg.startsWith("--")) {
        throw new ConfigurationException("Unexpected argument: " + arg);
      }
      String name = arg.substring(2);
      int eq = name.indexOf('=');
      if (eq > 0) {
        parameters.put(name.substring(0, eq), name.substring(eq + 1));
      } else if (i + 1 < args.length && !args[i + 1].startsWith("--")) {
        parameters.put(name, args[++i]);
      } else {
        parameters.put(name, "true");
      }
    }
  }

  public String getParameter(String name, String defaultValue) {
    return parameters.getOrDefault(name, defaultValue);
  }

  /** Location of the YAML configuration file, or {@code null} to use the bundled defaults. */
  public String configFile() {
    return parameters.get("config");
  }
}
