package com.finrag.config;

import com.finrag.exception.ConfigException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Command line arguments of the form {@code --name=value}. A bare {@code --flag} is stored as
 * {@code "true"}.
 */
public final class StartupParameters {
  private final Map<String, String> parameters = new LinkedHashMap<>();

  public StartupParameters(String[] args) {
    if (args == null) return;
    for (String arg : args) {
      if (arg == null || arg.isBlank()) continue;
      if (!arg.startsWith("--") || arg.length() == 2) {
        throw new ConfigException("Unrecognized argument: " + arg + " (expected --name=value)");
      }
      String body = arg.substring(2);
      int eq = body.indexOf('=');
      if (eq < 0) {
        parameters.put(body, "true");
      } else {
        parameters.put(body.substring(0, eq), body.substring(eq + 1));
      }
    }
  }

  public String getParameter(String name) {
    return parameters.get(name);
  }

  public String getParameter(String name, String defaultValue) {
    return parameters.getOrDefault(name, defaultValue);
  }

  /** Path given with {@code --config=}, or {@code null} to use the bundled configuration. */
  public String configFile() {
    String value = parameters.get("config");
    return value == null || value.isBlank() ? null : value.trim();
  }

  public Map<String, String> asMap() {
    return Collections.unmodifiableMap(parameters);
  }
}
