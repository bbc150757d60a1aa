package com.finrag.config;

import com.finrag.exception.ConfigException;
import com.finrag.logging.LoggingService;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.slf4j.Logger;

/**
 * Loads the application configuration: a YAML document, either the bundled {@code
 * application.yaml} or an external file, with selected keys overridden from the environment.
 */
public final class ConfigurationProvider {
  private static final Logger log = LoggingService.getLogger(ConfigurationProvider.class);

  public static final String DEFAULT_RESOURCE = "application.yaml";

  /** Environment variable → configuration key. */
  static final Map<String, String> ENV_OVERRIDES = new LinkedHashMap<>();

  static {
    ENV_OVERRIDES.put("FINRAG_HTTP_PORT", "http.port");
    ENV_OVERRIDES.put("FINRAG_HTTP_HOSTNAME", "http.hostname");
    ENV_OVERRIDES.put("FINRAG_LLM_PROVIDER", "llm.provider");
    ENV_OVERRIDES.put("OPENAI_API_KEY", "llm.openai.api-key");
    ENV_OVERRIDES.put("OLLAMA_BASE_URL", "llm.ollama.base-url");
    ENV_OVERRIDES.put("FINRAG_QUEUE_MAX_CONCURRENCY", "queue.max-concurrency");
  }

  private final YAMLConfiguration config;

  /** @param configFile external YAML file, or {@code null} for the bundled one */
  public ConfigurationProvider(String configFile) {
    this(configFile, System.getenv());
  }

  ConfigurationProvider(String configFile, Map<String, String> environment) {
    this.config = configFile == null ? loadResource(DEFAULT_RESOURCE) : loadFile(Path.of(configFile));
    applyEnvironment(environment);
  }

  public Configuration config() {
    return config;
  }

  private void applyEnvironment(Map<String, String> environment) {
    ENV_OVERRIDES.forEach(
        (variable, key) -> {
          String value = environment.get(variable);
          if (value != null && !value.isBlank()) {
            config.setProperty(key, value.trim());
            log.debug("Configuration key {} overridden by {}", key, variable);
          }
        });
  }

  private static YAMLConfiguration loadResource(String name) {
    InputStream in = ConfigurationProvider.class.getClassLoader().getResourceAsStream(name);
    if (in == null) {
      throw new ConfigException("Configuration resource not found on classpath: " + name);
    }
    log.info("Loading configuration from classpath:{}", name);
    try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
      return read(reader, name);
    } catch (IOException e) {
      throw new ConfigException("Failed to read configuration resource " + name, e);
    }
  }

  private static YAMLConfiguration loadFile(Path path) {
    if (!Files.isRegularFile(path)) {
      throw new ConfigException("Configuration file not found: " + path.toAbsolutePath());
    }
    log.info("Loading configuration from {}", path.toAbsolutePath());
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return read(reader, path.toString());
    } catch (IOException e) {
      throw new ConfigException("Failed to read configuration file " + path, e);
    }
  }

  private static YAMLConfiguration read(Reader reader, String origin) throws IOException {
    YAMLConfiguration yaml = new YAMLConfiguration();
    try {
      yaml.read(reader);
    } catch (ConfigurationException | RuntimeException e) {
      throw new ConfigException("Invalid YAML in " + origin + ": " + e.getMessage(), e);
    }
    return yaml;
  }
}
