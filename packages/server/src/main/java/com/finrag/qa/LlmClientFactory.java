package com.finrag.qa;

import com.finrag.exception.ConfigException;
import com.finrag.logging.LoggingService;
import java.time.Duration;
import java.util.Locale;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;

/**
 * Picks the language model backend from {@code llm.*} configuration.
 *
 * <p>{@code llm.provider} may be {@code openai}, {@code ollama} or {@code mock}. When it is not set
 * the OpenAI backend is used if an API key is configured, otherwise the mock.
 */
public final class LlmClientFactory {
  private static final Logger log = LoggingService.getLogger(LlmClientFactory.class);

  static final String DEFAULT_OPENAI_URL = "https://api.openai.com/v1";
  static final String DEFAULT_OPENAI_MODEL = "gpt-4o-mini";
  static final String DEFAULT_OLLAMA_URL = "http://localhost:11434";
  static final String DEFAULT_OLLAMA_MODEL = "mistral";

  private LlmClientFactory() {}

  public static LlmClient create(Configuration config) {
    String provider = config.getString("llm.provider", "");
    String apiKey = config.getString("llm.openai.api-key", "");
    double temperature = config.getDouble("llm.temperature", 0.1);
    Duration timeout = Duration.ofSeconds(config.getLong("llm.timeout-seconds", 60));
    if (temperature < 0.0 || temperature > 2.0) {
      throw new ConfigException("llm.temperature must be between 0.0 and 2.0, got " + temperature);
    }

    if (provider.isBlank()) {
      provider = apiKey.isBlank() ? "mock" : "openai";
    }

    LlmClient client =
        switch (provider.trim().toLowerCase(Locale.ROOT)) {
          case "openai" -> {
            if (apiKey.isBlank()) {
              throw new ConfigException(
                  "llm.provider is openai but no API key is configured (llm.openai.api-key)");
            }
            yield new OpenAiCompatibleLlmClient(
                "openai",
                config.getString("llm.openai.base-url", DEFAULT_OPENAI_URL),
                config.getString("llm.openai.model", DEFAULT_OPENAI_MODEL),
                temperature,
                apiKey,
                timeout);
          }
          case "ollama" ->
              new OpenAiCompatibleLlmClient(
                  "ollama",
                  stripSlash(config.getString("llm.ollama.base-url", DEFAULT_OLLAMA_URL)) + "/v1",
                  config.getString("llm.ollama.model", DEFAULT_OLLAMA_MODEL),
                  temperature,
                  null,
                  timeout);
          case "mock" -> new MockLlmClient();
          default -> throw new ConfigException("Unknown llm.provider: " + provider);
        };
    log.info("Using language model backend: {}", client.name());
    return client;
  }

  private static String stripSlash(String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }
}
