package com.finrag.qa;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.finrag.exception.LlmException;
import com.finrag.logging.LoggingService;
import com.finrag.utility.JacksonUtility;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;

/**
 * Client for the {@code /chat/completions} endpoint. OpenAI serves it under {@code
 * https://api.openai.com/v1}, Ollama under {@code <ollama>/v1}, so one implementation covers both.
 */
public final class OpenAiCompatibleLlmClient implements LlmClient {
  private static final Logger log = LoggingService.getLogger(OpenAiCompatibleLlmClient.class);
  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

  private final String name;
  private final String baseUrl;
  private final String model;
  private final double temperature;
  private final String apiKey;
  private final OkHttpClient http;
  private final ObjectMapper mapper = JacksonUtility.getJsonMapper();

  public OpenAiCompatibleLlmClient(
      String name,
      String baseUrl,
      String model,
      double temperature,
      String apiKey,
      Duration timeout) {
    this(
        name,
        baseUrl,
        model,
        temperature,
        apiKey,
        new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(10))
            .readTimeout(timeout)
            .callTimeout(timeout.plusSeconds(10))
            .build());
  }

  OpenAiCompatibleLlmClient(
      String name,
      String baseUrl,
      String model,
      double temperature,
      String apiKey,
      OkHttpClient http) {
    if (baseUrl == null || baseUrl.isBlank()) {
      throw new IllegalArgumentException("baseUrl must not be blank");
    }
    this.name = name;
    this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    this.model = model;
    this.temperature = temperature;
    this.apiKey = apiKey;
    this.http = http;
  }

  @Override
  public String chat(List<Message> messages) {
    Request.Builder request =
        new Request.Builder()
            .url(baseUrl + "/chat/completions")
            .post(RequestBody.create(requestBody(messages), JSON));
    if (apiKey != null && !apiKey.isBlank()) {
      request.header("Authorization", "Bearer " + apiKey);
    }

    long start = System.nanoTime();
    try (Response response = http.newCall(request.build()).execute()) {
      ResponseBody body = response.body();
      String payload = body == null ? "" : body.string();
      log.debug(
          "{} answered {} in {} ms",
          name,
          response.code(),
          (System.nanoTime() - start) / 1_000_000);
      if (!response.isSuccessful()) {
        throw new LlmException(
            "%s returned HTTP %d: %s".formatted(name, response.code(), abbreviate(payload)));
      }
      return extractContent(payload);
    } catch (IOException e) {
      throw new LlmException("Failed to call " + name + " at " + baseUrl + ": " + e.getMessage(), e);
    }
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public String model() {
    return model;
  }

  private String requestBody(List<Message> messages) {
    ObjectNode root = mapper.createObjectNode();
    root.put("model", model);
    root.put("temperature", temperature);
    ArrayNode array = root.putArray("messages");
    for (Message message : messages) {
      array.addObject().put("role", message.role().wireName()).put("content", message.content());
    }
    return root.toString();
  }

  private String extractContent(String payload) {
    JsonNode root;
    try {
      root = mapper.readTree(payload);
    } catch (IOException e) {
      throw new LlmException(name + " returned a body that is not JSON", e);
    }
    JsonNode content = root == null ? null : root.path("choices").path(0).path("message").get("content");
    if (content == null || !content.isTextual()) {
      throw new LlmException(name + " response has no choices[0].message.content");
    }
    return content.asText();
  }

  private static String abbreviate(String text) {
    return text.length() <= 300 ? text : text.substring(0, 300) + "...";
  }
}
