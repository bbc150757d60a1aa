package com.finrag;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.finrag.exception.StateException;
import com.finrag.qa.MockLlmClient;
import com.finrag.utility.JacksonUtility;
import java.nio.file.Path;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.junit.jupiter.api.Test;

class FinRagTest {
  private final OkHttpClient http = new OkHttpClient();

  @Test
  void startsServesAndShutsDown() throws Exception {
    Path config = Path.of(getClass().getClassLoader().getResource("test-config.yaml").toURI());
    FinRag app = new FinRag(new String[] {"--config=" + config});
    try {
      app.initialize();
      assertInstanceOf(MockLlmClient.class, app.llmClient());
      assertEquals(4, app.configuration().getInt("queue.max-concurrency"));
      assertTrue(app.httpServer().isRunning());

      String base = "http://localhost:" + app.httpServer().getPort();
      try (Response health = http.newCall(new Request.Builder().url(base + "/health").build()).execute()) {
        assertEquals(200, health.code());
        assertEquals("ok", read(health).get("status").asText());
      }

      Request chat =
          new Request.Builder()
              .url(base + "/api/v1/chat")
              .post(
                  RequestBody.create(
                      "{\"user_id\":\"u\",\"question\":\"What is a bond?\"}",
                      MediaType.get("application/json")))
              .build();
      try (Response answer = http.newCall(chat).execute()) {
        assertEquals(200, answer.code());
        assertEquals("mock", read(answer).get("source").asText());
      }

      try (Response metrics =
          http.newCall(new Request.Builder().url(base + "/metrics").build()).execute()) {
        String scrape = metrics.body().string();
        assertTrue(scrape.contains("finrag_llm_requests_total"));
        assertTrue(scrape.contains("status=\"success\""));
        assertTrue(scrape.contains("finrag_http_requests_total"));
        assertTrue(scrape.contains("endpoint=\"/api/v1/chat\""));
      }
    } finally {
      app.shutdown();
    }
    assertFalse(app.httpServer().isRunning());
  }

  @Test
  void configurationRequiresInitialize() {
    assertThrows(StateException.class, () -> new FinRag(new String[0]).configuration());
  }

  private static JsonNode read(Response response) throws Exception {
    return JacksonUtility.getJsonMapper().readTree(response.body().string());
  }
}
