package com.finrag.api;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.finrag.exception.ValidationException;
import com.finrag.tasks.TaskQueue;
import com.finrag.utility.JacksonUtility;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Duration;

/**
 * POST /api/v1/queue/clean[?max_age_seconds=N]: removes finished tasks older than N seconds.
 * Without the parameter the configured cleanup age is used.
 */
public final class QueueCleanServlet extends HttpServlet {
  private final TaskQueue queue;
  private final Duration defaultMaxAge;

  public QueueCleanServlet(TaskQueue queue, Duration defaultMaxAge) {
    this.queue = queue;
    this.defaultMaxAge = defaultMaxAge;
  }

  @Override
  protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    long maxAgeSeconds = defaultMaxAge.toSeconds();
    String param = req.getParameter("max_age_seconds");
    if (param != null && !param.isBlank()) {
      try {
        maxAgeSeconds = Long.parseLong(param.trim());
      } catch (NumberFormatException e) {
        ApiResponses.writeError(
            resp,
            400,
            "invalid_request",
            new ValidationException("max_age_seconds must be an integer", e)
                .withContext("max_age_seconds", param));
        return;
      }
      if (maxAgeSeconds < 0) {
        ApiResponses.writeError(
            resp,
            400,
            "invalid_request",
            new ValidationException("max_age_seconds must not be negative")
                .withContext("max_age_seconds", maxAgeSeconds));
        return;
      }
    }

    int removed = queue.clean(maxAgeSeconds);
    ObjectNode node = JacksonUtility.getJsonMapper().createObjectNode();
    node.put("removed", removed);
    node.put("max_age_seconds", maxAgeSeconds);
    ApiResponses.writeJson(resp, 200, node);
  }
}
