package com.finrag.api;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.finrag.utility.JacksonUtility;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Clock;

/** GET /health */
public final class HealthServlet extends HttpServlet {
  private final Clock clock;

  public HealthServlet(Clock clock) {
    this.clock = clock;
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    ObjectNode node = JacksonUtility.getJsonMapper().createObjectNode();
    node.put("status", "ok");
    node.put("timestamp", clock.instant().toString());
    ApiResponses.writeJson(resp, 200, node);
  }
}
