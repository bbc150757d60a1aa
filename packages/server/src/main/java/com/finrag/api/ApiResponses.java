package com.finrag.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.finrag.exception.ErrorDetails;
import com.finrag.exception.ExceptionUtil;
import com.finrag.utility.JacksonUtility;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;

/** JSON response helpers shared by the API servlets. */
final class ApiResponses {
  static final String JSON = "application/json";

  private ApiResponses() {}

  static void writeJson(HttpServletResponse resp, int status, JsonNode body) throws IOException {
    resp.setStatus(status);
    resp.setContentType(JSON);
    resp.setCharacterEncoding("UTF-8");
    resp.getWriter().write(JacksonUtility.getJsonMapper().writeValueAsString(body));
  }

  /**
   * Error body {@code {"error": ..., "message": ..., "code": ...}} built from the failure's {@link
   * ErrorDetails}. A {@code "context"} object is added when the failure carries one.
   */
  static void writeError(HttpServletResponse resp, int status, String error, Throwable cause)
      throws IOException {
    ErrorDetails details = ExceptionUtil.toErrorDetails(cause);
    ObjectMapper mapper = JacksonUtility.getJsonMapper();
    ObjectNode node = mapper.createObjectNode();
    node.put("error", error);
    node.put(
        "message",
        details.message().isBlank() ? ExceptionUtil.extractErrorMessage(cause) : details.message());
    node.put("code", details.code().name());
    if (details.context() != null && !details.context().isEmpty()) {
      node.set("context", mapper.valueToTree(details.context()));
    }
    writeJson(resp, status, node);
  }
}
