package com.finrag.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.finrag.exception.ValidationException;
import com.finrag.logging.LoggingService;
import com.finrag.qa.Answer;
import com.finrag.qa.ChatRequest;
import com.finrag.qa.FinancialQuestionService;
import com.finrag.utility.JacksonUtility;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;

/** POST /api/v1/chat: answers a question synchronously. */
public final class ChatServlet extends HttpServlet {
  private static final Logger log = LoggingService.getLogger(ChatServlet.class);

  private final FinancialQuestionService questions;
  private final ObjectMapper mapper = JacksonUtility.getJsonMapper();

  public ChatServlet(FinancialQuestionService questions) {
    this.questions = questions;
  }

  @Override
  protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    String question;
    try {
      question = readQuestion(req, mapper);
    } catch (ValidationException e) {
      ApiResponses.writeError(resp, 400, "invalid_request", e);
      return;
    }

    try {
      Answer answer = questions.answer(question);
      ApiResponses.writeJson(resp, 200, mapper.valueToTree(answer));
    } catch (RuntimeException e) {
      log.error("Chat request failed", e);
      ApiResponses.writeError(resp, 500, "internal_error", e);
    }
  }

  /**
   * Parse a {@link ChatRequest} body and return its question.
   *
   * @throws ValidationException for malformed JSON or a missing or blank question
   */
  static String readQuestion(HttpServletRequest req, ObjectMapper mapper) throws IOException {
    ChatRequest body;
    try {
      body = mapper.readValue(req.getInputStream(), ChatRequest.class);
    } catch (JsonProcessingException e) {
      throw new ValidationException("Request body is not valid JSON: " + e.getOriginalMessage(), e);
    }
    if (body == null || body.question() == null || body.question().isBlank()) {
      throw new ValidationException("question must not be blank");
    }
    return body.question();
  }
}
