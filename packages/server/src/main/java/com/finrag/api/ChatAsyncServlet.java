package com.finrag.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.finrag.exception.StateException;
import com.finrag.exception.ValidationException;
import com.finrag.logging.LoggingService;
import com.finrag.qa.FinancialQuestionService;
import com.finrag.tasks.TaskOperation;
import com.finrag.tasks.TaskQueue;
import com.finrag.tasks.TaskStatus;
import com.finrag.utility.JacksonUtility;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;

/**
 * POST /api/v1/chat/async: queues the question and answers 202 with the task id. Poll {@code
 * status_url} for the outcome.
 */
public final class ChatAsyncServlet extends HttpServlet {
  private static final Logger log = LoggingService.getLogger(ChatAsyncServlet.class);

  static final String OPERATION_NAME = "answer_financial_question";

  private final FinancialQuestionService questions;
  private final TaskQueue queue;
  private final ObjectMapper mapper = JacksonUtility.getJsonMapper();

  public ChatAsyncServlet(FinancialQuestionService questions, TaskQueue queue) {
    this.questions = questions;
    this.queue = queue;
  }

  @Override
  protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    String question;
    try {
      question = ChatServlet.readQuestion(req, mapper);
    } catch (ValidationException e) {
      ApiResponses.writeError(resp, 400, "invalid_request", e);
      return;
    }

    String taskId;
    try {
      taskId = queue.submit(TaskOperation.of(() -> questions.answer(question)), OPERATION_NAME);
    } catch (RuntimeException e) {
      log.error("Failed to create task", e);
      ApiResponses.writeError(
          resp, 500, "internal_error", new StateException("Failed to create task", e));
      return;
    }

    ObjectNode node = mapper.createObjectNode();
    node.put("task_id", taskId);
    node.put("status", TaskStatus.PENDING.wireName());
    node.put("status_url", ApiServer.TASKS_PATH + "/" + taskId);
    ApiResponses.writeJson(resp, 202, node);
  }
}
