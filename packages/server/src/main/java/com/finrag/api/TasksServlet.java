package com.finrag.api;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.finrag.exception.ValidationException;
import com.finrag.tasks.TaskNotFoundException;
import com.finrag.tasks.TaskQueue;
import com.finrag.tasks.TaskStatus;
import com.finrag.tasks.TaskView;
import com.finrag.utility.JacksonUtility;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;

/**
 * GET /api/v1/tasks/{id}: status, result or error of one task.
 *
 * <p>GET /api/v1/tasks[?status=pending|running|completed|failed]: every task, optionally
 * filtered.
 */
public final class TasksServlet extends HttpServlet {
  private final TaskQueue queue;

  public TasksServlet(TaskQueue queue) {
    this.queue = queue;
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    String path = req.getPathInfo();
    if (path == null || path.equals("/")) {
      list(req, resp);
      return;
    }

    TaskView view;
    try {
      view = queue.getStatus(path.substring(1));
    } catch (TaskNotFoundException e) {
      ApiResponses.writeError(resp, 404, "not_found", e);
      return;
    }
    ApiResponses.writeJson(resp, 200, TaskJson.toJson(view));
  }

  private void list(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    TaskStatus status = null;
    String filter = req.getParameter("status");
    if (filter != null && !filter.isBlank()) {
      try {
        status = TaskStatus.fromWireName(filter);
      } catch (ValidationException e) {
        ApiResponses.writeError(resp, 400, "invalid_request", e);
        return;
      }
    }

    List<TaskView> tasks = queue.list(status);
    ObjectNode node = JacksonUtility.getJsonMapper().createObjectNode();
    ArrayNode array = node.putArray("tasks");
    tasks.forEach(task -> array.add(TaskJson.toJson(task)));
    node.put("count", tasks.size());
    ApiResponses.writeJson(resp, 200, node);
  }
}
