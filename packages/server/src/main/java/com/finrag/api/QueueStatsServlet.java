package com.finrag.api;

import com.finrag.tasks.TaskQueue;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;

/** GET /api/v1/queue/stats */
public final class QueueStatsServlet extends HttpServlet {
  private final TaskQueue queue;

  public QueueStatsServlet(TaskQueue queue) {
    this.queue = queue;
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    ApiResponses.writeJson(resp, 200, TaskJson.toJson(queue.stats()));
  }
}
