package com.finrag.api;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.finrag.tasks.TaskError;
import com.finrag.tasks.TaskStats;
import com.finrag.tasks.TaskView;
import com.finrag.utility.JacksonUtility;
import java.time.Instant;

/** Wire representation of tasks: snake_case fields, ISO-8601 timestamps, explicit nulls. */
final class TaskJson {
  private TaskJson() {}

  static ObjectNode toJson(TaskView view) {
    ObjectNode node = JacksonUtility.getJsonMapper().createObjectNode();
    node.put("task_id", view.taskId());
    node.put("status", view.status().wireName());
    node.put("operation_name", view.operationName());
    if (view.result() == null) {
      node.putNull("result");
    } else {
      node.set("result", view.result());
    }
    TaskError error = view.error();
    if (error == null) {
      node.putNull("error");
    } else {
      node.putObject("error")
          .put("error_type", error.errorType())
          .put("error_message", error.errorMessage())
          .put("traceback", error.traceback());
    }
    putInstant(node, "created_at", view.createdAt());
    putInstant(node, "started_at", view.startedAt());
    putInstant(node, "completed_at", view.completedAt());
    return node;
  }

  static ObjectNode toJson(TaskStats stats) {
    ObjectNode node = JacksonUtility.getJsonMapper().createObjectNode();
    node.put("total", stats.total());
    node.put("pending", stats.pending());
    node.put("running", stats.running());
    node.put("completed", stats.completed());
    node.put("failed", stats.failed());
    return node;
  }

  private static void putInstant(ObjectNode node, String field, Instant value) {
    if (value == null) {
      node.putNull(field);
    } else {
      node.put(field, value.toString());
    }
  }
}
