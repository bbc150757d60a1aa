package com.finrag.api;

import com.finrag.metrics.HttpMetricsFilter;
import com.finrag.qa.FinancialQuestionService;
import com.finrag.tasks.TaskQueue;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import jakarta.servlet.DispatcherType;
import java.time.Clock;
import java.time.Duration;
import java.util.EnumSet;
import org.apache.commons.configuration2.Configuration;
import org.eclipse.jetty.ee10.servlet.FilterHolder;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.ee10.servlet.ServletHolder;

/**
 * Registers the HTTP API on a servlet context: the chat endpoints, task polling, queue
 * administration and the sanitized configuration under {@code /api/v1}, plus {@code /health} and
 * {@code /metrics}. With a meter registry every request is also measured.
 */
public final class ApiServer {
  static final String API_PATH = "/api/v1";
  static final String TASKS_PATH = API_PATH + "/tasks";

  private final TaskQueue queue;
  private final FinancialQuestionService questions;
  private final PrometheusMeterRegistry registry;
  private final Configuration config;
  private final Duration defaultCleanAge;
  private final Clock clock;

  public ApiServer(
      TaskQueue queue,
      FinancialQuestionService questions,
      PrometheusMeterRegistry registry,
      Configuration config,
      Duration defaultCleanAge,
      Clock clock) {
    this.queue = queue;
    this.questions = questions;
    this.registry = registry;
    this.config = config;
    this.defaultCleanAge = defaultCleanAge;
    this.clock = clock;
  }

  public void register(ServletContextHandler ctx) {
    if (registry != null) {
      ctx.addFilter(
          new FilterHolder(new HttpMetricsFilter(registry)),
          "/*",
          EnumSet.of(DispatcherType.REQUEST));
    }

    ctx.addServlet(new ServletHolder(new ChatServlet(questions)), API_PATH + "/chat");
    ctx.addServlet(
        new ServletHolder(new ChatAsyncServlet(questions, queue)), API_PATH + "/chat/async");

    // Also matches the bare collection path, where getPathInfo() is null.
    ctx.addServlet(new ServletHolder(new TasksServlet(queue)), TASKS_PATH + "/*");

    ctx.addServlet(new ServletHolder(new QueueStatsServlet(queue)), API_PATH + "/queue/stats");
    ctx.addServlet(
        new ServletHolder(new QueueCleanServlet(queue, defaultCleanAge)),
        API_PATH + "/queue/clean");
    ctx.addServlet(new ServletHolder(new ConfigServlet(config)), API_PATH + "/config");

    ctx.addServlet(new ServletHolder(new HealthServlet(clock)), "/health");
    if (registry != null) {
      ctx.addServlet(new ServletHolder(new MetricsServlet(registry)), "/metrics");
    }
  }
}
