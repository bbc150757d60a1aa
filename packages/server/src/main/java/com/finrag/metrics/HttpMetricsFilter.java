package com.finrag.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletMapping;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Records request count, latency and in-flight requests per method and endpoint.
 *
 * <p>The endpoint tag is the servlet mapping, not the raw URI, so task ids do not create a series
 * each: {@code /api/v1/tasks/abc} is reported as {@code /api/v1/tasks/{id}}. Requests that match no
 * servlet are reported as {@value #UNMATCHED}.
 */
public final class HttpMetricsFilter implements Filter {
  public static final String REQUESTS = "finrag.http.requests";
  public static final String DURATION = "finrag.http.request.duration";
  public static final String IN_PROGRESS = "finrag.http.requests.in.progress";

  static final String UNMATCHED = "unmatched";

  private final MeterRegistry registry;
  private final Map<Tags, AtomicInteger> inProgress = new ConcurrentHashMap<>();

  public HttpMetricsFilter(MeterRegistry registry) {
    this.registry = registry;
  }

  @Override
  public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
      throws IOException, ServletException {
    if (!(request instanceof HttpServletRequest req)
        || !(response instanceof HttpServletResponse resp)) {
      chain.doFilter(request, response);
      return;
    }

    Tags tags = Tags.of("method", req.getMethod(), "endpoint", endpoint(req));
    AtomicInteger active = inProgress.computeIfAbsent(tags, this::registerGauge);
    active.incrementAndGet();
    Timer.Sample sample = Timer.start(registry);
    int status = HttpServletResponse.SC_INTERNAL_SERVER_ERROR;
    try {
      chain.doFilter(request, response);
      status = resp.getStatus();
    } finally {
      active.decrementAndGet();
      sample.stop(
          Timer.builder(DURATION)
              .description("HTTP request latency")
              .tags(tags)
              .register(registry));
      Counter.builder(REQUESTS)
          .description("HTTP requests received")
          .tags(tags)
          .tag("status", Integer.toString(status))
          .register(registry)
          .increment();
    }
  }

  private AtomicInteger registerGauge(Tags tags) {
    AtomicInteger value = new AtomicInteger();
    return registry.gauge(IN_PROGRESS, tags, value);
  }

  static String endpoint(HttpServletRequest req) {
    HttpServletMapping mapping = req.getHttpServletMapping();
    if (mapping == null || mapping.getMappingMatch() == null) {
      return UNMATCHED;
    }
    String pattern = mapping.getPattern();
    switch (mapping.getMappingMatch()) {
      case EXACT:
        return pattern;
      case PATH:
        String base = pattern.substring(0, pattern.length() - 2);
        String rest = req.getPathInfo();
        return rest == null || rest.equals("/") ? base : base + "/{id}";
      default:
        return UNMATCHED;
    }
  }
}
