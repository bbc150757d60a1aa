package com.finrag;

import com.finrag.api.ApiServer;
import com.finrag.config.ConfigurationProvider;
import com.finrag.config.StartupParameters;
import com.finrag.exception.NetworkException;
import com.finrag.exception.StateException;
import com.finrag.http.EmbeddedJettyServer;
import com.finrag.logging.LoggingService;
import com.finrag.metrics.TaskMetrics;
import com.finrag.qa.FinancialQuestionService;
import com.finrag.qa.LlmClient;
import com.finrag.qa.LlmClientFactory;
import com.finrag.qa.MeteredLlmClient;
import com.finrag.tasks.TaskQueue;
import com.finrag.tasks.TaskQueueSettings;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import java.time.Clock;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;

/**
 * Application root. Builds every component once, in dependency order, and tears them down in
 * reverse on shutdown. Components receive their collaborators explicitly; nothing is looked up
 * globally.
 */
public class FinRag {
  private static final Logger log = LoggingService.getLogger(FinRag.class);

  private final StartupParameters startupParameters;
  private final Clock clock = Clock.systemUTC();
  private ConfigurationProvider configurationProvider;
  private PrometheusMeterRegistry meterRegistry;
  private TaskQueue taskQueue;
  private LlmClient llmClient;
  private EmbeddedJettyServer httpServer;
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private final CountDownLatch shutdownLatch = new CountDownLatch(1);
  private volatile Thread shutdownHook;

  public FinRag(String[] applicationArgs) {
    this.startupParameters = new StartupParameters(applicationArgs);
  }

  public void initialize() {
    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    // Apply logging levels as early as possible.
    LoggingService.applyConfiguration(configuration());

    this.meterRegistry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
    TaskMetrics metrics = new TaskMetrics(meterRegistry);
    TaskQueueSettings settings = TaskQueueSettings.fromConfiguration(configuration());
    this.taskQueue = new TaskQueue(settings, clock, metrics);
    metrics.bindQueue(taskQueue);
    taskQueue.start();

    this.llmClient = LlmClientFactory.create(configuration());
    FinancialQuestionService questions =
        new FinancialQuestionService(new MeteredLlmClient(llmClient, meterRegistry));

    this.httpServer = new EmbeddedJettyServer(configuration());
    httpServer.prepare();
    try {
      new ApiServer(
              taskQueue,
              questions,
              meterRegistry,
              configuration(),
              settings.getCleanupMaxAge(),
              clock)
          .register(httpServer.getContextHandler());
      httpServer.start();
    } catch (RuntimeException e) {
      shutdown();
      throw new NetworkException("Could not start http server", e);
    }
    log.info("FinRag ready on port {}", httpServer.getPort());
  }

  /**
   * Block the current thread until a shutdown signal is received (Ctrl+C or JVM termination), then
   * release resources before returning.
   */
  public void waitShutdownSignal() {
    if (shutdownHook == null) {
      synchronized (this) {
        if (shutdownHook == null) {
          shutdownHook = new Thread(this::shutdown, "finrag-shutdown-hook");
          Runtime.getRuntime().addShutdownHook(shutdownHook);
        }
      }
    }

    try {
      shutdownLatch.await();
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
  }

  /** Release resources. Safe to call multiple times; executed only once. */
  public void shutdown() {
    if (shuttingDown.compareAndSet(false, true)) {
      log.info("Shutting down");
      try {
        closeQuietly(httpServer);
        closeQuietly(taskQueue);
        if (meterRegistry != null) meterRegistry.close();
      } finally {
        shutdownLatch.countDown();
      }
    }
  }

  private void closeQuietly(AutoCloseable closeable) {
    if (closeable != null) {
      try {
        closeable.close();
      } catch (Exception e) {
        log.warn("Failed to close {}", closeable.getClass().getSimpleName(), e);
      }
    }
  }

  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("FinRag not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }

  public TaskQueue taskQueue() {
    return taskQueue;
  }

  public LlmClient llmClient() {
    return llmClient;
  }

  public EmbeddedJettyServer httpServer() {
    return httpServer;
  }

  public PrometheusMeterRegistry meterRegistry() {
    return meterRegistry;
  }
}
