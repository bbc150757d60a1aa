package com.finrag.tasks;

import com.finrag.exception.ConfigException;
import java.time.Duration;
import org.apache.commons.configuration2.Configuration;

/** Tuning knobs for {@link TaskQueue}. Built explicitly or read from the {@code queue.*} keys. */
public final class TaskQueueSettings {
  private final int maxConcurrency;
  private final boolean cleanupEnabled;
  private final Duration cleanupInterval;
  private final Duration cleanupMaxAge;
  private final Duration shutdownGrace;

  private TaskQueueSettings(Builder builder) {
    this.maxConcurrency = builder.maxConcurrency;
    this.cleanupEnabled = builder.cleanupEnabled;
    this.cleanupInterval = builder.cleanupInterval;
    this.cleanupMaxAge = builder.cleanupMaxAge;
    this.shutdownGrace = builder.shutdownGrace;
  }

  public int getMaxConcurrency() {
    return maxConcurrency;
  }

  public boolean isCleanupEnabled() {
    return cleanupEnabled;
  }

  public Duration getCleanupInterval() {
    return cleanupInterval;
  }

  public Duration getCleanupMaxAge() {
    return cleanupMaxAge;
  }

  public Duration getShutdownGrace() {
    return shutdownGrace;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /** Defaults: unbounded concurrency, sweep every 5 minutes removing tasks older than 1 hour. */
  public static TaskQueueSettings defaults() {
    return newBuilder().build();
  }

  /**
   * Read settings from configuration. Recognized keys:
   *
   * <ul>
   *   <li>{@code queue.max-concurrency} (0 = unbounded)
   *   <li>{@code queue.cleanup.enabled}
   *   <li>{@code queue.cleanup.interval-seconds}
   *   <li>{@code queue.cleanup.max-age-seconds}
   *   <li>{@code queue.shutdown-grace-seconds}
   * </ul>
   */
  public static TaskQueueSettings fromConfiguration(Configuration config) {
    Builder defaults = new Builder();
    try {
      return newBuilder()
          .withMaxConcurrency(config.getInt("queue.max-concurrency", defaults.maxConcurrency))
          .withCleanupEnabled(config.getBoolean("queue.cleanup.enabled", defaults.cleanupEnabled))
          .withCleanupInterval(
              Duration.ofSeconds(
                  config.getLong(
                      "queue.cleanup.interval-seconds", defaults.cleanupInterval.toSeconds())))
          .withCleanupMaxAge(
              Duration.ofSeconds(
                  config.getLong(
                      "queue.cleanup.max-age-seconds", defaults.cleanupMaxAge.toSeconds())))
          .withShutdownGrace(
              Duration.ofSeconds(
                  config.getLong(
                      "queue.shutdown-grace-seconds", defaults.shutdownGrace.toSeconds())))
          .build();
    } catch (ConfigException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new ConfigException("Invalid queue configuration: " + e.getMessage(), e);
    }
  }

  @Override
  public String toString() {
    return String.format(
        "TaskQueueSettings{maxConcurrency=%d, cleanupEnabled=%s, cleanupInterval=%s, cleanupMaxAge=%s, shutdownGrace=%s}",
        maxConcurrency, cleanupEnabled, cleanupInterval, cleanupMaxAge, shutdownGrace);
  }

  public static final class Builder {
    private int maxConcurrency = 0;
    private boolean cleanupEnabled = true;
    private Duration cleanupInterval = Duration.ofMinutes(5);
    private Duration cleanupMaxAge = Duration.ofHours(1);
    private Duration shutdownGrace = Duration.ofSeconds(10);

    private Builder() {}

    /**
     * Maximum number of tasks executing at once; extra tasks wait in a backlog. Zero or negative
     * means unbounded. Default: 0
     */
    public Builder withMaxConcurrency(int maxConcurrency) {
      this.maxConcurrency = maxConcurrency;
      return this;
    }

    /** Run the periodic cleanup sweep. Default: true */
    public Builder withCleanupEnabled(boolean enabled) {
      this.cleanupEnabled = enabled;
      return this;
    }

    /** Delay between cleanup sweeps. Default: 5 minutes */
    public Builder withCleanupInterval(Duration interval) {
      this.cleanupInterval = interval;
      return this;
    }

    /** Finished tasks older than this are removed by the sweep. Default: 1 hour */
    public Builder withCleanupMaxAge(Duration maxAge) {
      this.cleanupMaxAge = maxAge;
      return this;
    }

    /** How long {@link TaskQueue#close()} waits for running tasks. Default: 10 seconds */
    public Builder withShutdownGrace(Duration grace) {
      this.shutdownGrace = grace;
      return this;
    }

    public TaskQueueSettings build() {
      if (cleanupInterval == null || cleanupInterval.isZero() || cleanupInterval.isNegative()) {
        throw new ConfigException("queue.cleanup.interval-seconds must be positive");
      }
      if (cleanupMaxAge == null || cleanupMaxAge.isNegative()) {
        throw new ConfigException("queue.cleanup.max-age-seconds must not be negative");
      }
      if (shutdownGrace == null || shutdownGrace.isNegative()) {
        throw new ConfigException("queue.shutdown-grace-seconds must not be negative");
      }
      return new TaskQueueSettings(this);
    }
  }
}
