package com.finrag.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single entry point for obtaining loggers and applying logger levels from the application
 * configuration.
 *
 * <p>Levels are read from keys below {@code logging.level}, for example:
 *
 * <pre>
 * logging:
 *   level:
 *     root: INFO
 *     com.finrag.tasks: DEBUG
 * </pre>
 */
public final class LoggingService {
  private static final String LEVEL_PREFIX = "logging.level";

  private LoggingService() {}

  public static Logger getLogger(Class<?> type) {
    return LoggerFactory.getLogger(type);
  }

  public static Logger getLogger(String name) {
    return LoggerFactory.getLogger(name);
  }

  /**
   * Apply {@code logging.level.*} entries to the Logback context. Unknown level names fall back to
   * DEBUG, as Logback does. Does nothing when SLF4J is not bound to Logback.
   */
  public static void applyConfiguration(Configuration configuration) {
    if (configuration == null) return;
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      getLogger(LoggingService.class)
          .debug("Logger factory {} is not Logback, skipping level configuration", factory);
      return;
    }

    Configuration levels = configuration.subset(LEVEL_PREFIX);
    Iterator<String> keys = levels.getKeys();
    while (keys.hasNext()) {
      String loggerName = keys.next();
      String value = levels.getString(loggerName);
      if (value == null || value.isBlank()) continue;

      // Dotted YAML keys come back with their dots escaped as "..".
      String target =
          "root".equalsIgnoreCase(loggerName)
              ? Logger.ROOT_LOGGER_NAME
              : loggerName.replace("..", ".").trim();
      context.getLogger(target).setLevel(Level.toLevel(value.trim(), Level.DEBUG));
    }
  }
}
