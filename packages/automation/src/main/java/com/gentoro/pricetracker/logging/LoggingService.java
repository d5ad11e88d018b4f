package com.gentoro.pricetracker.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.rolling.RollingFileAppender;
import ch.qos.logback.core.rolling.TimeBasedRollingPolicy;
import java.io.File;
import java.util.Iterator;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for obtaining loggers and applying logging settings from {@code application.yaml}.
 *
 * <p>Supported keys:
 *
 * <ul>
 *   <li>{@code logging.level}: root level, e.g. {@code INFO}
 *   <li>{@code logging.levels.<logger-name>}: per-logger overrides
 *   <li>{@code logging.file.directory}: when set, a daily rolling file appender is attached
 * </ul>
 */
public final class LoggingService {
  static final String PATTERN =
      "%d{yyyy-MM-dd HH:mm:ss.SSS} [%thread] %-5level %logger{36} - %msg%n";

  private LoggingService() {}

  public static Logger getLogger(Class<?> type) {
    return LoggerFactory.getLogger(type);
  }

  /** Apply levels and the optional file appender. A no-op when Logback is not the backend. */
  public static void applyConfiguration(Configuration configuration) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      return;
    }

    String rootLevel = configuration.getString("logging.level", null);
    if (rootLevel != null && !rootLevel.isBlank()) {
      context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(Level.toLevel(rootLevel, Level.INFO));
    }

    Configuration levels = configuration.subset("logging.levels");
    for (Iterator<String> keys = levels.getKeys(); keys.hasNext(); ) {
      String key = keys.next();
      // hierarchical configurations escape dots inside a node name by doubling them
      String loggerName = key.replace("..", ".");
      context.getLogger(loggerName).setLevel(Level.toLevel(levels.getString(key), Level.INFO));
    }

    String directory = configuration.getString("logging.file.directory", null);
    if (directory != null && !directory.isBlank()) {
      attachRollingFile(context, new File(directory));
    }
  }

  private static void attachRollingFile(LoggerContext context, File logsDir) {
    ch.qos.logback.classic.Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
    if (root.getAppender("FILE") != null) {
      return;
    }
    if (!logsDir.exists()) {
      // noinspection ResultOfMethodCallIgnored
      logsDir.mkdirs();
    }

    RollingFileAppender<ILoggingEvent> fileAppender = new RollingFileAppender<>();
    fileAppender.setContext(context);
    fileAppender.setName("FILE");
    fileAppender.setFile(new File(logsDir, "automation.log").getPath());

    TimeBasedRollingPolicy<ILoggingEvent> rollingPolicy = new TimeBasedRollingPolicy<>();
    rollingPolicy.setContext(context);
    rollingPolicy.setParent(fileAppender);
    rollingPolicy.setFileNamePattern(
        new File(logsDir, "automation.%d{yyyy-MM-dd}.log.gz").getPath());
    rollingPolicy.setMaxHistory(7);
    rollingPolicy.start();

    PatternLayoutEncoder encoder = new PatternLayoutEncoder();
    encoder.setContext(context);
    encoder.setPattern(PATTERN);
    encoder.start();

    fileAppender.setEncoder(encoder);
    fileAppender.setRollingPolicy(rollingPolicy);
    fileAppender.start();

    root.addAppender(fileAppender);
    getLogger(LoggingService.class).info("File logging enabled at {}", fileAppender.getFile());
  }
}
