package io.naemailer.logging;

import io.naemailer.config.EmailerProperties;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Owns the process-wide log level. The level is applied through Spring Boot's {@link
 * LoggingSystem} when the application is ready and re-applied by every request; re-applying an
 * unchanged level is a no-op.
 */
@Component
public class LogLevelManager {

  private static final Logger log = LoggerFactory.getLogger(LogLevelManager.class);

  private final LoggingSystem loggingSystem;
  private final EmailerProperties properties;
  private final AtomicReference<LogLevel> current = new AtomicReference<>();
  private final AtomicBoolean started = new AtomicBoolean();

  public LogLevelManager(LoggingSystem loggingSystem, EmailerProperties properties) {
    this.loggingSystem = loggingSystem;
    this.properties = properties;
  }

  @EventListener(ApplicationReadyEvent.class)
  public void onApplicationReady() {
    ensureConfigured();
    if (started.compareAndSet(false, true)) {
      log.info("na-emailer started (ready to receive events)");
    }
  }

  /** Applies the configured level if it differs from the one currently in effect. */
  public void ensureConfigured() {
    apply(properties.logLevel());
  }

  /** Returns the level in effect, or {@code null} before the first call to {@link #apply}. */
  public LogLevel currentLevel() {
    return current.get();
  }

  void apply(String configuredLevel) {
    LogLevel level = parse(configuredLevel);
    LogLevel previous = current.getAndSet(level);
    if (previous != level) {
      loggingSystem.setLogLevel(LoggingSystem.ROOT_LOGGER_NAME, level);
      log.debug("Log level set to {}", level);
    }
  }

  static LogLevel parse(String configuredLevel) {
    if (configuredLevel == null || configuredLevel.isBlank()) {
      return LogLevel.INFO;
    }
    String name = configuredLevel.strip().toUpperCase(Locale.ROOT);
    if (name.equals("WARNING")) {
      return LogLevel.WARN;
    }
    if (name.equals("CRITICAL")) {
      return LogLevel.FATAL;
    }
    try {
      return LogLevel.valueOf(name);
    } catch (IllegalArgumentException e) {
      log.warn("Unknown log level '{}', using INFO", configuredLevel);
      return LogLevel.INFO;
    }
  }
}
