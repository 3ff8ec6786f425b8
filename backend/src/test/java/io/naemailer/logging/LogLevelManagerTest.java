package io.naemailer.logging;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import io.naemailer.config.EmailerProperties;
import io.naemailer.filter.FilterMode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;

class LogLevelManagerTest {

  private LoggingSystem loggingSystem;

  @BeforeEach
  void setUp() {
    loggingSystem = mock(LoggingSystem.class);
  }

  private LogLevelManager manager(String level) {
    var properties =
        new EmailerProperties(
            level,
            false,
            new EmailerProperties.Email("na@example.com", null, null, null),
            null,
            FilterMode.ALL,
            new EmailerProperties.Templates(null, "classpath:/templates/email/"));
    return new LogLevelManager(loggingSystem, properties);
  }

  @Test
  void ensureConfigured_applies_level_once_while_unchanged() {
    var manager = manager("debug");

    manager.ensureConfigured();
    manager.ensureConfigured();
    manager.onApplicationReady();

    verify(loggingSystem, times(1)).setLogLevel(LoggingSystem.ROOT_LOGGER_NAME, LogLevel.DEBUG);
    assertThat(manager.currentLevel()).isEqualTo(LogLevel.DEBUG);
  }

  @Test
  void apply_reconfigures_when_level_changes() {
    var manager = manager("INFO");

    manager.apply("INFO");
    manager.apply("WARN");
    manager.apply("WARN");

    verify(loggingSystem).setLogLevel(LoggingSystem.ROOT_LOGGER_NAME, LogLevel.INFO);
    verify(loggingSystem).setLogLevel(LoggingSystem.ROOT_LOGGER_NAME, LogLevel.WARN);
    verify(loggingSystem, times(2)).setLogLevel(any(), any());
  }

  @Test
  void parse_falls_back_to_info_and_accepts_common_aliases() {
    assertThat(LogLevelManager.parse(null)).isEqualTo(LogLevel.INFO);
    assertThat(LogLevelManager.parse("verbose")).isEqualTo(LogLevel.INFO);
    assertThat(LogLevelManager.parse(" warning ")).isEqualTo(LogLevel.WARN);
    assertThat(LogLevelManager.parse("CRITICAL")).isEqualTo(LogLevel.FATAL);
    assertThat(LogLevelManager.parse("trace")).isEqualTo(LogLevel.TRACE);
  }
}
