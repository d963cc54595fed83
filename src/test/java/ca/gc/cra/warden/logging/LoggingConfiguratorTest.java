package ca.gc.cra.warden.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingConfiguratorTest {
  private Logger root;
  private Level originalLevel;

  @BeforeEach
  void rememberLevel() {
    root = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    originalLevel = root.getLevel();
  }

  @AfterEach
  void restoreLevel() {
    root.setLevel(originalLevel);
  }

  @Test
  void verboseLoggingEnablesDebugOnRoot() {
    root.setLevel(Level.INFO);

    LoggingConfigurator.enableVerboseLogging();

    assertEquals(Level.DEBUG, root.getLevel());
  }

  @Test
  void debugEventsReachAppendersAfterEnabling() {
    Logger sample = (Logger) LoggerFactory.getLogger("ca.gc.cra.warden.sample");
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    appender.start();
    sample.addAppender(appender);
    try {
      root.setLevel(Level.INFO);
      LoggingConfigurator.enableVerboseLogging();
      sample.debug("attribution miss for {}", 42);

      assertTrue(appender.list.stream().anyMatch(e -> e.getFormattedMessage().equals("attribution miss for 42")));
    } finally {
      sample.detachAppender(appender);
    }
  }
}
