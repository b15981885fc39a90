package com.knutgame.guard.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingConfiguratorTest {
  private Logger guard;
  private Level original;

  @BeforeEach
  void captureLevel() {
    LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
    guard = context.getLogger(LoggingConfigurator.GUARD_LOGGER);
    original = guard.getLevel();
  }

  @AfterEach
  void restoreLevel() {
    guard.setLevel(original);
  }

  @Test
  void enablesDebugForGuardLoggers() {
    assertTrue(LoggingConfigurator.enableVerboseLogging());

    assertEquals(Level.DEBUG, guard.getLevel());
    assertTrue(LoggerFactory.getLogger("com.knutgame.guard.application.anticheat.SpeedValidator").isDebugEnabled());
  }

  @Test
  void artifactLeavesBackendConfigurationToHost() {
    assertNull(LoggingConfiguratorTest.class.getResource("/logback.xml"));
  }

  @Test
  void repeatedCallsAreHarmless() {
    assertTrue(LoggingConfigurator.enableVerboseLogging());
    assertTrue(LoggingConfigurator.enableVerboseLogging());

    assertEquals(Level.DEBUG, guard.getLevel());
  }
}
