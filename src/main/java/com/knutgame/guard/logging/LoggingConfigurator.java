package com.knutgame.guard.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Raises the anti-cheat loggers to DEBUG inside a running JVM.
 * <p><strong>Why:</strong> Per-session rejection details are logged at DEBUG; operators switch them on through
 * {@code logging.verbose} without editing {@code logback.xml}.</p>
 * <p><strong>Thread-safety:</strong> Intended for startup; level changes are delegated to Logback.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings log a warning and keep their configuration.
 * @since 0.1.0
 */
public final class LoggingConfigurator {
  static final String GUARD_LOGGER = "com.knutgame.guard";
  private static final String LOGBACK_CONTEXT = "ch.qos.logback.classic.LoggerContext";
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Sets the {@code com.knutgame.guard} logger to DEBUG. Safe to call when Logback is not on the classpath.
   *
   * @return {@code true} when the backend accepted the change
   */
  public static boolean enableVerboseLogging() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    // Logback is optional; its classes must not be touched unless it is the bound backend
    if (LOGBACK_CONTEXT.equals(factory.getClass().getName()) && factory instanceof LoggerContext context) {
      Logger guard = context.getLogger(GUARD_LOGGER);
      if (!Level.DEBUG.equals(guard.getLevel())) {
        guard.setLevel(Level.DEBUG);
        log.info("Verbose anti-cheat logging enabled");
      }
      return true;
    }
    log.warn("Verbose logging requested but backend {} does not support dynamic level updates",
        factory.getClass().getName());
    return false;
  }
}
