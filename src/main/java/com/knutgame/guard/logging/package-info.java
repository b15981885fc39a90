/**
 * <strong>Purpose:</strong> Runtime control of anti-cheat log verbosity.
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; no custom metrics.
 *
 * @since 0.1.0
 */
package com.knutgame.guard.logging;
