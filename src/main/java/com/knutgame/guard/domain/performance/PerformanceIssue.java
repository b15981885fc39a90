package com.knutgame.guard.domain.performance;

import java.util.Objects;

/**
 * One degradation observed on the client during a session.
 *
 * @param kind type of degradation
 * @param severity reported severity
 * @param timestampMs start of the issue in milliseconds since session start
 * @param durationMs length of the issue in milliseconds; {@code 0} for instantaneous reports
 * @param fpsAtTime frame rate measured when the issue was detected
 * @since 0.1.0
 */
public record PerformanceIssue(
    IssueKind kind,
    Severity severity,
    long timestampMs,
    long durationMs,
    double fpsAtTime) {

  public PerformanceIssue {
    kind = Objects.requireNonNull(kind, "kind");
    severity = Objects.requireNonNull(severity, "severity");
    if (durationMs < 0) {
      throw new IllegalArgumentException("durationMs must be non-negative (was " + durationMs + ")");
    }
  }

  /**
   * Returns whether {@code timestampMs} falls inside this issue widened by {@code paddingMs} on both sides.
   *
   * @param timestampMs instant to test
   * @param paddingMs extra milliseconds before the start and after the end
   * @return {@code true} when the instant lies in {@code [start - padding, start + duration + padding]}
   */
  public boolean covers(long timestampMs, double paddingMs) {
    return timestampMs >= this.timestampMs - paddingMs
        && timestampMs <= this.timestampMs + durationMs + paddingMs;
  }
}
