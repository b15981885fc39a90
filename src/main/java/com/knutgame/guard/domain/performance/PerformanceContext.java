package com.knutgame.guard.domain.performance;

import java.util.List;

/**
 * <strong>What:</strong> Aggregated performance report for one session.
 * <p><strong>Why:</strong> Lets the validators tell degraded-but-honest clients apart from impossible movement.</p>
 * <p><strong>Role:</strong> Built by the upstream performance monitor; the anti-cheat engine only reads it.</p>
 * <p><strong>Thread-safety:</strong> Immutable; lists are defensively copied.</p>
 *
 * @param issues degradations reported during the session; {@code null} becomes empty
 * @param averageFps mean frame rate over the session
 * @param memoryPressureLevel memory pressure between 0 (none) and 5 (severe)
 * @param performanceScore composite client health between 0 and 100
 * @param sessionDurationMs length of the monitored window in milliseconds
 * @param stutterTimestamps stutter instants recorded without a full issue report; {@code null} becomes empty
 * @since 0.1.0
 */
public record PerformanceContext(
    List<PerformanceIssue> issues,
    double averageFps,
    int memoryPressureLevel,
    int performanceScore,
    long sessionDurationMs,
    List<Long> stutterTimestamps) {

  /** Frame rate reported by a healthy client. */
  public static final double NOMINAL_FPS = 60.0;

  public PerformanceContext {
    issues = issues == null ? List.of() : List.copyOf(issues);
    stutterTimestamps = stutterTimestamps == null ? List.of() : List.copyOf(stutterTimestamps);
    if (!Double.isFinite(averageFps) || averageFps < 0) {
      throw new IllegalArgumentException("averageFps must be finite and non-negative (was " + averageFps + ")");
    }
    if (memoryPressureLevel < 0 || memoryPressureLevel > 5) {
      throw new IllegalArgumentException(
          "memoryPressureLevel must be between 0 and 5 (was " + memoryPressureLevel + ")");
    }
    if (performanceScore < 0 || performanceScore > 100) {
      throw new IllegalArgumentException(
          "performanceScore must be between 0 and 100 (was " + performanceScore + ")");
    }
  }

  /**
   * Context describing a perfectly healthy client: nominal frame rate, full score, no issues.
   *
   * @return neutral context
   */
  public static PerformanceContext neutral() {
    return new PerformanceContext(List.of(), NOMINAL_FPS, 0, 100, 0L, List.of());
  }

  /**
   * Sum of severity weights across all issues.
   *
   * @return total severity weight; {@code 0} when no issues were reported
   */
  public int totalSeverityWeight() {
    int total = 0;
    for (PerformanceIssue issue : issues) {
      total += issue.severity().weight();
    }
    return total;
  }
}
