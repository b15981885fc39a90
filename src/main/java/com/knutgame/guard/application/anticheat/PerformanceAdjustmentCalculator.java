package com.knutgame.guard.application.anticheat;

import com.knutgame.guard.config.AntiCheatOptions;
import com.knutgame.guard.domain.performance.IssueKind;
import com.knutgame.guard.domain.performance.PerformanceContext;
import com.knutgame.guard.domain.performance.PerformanceIssue;
import com.knutgame.guard.domain.verdict.PerformanceAdjustment;
import java.util.Objects;

/**
 * <strong>What:</strong> Turns a performance report into concrete tolerance multipliers and window extensions.
 * <p><strong>Why:</strong> Low frame rates, stutters, and memory pauses make honest input look jumpy; relaxing
 * thresholds in proportion to the measured degradation keeps those players from being rejected.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Combine frame-rate, score, and issue-density deficits into additive terms above a 1.0 baseline.</li>
 *   <li>Boost proximity tolerance further under memory pressure.</li>
 *   <li>Clamp every value to the caps configured in {@link AntiCheatOptions}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; pure function of its arguments.</p>
 * <p><strong>Performance:</strong> Linear in the number of reported issues.</p>
 *
 * @since 0.1.0
 */
public final class PerformanceAdjustmentCalculator {
  static final double FPS_SPEED_WEIGHT = 0.6;
  static final double SCORE_SPEED_WEIGHT = 0.5;
  static final double SCORE_PROXIMITY_WEIGHT = 0.3;
  static final double ISSUE_SPEED_SCALE = 0.05;
  static final double ISSUE_PROXIMITY_SCALE = 0.03;
  static final double MEMORY_LEVEL_PROXIMITY_SCALE = 0.06;
  static final double MEMORY_ISSUE_PROXIMITY_SCALE = 0.04;
  static final double EXTENSION_MS_PER_WEIGHT = 25.0;
  static final double EXTENSION_PER_DURATION_MS = 0.25;
  static final double STUTTER_BASE_TOLERANCE_MS = 80.0;
  static final double STUTTER_MS_PER_WEIGHT = 40.0;

  /**
   * Computes the adjustment for {@code context} under {@code options}.
   *
   * @param context performance report; must not be {@code null}
   * @param options thresholds and caps; must not be {@code null}
   * @return neutral adjustment when adjustment is disabled, otherwise the clamped relaxations
   */
  public PerformanceAdjustment calculate(PerformanceContext context, AntiCheatOptions options) {
    Objects.requireNonNull(context, "context");
    Objects.requireNonNull(options, "options");
    if (!options.performanceAdjustmentEnabled()) {
      return PerformanceAdjustment.neutral();
    }

    double fpsDeficit = Math.max(0.0, options.lowFpsThreshold() - context.averageFps()) / options.lowFpsThreshold();
    double scoreDeficit = Math.max(0, 100 - context.performanceScore()) / 100.0;
    double issueLoad = 0.0;
    int memoryIssueWeight = 0;
    int stutterWeight = 0;
    double extension = 0.0;
    for (PerformanceIssue issue : context.issues()) {
      int weight = issue.severity().weight();
      issueLoad += weight * kindFactor(issue.kind());
      extension += weight * EXTENSION_MS_PER_WEIGHT + issue.durationMs() * EXTENSION_PER_DURATION_MS;
      switch (issue.kind()) {
        case STUTTER -> stutterWeight += weight;
        case MEMORY_PRESSURE -> memoryIssueWeight += weight;
        case LOW_FPS -> {
          // covered by the frame-rate deficit
        }
      }
    }
    double memoryTerm = context.memoryPressureLevel() * MEMORY_LEVEL_PROXIMITY_SCALE
        + memoryIssueWeight * MEMORY_ISSUE_PROXIMITY_SCALE;

    double speed = 1.0
        + fpsDeficit * FPS_SPEED_WEIGHT
        + scoreDeficit * SCORE_SPEED_WEIGHT
        + issueLoad * ISSUE_SPEED_SCALE;
    double proximity = 1.0
        + scoreDeficit * SCORE_PROXIMITY_WEIGHT
        + issueLoad * ISSUE_PROXIMITY_SCALE
        + memoryTerm;

    double stutterTolerance = options.stutterToleranceMs();
    if (stutterWeight > 0) {
      stutterTolerance = Math.max(stutterTolerance, STUTTER_BASE_TOLERANCE_MS + stutterWeight * STUTTER_MS_PER_WEIGHT);
    }

    return new PerformanceAdjustment(
        clamp(speed, 1.0, options.maxSpeedMultiplier()),
        clamp(proximity, 1.0, options.maxProximityMultiplier()),
        clamp(extension, 0.0, options.maxTimeWindowExtensionMs()),
        Math.min(stutterTolerance, options.stutterToleranceMs() + options.maxTimeWindowExtensionMs()));
  }

  /**
   * Share of an issue's severity weight that counts toward general tolerance. Memory pressure mostly disturbs
   * pickup timing and is boosted separately on the proximity side.
   */
  static double kindFactor(IssueKind kind) {
    return switch (kind) {
      case STUTTER -> 1.0;
      case LOW_FPS -> 0.75;
      case MEMORY_PRESSURE -> 0.5;
    };
  }

  private static double clamp(double value, double min, double max) {
    return Math.max(min, Math.min(max, value));
  }
}
