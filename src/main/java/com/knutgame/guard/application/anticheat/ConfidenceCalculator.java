package com.knutgame.guard.application.anticheat;

import com.knutgame.guard.domain.performance.PerformanceContext;
import java.util.Objects;

/**
 * <strong>What:</strong> Aggregate trust score for a performance report.
 * <p><strong>Why:</strong> A report degraded enough to explain almost any anomaly is also too degraded to trust;
 * the service rejects sessions whose confidence falls below the configured threshold even when every rule passed.</p>
 * <p><strong>Formula:</strong> {@code 0.5 * score/100 + 0.5 * min(1, fps/60)}, minus {@value #ISSUE_PENALTY_PER_WEIGHT}
 * per unit of issue severity weight and {@value #MEMORY_PENALTY_PER_LEVEL} per memory pressure level, clamped to
 * {@code [0, 1]}.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class ConfidenceCalculator {
  static final double SCORE_WEIGHT = 0.5;
  static final double FPS_WEIGHT = 0.5;
  static final double ISSUE_PENALTY_PER_WEIGHT = 0.02;
  static final double MEMORY_PENALTY_PER_LEVEL = 0.02;

  /**
   * Computes the confidence of {@code context}. Independent of whether performance adjustment is enabled.
   *
   * @param context performance report; must not be {@code null}
   * @return confidence in {@code [0, 1]}
   */
  public double calculate(PerformanceContext context) {
    Objects.requireNonNull(context, "context");
    double score = SCORE_WEIGHT * (context.performanceScore() / 100.0)
        + FPS_WEIGHT * Math.min(1.0, context.averageFps() / PerformanceContext.NOMINAL_FPS);
    double penalty = ISSUE_PENALTY_PER_WEIGHT * context.totalSeverityWeight()
        + MEMORY_PENALTY_PER_LEVEL * context.memoryPressureLevel();
    return Math.max(0.0, Math.min(1.0, score - penalty));
  }
}
