package com.knutgame.guard.domain.verdict;

import java.util.Optional;

/**
 * <strong>What:</strong> Final decision about a submitted session.
 * <p><strong>Why:</strong> Carries a typed reason instead of throwing, so every outcome is a value the caller can map.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param valid whether the session may proceed to scoring
 * @param reason rejection reason; present exactly when {@code valid} is {@code false}
 * @param confidence aggregate trust score in {@code [0, 1]}
 * @param performanceAdjusted whether performance context relaxed any threshold
 * @param adjustmentDetails relaxations applied; present exactly when {@code performanceAdjusted} is {@code true}
 * @since 0.1.0
 */
public record ValidationResult(
    boolean valid,
    RejectionReason reason,
    double confidence,
    boolean performanceAdjusted,
    PerformanceAdjustment adjustmentDetails) {

  public ValidationResult {
    if (valid == (reason != null)) {
      throw new IllegalArgumentException(
          valid ? "valid result must not carry a reason" : "invalid result requires a reason");
    }
    if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
      throw new IllegalArgumentException("confidence must be within [0, 1] (was " + confidence + ")");
    }
    if (performanceAdjusted == (adjustmentDetails == null)) {
      throw new IllegalArgumentException(
          "adjustmentDetails must be present exactly when performanceAdjusted is true");
    }
  }

  /**
   * Builds an accepting result.
   *
   * @param confidence trust score in {@code [0, 1]}
   * @param adjustment adjustment applied; reported only when it deviates from neutral
   * @return valid result
   */
  public static ValidationResult accepted(double confidence, PerformanceAdjustment adjustment) {
    boolean adjusted = adjustment != null && adjustment.deviatesFromNeutral();
    return new ValidationResult(true, null, confidence, adjusted, adjusted ? adjustment : null);
  }

  /**
   * Builds a rejecting result.
   *
   * @param reason why the session is rejected; must not be {@code null}
   * @param confidence trust score in {@code [0, 1]}
   * @param adjustment adjustment applied; reported only when it deviates from neutral
   * @return invalid result
   */
  public static ValidationResult rejected(
      RejectionReason reason, double confidence, PerformanceAdjustment adjustment) {
    boolean adjusted = adjustment != null && adjustment.deviatesFromNeutral();
    return new ValidationResult(false, reason, confidence, adjusted, adjusted ? adjustment : null);
  }

  /**
   * Reason code as reported over the wire.
   *
   * @return code such as {@code LowConfidence}, or empty for accepted sessions
   */
  public Optional<String> reasonCode() {
    return reason == null ? Optional.empty() : Optional.of(reason.code());
  }
}
