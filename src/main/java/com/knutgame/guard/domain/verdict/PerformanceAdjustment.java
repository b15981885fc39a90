package com.knutgame.guard.domain.verdict;

/**
 * <strong>What:</strong> Threshold relaxations derived from one performance report.
 * <p><strong>Role:</strong> Ephemeral value computed once per validation and shared by the speed and proximity checks.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param speedToleranceMultiplier factor applied to the allowed lateral speed; at least {@code 1.0}
 * @param proximityToleranceMultiplier factor applied to the allowed pickup distance; at least {@code 1.0}
 * @param timeWindowExtensionMs milliseconds by which issue windows are widened; non-negative
 * @param stutterToleranceMs minimum length of a stutter window in milliseconds; non-negative
 * @since 0.1.0
 */
public record PerformanceAdjustment(
    double speedToleranceMultiplier,
    double proximityToleranceMultiplier,
    double timeWindowExtensionMs,
    double stutterToleranceMs) {

  private static final PerformanceAdjustment NEUTRAL = new PerformanceAdjustment(1.0, 1.0, 0.0, 0.0);

  public PerformanceAdjustment {
    if (!(speedToleranceMultiplier >= 1.0)) {
      throw new IllegalArgumentException(
          "speedToleranceMultiplier must be at least 1.0 (was " + speedToleranceMultiplier + ")");
    }
    if (!(proximityToleranceMultiplier >= 1.0)) {
      throw new IllegalArgumentException(
          "proximityToleranceMultiplier must be at least 1.0 (was " + proximityToleranceMultiplier + ")");
    }
    if (!(timeWindowExtensionMs >= 0)) {
      throw new IllegalArgumentException(
          "timeWindowExtensionMs must be non-negative (was " + timeWindowExtensionMs + ")");
    }
    if (!(stutterToleranceMs >= 0)) {
      throw new IllegalArgumentException(
          "stutterToleranceMs must be non-negative (was " + stutterToleranceMs + ")");
    }
  }

  /**
   * Adjustment that leaves every threshold untouched.
   *
   * @return {@code {1.0, 1.0, 0, 0}}
   */
  public static PerformanceAdjustment neutral() {
    return NEUTRAL;
  }

  /**
   * Returns whether a multiplier or the time-window extension relaxes any threshold.
   * The stutter tolerance alone does not count.
   *
   * @return {@code true} when the adjustment changes validation behaviour
   */
  public boolean deviatesFromNeutral() {
    return speedToleranceMultiplier > 1.0
        || proximityToleranceMultiplier > 1.0
        || timeWindowExtensionMs > 0.0;
  }
}
