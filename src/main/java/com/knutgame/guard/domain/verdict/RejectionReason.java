package com.knutgame.guard.domain.verdict;

/**
 * Closed set of reasons a session can be rejected for.
 *
 * @since 0.1.0
 */
public enum RejectionReason {
  /** Move pair faster than the baseline limit with no performance context applied. */
  SPEED_EXCEEDED("SpeedExceeded"),
  /** Move pair faster than the performance-adjusted limit. */
  DYNAMIC_SPEED_EXCEEDED("DynamicSpeedExceeded"),
  /** Move pair overlapping a stutter but faster than the anti-teleport ceiling. */
  SPEED_EXCEEDED_DESPITE_STUTTER("SpeedExceededDespiteStutter"),
  /** Pickup too far from the player with no performance context applied. */
  PROXIMITY_EXCEEDED("ProximityExceeded"),
  /** Pickup too far from the player even after performance adjustment. */
  DYNAMIC_PROXIMITY_EXCEEDED("DynamicProximityExceeded"),
  /** Rules passed but the performance report is too degraded to trust. */
  LOW_CONFIDENCE("LowConfidence");

  private final String code;

  RejectionReason(String code) {
    this.code = code;
  }

  /**
   * Stable identifier reported to clients and used in metric names.
   *
   * @return reason code such as {@code SpeedExceeded}
   */
  public String code() {
    return code;
  }

  @Override
  public String toString() {
    return code;
  }
}
