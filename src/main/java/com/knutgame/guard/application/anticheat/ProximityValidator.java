package com.knutgame.guard.application.anticheat;

import com.knutgame.guard.config.AntiCheatOptions;
import com.knutgame.guard.domain.performance.PerformanceIssue;
import com.knutgame.guard.domain.session.ItemEvent;
import com.knutgame.guard.domain.verdict.PerformanceAdjustment;
import com.knutgame.guard.domain.verdict.RejectionReason;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Rejects item pickups reported too far from where the player was at pickup time.
 *
 * <p>Pickups happen on a single lane, so only the lateral distance between the item and the interpolated player
 * position counts; {@code y} is checked by {@link SessionIntegrityChecker} instead. Pickups close to any reported
 * performance issue get a severity-dependent bonus, bounded by a hard ceiling of
 * {@code baseProximityTolerancePx * maxProximityMultiplier * }{@value #HARD_CEILING_FACTOR}.</p>
 *
 * @since 0.1.0
 */
public final class ProximityValidator {
  static final double NEAR_ISSUE_BONUS_PER_WEIGHT = 0.25;
  static final double HARD_CEILING_FACTOR = 1.5;

  /**
   * Checks pickups in submission order, stopping at the first offending one.
   *
   * @param timeline sorted moves used for interpolation; must not be {@code null}
   * @param items reported pickups; must not be {@code null}
   * @param adjustment relaxations for this session; must not be {@code null}
   * @param issues performance issues eligible for the near-issue bonus; must not be {@code null}
   * @param options thresholds; must not be {@code null}
   * @return passing verdict, or the reason of the first offending pickup
   */
  public RuleVerdict validate(
      MoveTimeline timeline,
      List<ItemEvent> items,
      PerformanceAdjustment adjustment,
      List<PerformanceIssue> issues,
      AntiCheatOptions options) {
    Objects.requireNonNull(timeline, "timeline");
    Objects.requireNonNull(items, "items");
    Objects.requireNonNull(adjustment, "adjustment");
    Objects.requireNonNull(issues, "issues");
    Objects.requireNonNull(options, "options");

    boolean adjusted = adjustment.deviatesFromNeutral();
    double allowed = options.baseProximityTolerancePx() * adjustment.proximityToleranceMultiplier();
    double ceiling = hardCeiling(options);
    for (ItemEvent item : items) {
      OptionalDouble expectedX = timeline.expectedXAt(item.timestampMs());
      if (expectedX.isEmpty()) {
        // nothing to compare against
        continue;
      }
      double distance = Math.abs(item.x() - expectedX.getAsDouble());
      double limit = allowed;
      if (adjusted) {
        int nearbyWeight = strongestNearbyWeight(issues, item.timestampMs(), adjustment.timeWindowExtensionMs());
        limit = Math.min(allowed * (1.0 + NEAR_ISSUE_BONUS_PER_WEIGHT * nearbyWeight), ceiling);
      }
      if (!(distance <= limit)) {
        return RuleVerdict.fail(adjusted
            ? RejectionReason.DYNAMIC_PROXIMITY_EXCEEDED
            : RejectionReason.PROXIMITY_EXCEEDED);
      }
    }
    return RuleVerdict.pass();
  }

  /**
   * Pickup distance that no performance report can lift.
   *
   * @param options thresholds
   * @return pixels
   */
  public double hardCeiling(AntiCheatOptions options) {
    return options.baseProximityTolerancePx() * options.maxProximityMultiplier() * HARD_CEILING_FACTOR;
  }

  private static int strongestNearbyWeight(List<PerformanceIssue> issues, long timestampMs, double extensionMs) {
    int strongest = 0;
    for (PerformanceIssue issue : issues) {
      if (issue.covers(timestampMs, extensionMs)) {
        strongest = Math.max(strongest, issue.severity().weight());
      }
    }
    return strongest;
  }
}
