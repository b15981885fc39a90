package com.knutgame.guard.application.anticheat;

import com.knutgame.guard.config.AntiCheatOptions;
import com.knutgame.guard.config.GameConstants;
import com.knutgame.guard.domain.performance.Severity;
import com.knutgame.guard.domain.session.MoveEvent;
import com.knutgame.guard.domain.verdict.PerformanceAdjustment;
import com.knutgame.guard.domain.verdict.RejectionReason;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Rejects consecutive move pairs whose lateral speed is implausible.
 * <p><strong>Why:</strong> Input can never move the player faster than the game allows, however bad the frame rate.</p>
 * <p><strong>Rules:</strong>
 * <ul>
 *   <li>Allowed speed is {@code nominalMaxSpeed * baseSpeedTolerance * speedToleranceMultiplier}.</li>
 *   <li>Pairs overlapping a {@link StutterWindow} get a severity-dependent bonus.</li>
 *   <li>No pair may exceed {@code baseline * maxSpeedMultiplier * }{@value #ANTI_TELEPORT_FACTOR}, stutter or not.</li>
 * </ul>
 * <p><strong>Reasons:</strong> {@link RejectionReason#SPEED_EXCEEDED_DESPITE_STUTTER} only for a stutter-overlapping
 * pair above that ceiling. A pair above its stutter bonus but below the ceiling is reported like any other pair:
 * {@link RejectionReason#DYNAMIC_SPEED_EXCEEDED} when adjusted, {@link RejectionReason#SPEED_EXCEEDED} otherwise.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @since 0.1.0
 */
public final class SpeedValidator {
  /** Factor over the largest adjusted limit that bounds any stutter bonus. */
  static final double ANTI_TELEPORT_FACTOR = 1.5;
  static final double STUTTER_BONUS_PER_WEIGHT = 0.5;

  private final double nominalMaxSpeed;

  /** Creates a validator for the game's configured lateral speed. */
  public SpeedValidator() {
    this(GameConstants.MOVE_SPEED);
  }

  /**
   * Creates a validator for a custom lateral speed.
   *
   * @param nominalMaxSpeed maximum player speed in pixels per second; must be positive
   */
  public SpeedValidator(double nominalMaxSpeed) {
    if (!(nominalMaxSpeed > 0)) {
      throw new IllegalArgumentException("nominalMaxSpeed must be positive (was " + nominalMaxSpeed + ")");
    }
    this.nominalMaxSpeed = nominalMaxSpeed;
  }

  /**
   * Checks every consecutive pair of {@code timeline}, stopping at the first offending pair.
   *
   * @param timeline chronologically sorted moves; must not be {@code null}
   * @param adjustment relaxations for this session; must not be {@code null}
   * @param stutterWindows windows eligible for the stutter bonus; must not be {@code null}
   * @param options thresholds; must not be {@code null}
   * @return passing verdict, or the reason of the first offending pair
   */
  public RuleVerdict validate(
      MoveTimeline timeline,
      PerformanceAdjustment adjustment,
      List<StutterWindow> stutterWindows,
      AntiCheatOptions options) {
    Objects.requireNonNull(timeline, "timeline");
    Objects.requireNonNull(adjustment, "adjustment");
    Objects.requireNonNull(stutterWindows, "stutterWindows");
    Objects.requireNonNull(options, "options");

    List<MoveEvent> moves = timeline.moves();
    if (moves.size() < 2) {
      return RuleVerdict.pass();
    }
    double baseline = baselineSpeed(options);
    double allowed = baseline * adjustment.speedToleranceMultiplier();
    double ceiling = hardCeiling(options);

    for (int i = 1; i < moves.size(); i++) {
      MoveEvent previous = moves.get(i - 1);
      MoveEvent current = moves.get(i);
      long dtMs = Math.max(1L, (long) current.timestampMs() - previous.timestampMs());
      double speed = Math.abs(current.x() - previous.x()) / (dtMs / 1000.0);
      if (speed <= allowed) {
        continue;
      }
      Severity stutter = strongestOverlap(stutterWindows, previous.timestampMs(), current.timestampMs());
      if (stutter != null) {
        double lenient = Math.min(allowed * (1.0 + STUTTER_BONUS_PER_WEIGHT * stutter.weight()), ceiling);
        if (speed <= lenient) {
          continue;
        }
        if (!(speed <= ceiling)) {
          return RuleVerdict.fail(RejectionReason.SPEED_EXCEEDED_DESPITE_STUTTER);
        }
      }
      return RuleVerdict.fail(adjustment.deviatesFromNeutral()
          ? RejectionReason.DYNAMIC_SPEED_EXCEEDED
          : RejectionReason.SPEED_EXCEEDED);
    }
    return RuleVerdict.pass();
  }

  /**
   * Speed tolerated without any performance context.
   *
   * @param options thresholds
   * @return pixels per second
   */
  public double baselineSpeed(AntiCheatOptions options) {
    return nominalMaxSpeed * options.baseSpeedTolerance();
  }

  /**
   * Absolute speed ceiling that no performance report can lift.
   *
   * @param options thresholds
   * @return pixels per second
   */
  public double hardCeiling(AntiCheatOptions options) {
    return baselineSpeed(options) * options.maxSpeedMultiplier() * ANTI_TELEPORT_FACTOR;
  }

  private static Severity strongestOverlap(List<StutterWindow> windows, long fromMs, long toMs) {
    Severity strongest = null;
    for (StutterWindow window : windows) {
      if (window.overlaps(fromMs, toMs)
          && (strongest == null || window.severity().weight() > strongest.weight())) {
        strongest = window.severity();
      }
    }
    return strongest;
  }
}
