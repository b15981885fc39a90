package com.knutgame.guard.application.anticheat;

import com.knutgame.guard.config.GameConstants;
import com.knutgame.guard.domain.session.EventEnvelope;
import com.knutgame.guard.domain.session.ItemEvent;
import com.knutgame.guard.domain.session.MoveEvent;
import com.knutgame.guard.domain.session.SubmitSessionRequest;
import java.util.HashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> Structural checks on a submission: duration, size limits, duplicate pickups, canvas bounds,
 * and the pickup lane.
 * <p><strong>Why:</strong> Catches malformed or padded submissions cheaply, independent of any performance report.</p>
 * <p><strong>Role:</strong> Runs before {@link PerformanceAwareAntiCheatService}; its violations use their own codes
 * and never mix with {@link com.knutgame.guard.domain.verdict.RejectionReason}.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class SessionIntegrityChecker {
  static final long MIN_DURATION_MS = 1_000L;
  static final long MAX_DURATION_MS = 60L * 60L * 1_000L;
  static final long DURATION_SLACK_MS = 500L;
  static final int MAX_MOVES = 50_000;
  static final int MAX_ITEMS = 500;

  /**
   * Checks {@code request}, stopping at the first violation in declaration order of {@link IntegrityViolation}.
   * Event order is irrelevant; unsorted streams are accepted.
   *
   * @param request submission to check; must not be {@code null}
   * @return the first violation found, or empty when the submission is well formed
   */
  public Optional<IntegrityViolation> check(SubmitSessionRequest request) {
    Objects.requireNonNull(request, "request");
    EventEnvelope events = request.events();
    long durationMs = request.duration().toMillis();
    if (durationMs < MIN_DURATION_MS) {
      return Optional.of(IntegrityViolation.DURATION_TOO_SHORT);
    }
    if (durationMs > MAX_DURATION_MS) {
      return Optional.of(IntegrityViolation.DURATION_TOO_LONG);
    }
    if (events.moves().size() > MAX_MOVES) {
      return Optional.of(IntegrityViolation.TOO_MANY_MOVES);
    }
    if (events.items().size() > MAX_ITEMS) {
      return Optional.of(IntegrityViolation.TOO_MANY_ITEMS);
    }
    Set<String> seen = new HashSet<>();
    for (ItemEvent item : events.items()) {
      if (!seen.add(item.itemId())) {
        return Optional.of(IntegrityViolation.DUPLICATE_ITEM);
      }
    }
    int lastEventMs = events.lastTimestampMs();
    if (lastEventMs > 0 && Math.abs(lastEventMs - durationMs) > DURATION_SLACK_MS) {
      return Optional.of(IntegrityViolation.DURATION_MISMATCH);
    }
    for (MoveEvent move : events.moves()) {
      if (!within(move.x(), request.canvasWidth())) {
        return Optional.of(IntegrityViolation.OUT_OF_BOUNDS);
      }
    }
    for (ItemEvent item : events.items()) {
      if (!within(item.x(), request.canvasWidth()) || !within(item.y(), request.canvasHeight())) {
        return Optional.of(IntegrityViolation.OUT_OF_BOUNDS);
      }
    }
    double lane = request.canvasHeight() * GameConstants.PLAYER_LANE_FRACTION;
    for (ItemEvent item : events.items()) {
      if (Math.abs(item.y() - lane) > GameConstants.PLAYER_LANE_HALF_HEIGHT_PX) {
        return Optional.of(IntegrityViolation.ITEM_PICKUP_WRONG_LANE);
      }
    }
    return Optional.empty();
  }

  /** NaN and infinities are never inside the canvas. */
  private static boolean within(double coordinate, int extent) {
    return coordinate >= 0 && coordinate <= extent;
  }
}
