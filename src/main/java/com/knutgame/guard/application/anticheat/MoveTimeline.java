package com.knutgame.guard.application.anticheat;

import com.knutgame.guard.domain.session.MoveEvent;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Chronologically ordered view of a session's move stream with linear position interpolation.
 *
 * <p>Clients do not guarantee ordering, so the stream is copied and stably sorted by timestamp once per validation.
 * Moves sharing a timestamp keep their submission order.</p>
 *
 * @since 0.1.0
 */
public final class MoveTimeline {
  private final List<MoveEvent> moves;

  private MoveTimeline(List<MoveEvent> moves) {
    this.moves = moves;
  }

  /**
   * Sorts {@code moves} into a timeline. The argument is not modified.
   *
   * @param moves submitted moves in any order; must not be {@code null}
   * @return timeline over a sorted copy
   */
  public static MoveTimeline of(List<MoveEvent> moves) {
    Objects.requireNonNull(moves, "moves");
    List<MoveEvent> sorted = new ArrayList<>(moves);
    sorted.sort(MoveEvent.BY_TIME);
    return new MoveTimeline(List.copyOf(sorted));
  }

  /**
   * Sorted moves.
   *
   * @return immutable list ordered by timestamp
   */
  public List<MoveEvent> moves() {
    return moves;
  }

  public int size() {
    return moves.size();
  }

  /**
   * Expected player x at {@code timestampMs}, interpolated between the last move at or before that instant and the
   * first move after it. When only one side exists its position is used as is.
   *
   * @param timestampMs instant in milliseconds since session start
   * @return expected x, or empty when the timeline has no moves
   */
  public OptionalDouble expectedXAt(long timestampMs) {
    if (moves.isEmpty()) {
      return OptionalDouble.empty();
    }
    int before = lastIndexAtOrBefore(timestampMs);
    if (before < 0) {
      return OptionalDouble.of(moves.get(0).x());
    }
    MoveEvent previous = moves.get(before);
    if (previous.timestampMs() == timestampMs || before == moves.size() - 1) {
      return OptionalDouble.of(previous.x());
    }
    // next.timestampMs() > timestampMs >= previous.timestampMs(), so the span is positive
    MoveEvent next = moves.get(before + 1);
    double ratio = (timestampMs - previous.timestampMs()) / (double) (next.timestampMs() - previous.timestampMs());
    return OptionalDouble.of(previous.x() + ratio * (next.x() - previous.x()));
  }

  private int lastIndexAtOrBefore(long timestampMs) {
    int low = 0;
    int high = moves.size() - 1;
    int found = -1;
    while (low <= high) {
      int mid = (low + high) >>> 1;
      if (moves.get(mid).timestampMs() <= timestampMs) {
        found = mid;
        low = mid + 1;
      } else {
        high = mid - 1;
      }
    }
    return found;
  }
}
