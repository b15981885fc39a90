package com.knutgame.guard.domain.session;

import java.util.List;

/**
 * Event streams recorded during one session. Each stream keeps the order the client sent it in,
 * which is not guaranteed to be chronological.
 *
 * @param moves lateral movement samples; {@code null} becomes empty
 * @param hits obstacle collisions; {@code null} becomes empty
 * @param items item pickups; {@code null} becomes empty
 * @since 0.1.0
 */
public record EventEnvelope(List<MoveEvent> moves, List<HitEvent> hits, List<ItemEvent> items) {

  public EventEnvelope {
    moves = moves == null ? List.of() : List.copyOf(moves);
    hits = hits == null ? List.of() : List.copyOf(hits);
    items = items == null ? List.of() : List.copyOf(items);
  }

  /**
   * Returns an envelope without any events.
   *
   * @return empty envelope
   */
  public static EventEnvelope empty() {
    return new EventEnvelope(List.of(), List.of(), List.of());
  }

  /**
   * Latest timestamp across all three streams.
   *
   * @return last event time in milliseconds, or {@code -1} when the envelope is empty
   */
  public int lastTimestampMs() {
    int last = -1;
    for (MoveEvent move : moves) {
      last = Math.max(last, move.timestampMs());
    }
    for (HitEvent hit : hits) {
      last = Math.max(last, hit.timestampMs());
    }
    for (ItemEvent item : items) {
      last = Math.max(last, item.timestampMs());
    }
    return last;
  }
}
