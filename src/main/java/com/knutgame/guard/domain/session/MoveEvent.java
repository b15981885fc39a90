package com.knutgame.guard.domain.session;

import java.util.Comparator;

/**
 * Lateral player position sampled by the client.
 *
 * @param timestampMs milliseconds since session start
 * @param x horizontal position in canvas pixels
 * @since 0.1.0
 */
public record MoveEvent(int timestampMs, double x) {

  /** Orders moves by ascending timestamp. */
  public static final Comparator<MoveEvent> BY_TIME = Comparator.comparingInt(MoveEvent::timestampMs);
}
