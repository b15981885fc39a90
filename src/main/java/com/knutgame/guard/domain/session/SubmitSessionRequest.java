package com.knutgame.guard.domain.session;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * <strong>What:</strong> Immutable end-of-session submission produced by the game client.
 * <p><strong>Why:</strong> Carries everything the anti-cheat engine needs to judge whether a score may be persisted.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to validate from several threads at once.</p>
 *
 * @param sessionId server-issued session identifier
 * @param canvasWidth client canvas width in pixels
 * @param canvasHeight client canvas height in pixels
 * @param startedAt client-reported session start
 * @param endedAt client-reported session end
 * @param events recorded event streams; {@code null} becomes {@link EventEnvelope#empty()}
 * @since 0.1.0
 */
public record SubmitSessionRequest(
    UUID sessionId,
    int canvasWidth,
    int canvasHeight,
    Instant startedAt,
    Instant endedAt,
    EventEnvelope events) {

  public SubmitSessionRequest {
    sessionId = Objects.requireNonNull(sessionId, "sessionId");
    startedAt = Objects.requireNonNull(startedAt, "startedAt");
    endedAt = Objects.requireNonNull(endedAt, "endedAt");
    events = events == null ? EventEnvelope.empty() : events;
  }

  /**
   * Client-reported wall-clock length of the session.
   *
   * @return duration between {@link #startedAt()} and {@link #endedAt()}; negative when the client clock ran backwards
   */
  public Duration duration() {
    return Duration.between(startedAt, endedAt);
  }
}
