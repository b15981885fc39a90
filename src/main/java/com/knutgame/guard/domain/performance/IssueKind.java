package com.knutgame.guard.domain.performance;

/**
 * Closed set of client-side degradations the performance monitor reports.
 *
 * @since 0.1.0
 */
public enum IssueKind {
  /** Short frame-time spike. */
  STUTTER,
  /** Sustained frame rate below the playable threshold. */
  LOW_FPS,
  /** Garbage collection or allocation pressure on the client. */
  MEMORY_PRESSURE
}
