/**
 * <strong>Purpose:</strong> Telemetry submitted by the game client when a session ends.
 * <p><strong>Pipeline role:</strong> Input to the integrity checks and the performance-aware validators.
 * <p><strong>Concurrency:</strong> Immutable records; lists are defensively copied.
 * <p><strong>Security:</strong> All values are client-controlled and untrusted until validated.
 *
 * @since 0.1.0
 */
package com.knutgame.guard.domain.session;
