/**
 * Core domain model for submitted game sessions and the verdicts reached about them.
 * <p><strong>Role:</strong> Domain layer; immutable telemetry, performance reports, and validation outcomes without
 * infrastructure dependencies.</p>
 * <p><strong>Concurrency:</strong> Types are immutable records or enums; safe to share across threads.</p>
 * <p><strong>Metrics:</strong> Rejection reason codes feed tagging on {@code anticheat.session.rejected.*} counters.</p>
 */
package com.knutgame.guard.domain;
