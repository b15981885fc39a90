/**
 * <strong>Purpose:</strong> Client performance reports summarised by the upstream performance monitor.
 * <p><strong>Pipeline role:</strong> Read-only input that relaxes validation thresholds for degraded clients.
 * <p><strong>Concurrency:</strong> Immutable records and enums.
 *
 * @since 0.1.0
 */
package com.knutgame.guard.domain.performance;
