/**
 * <strong>Purpose:</strong> Performance-aware validation engine deciding whether a submitted session is plausible.
 * <p><strong>Pipeline role:</strong> Application layer. The service computes one
 * {@link com.knutgame.guard.domain.verdict.PerformanceAdjustment}, runs the speed and proximity validators,
 * then applies the confidence gate.
 * <p><strong>Concurrency:</strong> Validators and calculators are stateless; the service reads an atomically swapped
 * options snapshot and needs no locks.
 * <p><strong>Performance:</strong> Linear in event count after one sort of the move stream.
 * <p><strong>Observability:</strong> Verdict counters and latency histograms via
 * {@link com.knutgame.guard.application.port.MetricsPort}; rejections logged at DEBUG with {@code sessionId} in MDC.
 * <p><strong>Security:</strong> Anti-teleport and proximity ceilings hold under every performance report.
 *
 * @since 0.1.0
 */
package com.knutgame.guard.application.anticheat;
