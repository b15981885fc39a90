/**
 * <strong>Purpose:</strong> OpenTelemetry-backed implementation of {@link com.knutgame.guard.application.port.MetricsPort}.
 * <p><strong>Pipeline role:</strong> Infrastructure adapter exporting verdict counters and validation latency.
 * <p><strong>Concurrency:</strong> Instruments are cached in concurrent maps; safe for request threads.
 * <p><strong>Observability:</strong> Exporter chosen by {@code metrics.exporter} or {@code OTEL_METRICS_EXPORTER};
 * {@code none} disables export.
 *
 * @since 0.1.0
 */
package com.knutgame.guard.infrastructure.metrics;
