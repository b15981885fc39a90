package com.knutgame.guard.application.port;

/**
 * <strong>What:</strong> Port abstracting anti-cheat metrics emission.
 * <p><strong>Why:</strong> Lets the validation service count verdicts and time evaluations without binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Implemented by adapters such as {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent updates from request threads.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code anticheat.session.rejected.SpeedExceeded}).</p>
 *
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier; must not be {@code null}
   */
  void increment(String key);

  /**
   * Records one sample for a histogram-style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value, e.g. nanoseconds
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
