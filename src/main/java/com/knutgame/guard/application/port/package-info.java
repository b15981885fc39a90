/**
 * <strong>Purpose:</strong> Ports exposed to the session-submission endpoint and required from observability adapters.
 * <p><strong>Pipeline role:</strong> Application boundary; adapters implement {@link com.knutgame.guard.application.port.MetricsPort},
 * callers consume {@link com.knutgame.guard.application.port.SmartAntiCheat}.
 * <p><strong>Concurrency:</strong> Implementations must be thread-safe.
 * <p><strong>Security:</strong> Ports assume requests have not been trusted yet.
 *
 * @since 0.1.0
 */
package com.knutgame.guard.application.port;
