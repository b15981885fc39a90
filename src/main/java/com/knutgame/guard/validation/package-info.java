/**
 * <strong>Purpose:</strong> Validation helpers used while building configuration snapshots.
 * <p><strong>Pipeline role:</strong> Ensures anti-cheat options are sane before they are published to validators.
 * <p><strong>Concurrency:</strong> Stateless utilities safe for concurrent invocation.
 * <p><strong>Observability:</strong> No direct metrics or logging; failures surface via {@link IllegalArgumentException}.
 *
 * @since 0.1.0
 */
package com.knutgame.guard.validation;
