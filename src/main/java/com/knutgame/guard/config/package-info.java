/**
 * <strong>Purpose:</strong> Anti-cheat configuration records, YAML loading, and the composition root.
 * <p><strong>Pipeline role:</strong> Translates operator settings into immutable option snapshots and wired services.
 * <p><strong>Concurrency:</strong> Records are immutable; loaders are stateless.
 * <p><strong>Security:</strong> Out-of-range tolerances are rejected before they can weaken validation.
 *
 * @since 0.1.0
 */
package com.knutgame.guard.config;
