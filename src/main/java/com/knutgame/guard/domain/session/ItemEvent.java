package com.knutgame.guard.domain.session;

import java.util.Objects;

/**
 * Item pickup reported by the client.
 *
 * @param timestampMs milliseconds since session start
 * @param itemId client-assigned identifier, unique within a session
 * @param kind item type
 * @param x horizontal pickup position in canvas pixels
 * @param y vertical pickup position in canvas pixels
 * @since 0.1.0
 */
public record ItemEvent(int timestampMs, String itemId, ItemKind kind, double x, double y) {

  public ItemEvent {
    itemId = Objects.requireNonNull(itemId, "itemId");
    kind = Objects.requireNonNull(kind, "kind");
  }
}
