package com.knutgame.guard.domain.session;

/**
 * Collectible item types dropped during a session.
 *
 * @since 0.1.0
 */
public enum ItemKind {
  /** Flat score bonus. */
  POINTS,
  /** Restores one life. */
  LIFE,
  /** Temporarily slows falling obstacles. */
  SLOWMO,
  /** Temporarily multiplies the score rate. */
  MULTI
}
