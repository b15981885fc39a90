package com.knutgame.guard.config;

/**
 * Gameplay constants shared with the client build. Values must match the client's configuration.
 *
 * @since 0.1.0
 */
public final class GameConstants {
  /** Maximum lateral player speed in pixels per second. */
  public static final double MOVE_SPEED = 200.0;

  /** Vertical offset of the player lane as a fraction of canvas height. */
  public static final double PLAYER_LANE_FRACTION = 0.9;

  /** Half-height of the pickup band around the player lane, in pixels. */
  public static final double PLAYER_LANE_HALF_HEIGHT_PX = 64.0;

  private GameConstants() {}
}
